package wirelay.util.geometry;

import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

/**
 * An immutable pair of real coordinates, used both for points (box centers, port anchors) and for extents (box
 * sizes). Arithmetic is element-wise unless noted otherwise.
 */
@Value.Immutable
@Tuple
public interface Vector2D extends Translatable<Vector2D> {
  Vector2D ZERO = Vector2D.of(0, 0);

  static Vector2D of(double x, double y) {
    return ImmutableVector2D.of(x, y);
  }

  double x();
  double y();

  default Vector2D plus(Vector2D other) {
    return translate(other.x(), other.y());
  }

  default Vector2D minus(Vector2D other) {
    return translate(-other.x(), -other.y());
  }

  default Vector2D negate() {
    return of(-x(), -y());
  }

  default Vector2D times(double scalar) {
    return of(x() * scalar, y() * scalar);
  }

  default Vector2D times(Vector2D other) {
    return of(x() * other.x(), y() * other.y());
  }

  default Vector2D dividedBy(double scalar) {
    return of(x() / scalar, y() / scalar);
  }

  /**
   * @return (max(x, other.x), max(y, other.y))
   */
  default Vector2D max(Vector2D other) {
    if (other.x() >= x() && other.y() >= y()) return other;
    if (x() >= other.x() && y() >= other.y()) return this;
    return of(Math.max(x(), other.x()), Math.max(y(), other.y()));
  }

  /**
   * @return (min(x, other.x), min(y, other.y))
   */
  default Vector2D min(Vector2D other) {
    if (other.x() <= x() && other.y() <= y()) return other;
    if (x() <= other.x() && y() <= other.y()) return this;
    return of(Math.min(x(), other.x()), Math.min(y(), other.y()));
  }

  @Override
  default Vector2D translate(double dx, double dy) {
    return dx == 0 && dy == 0 ? this : of(x() + dx, y() + dy);
  }

  @Value.Check
  default void checkFinite() {
    assert Double.isFinite(x()) && Double.isFinite(y()) : "Vector components must be finite: " + this;
  }
}
