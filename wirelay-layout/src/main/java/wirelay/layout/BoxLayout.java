package wirelay.layout;

import org.immutables.value.Value;
import wirelay.util.geometry.Translatable;
import wirelay.util.geometry.Vector2D;

import java.util.Optional;

/**
 * Geometry of one box: its center {@link #position} in the coordinate frame of the diagram immediately containing
 * it, and the {@link #size} of its bounding rectangle. The {@link #value} is the box's payload (a generator), absent
 * for diagrams that exist only as containers.
 */
@Value.Immutable
public interface BoxLayout<V> extends Translatable<BoxLayout<V>> {
  static <V> BoxLayout<V> of(Optional<? extends V> value, Vector2D position, Vector2D size) {
    return ImmutableBoxLayout.<V>builder()
            .value(value)
            .position(position)
            .size(size)
            .build();
  }

  static <V> BoxLayout<V> of(V value, Vector2D size) {
    return of(Optional.of(value), Vector2D.ZERO, size);
  }

  static <V> BoxLayout<V> container() {
    return container(Vector2D.ZERO);
  }

  static <V> BoxLayout<V> container(Vector2D size) {
    return of(Optional.empty(), Vector2D.ZERO, size);
  }

  Optional<V> value();

  Vector2D position();

  Vector2D size();

  BoxLayout<V> withPosition(Vector2D position);

  BoxLayout<V> withSize(Vector2D size);

  default Vector2D lowerCorner() {
    return position().minus(size().dividedBy(2));
  }

  default Vector2D upperCorner() {
    return position().plus(size().dividedBy(2));
  }

  @Override
  default BoxLayout<V> translate(double dx, double dy) {
    return dx == 0 && dy == 0 ? this : withPosition(position().translate(dx, dy));
  }

  @Value.Check
  default void checkSize() {
    assert size().x() >= 0 && size().y() >= 0 : "Box size cannot be negative: " + this;
  }
}
