package wirelay.util.geometry;

/**
 * A value with a position that can be moved without changing anything else about it.
 */
public interface Translatable<T extends Translatable<T>> {
  default T translate(Vector2D offset) {
    return translate(offset.x(), offset.y());
  }

  T translate(double dx, double dy);
}
