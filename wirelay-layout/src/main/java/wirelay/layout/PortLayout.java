package wirelay.layout;

import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;
import wirelay.util.geometry.Vector2D;

/**
 * Geometry of one port: its anchor {@link #position} relative to the center of the box that owns it, and the
 * outward unit {@link #normal} of the box edge it sits on.
 */
@Value.Immutable
@Tuple
public interface PortLayout<V> {
  static <V> PortLayout<V> of(V value, Vector2D position, Vector2D normal) {
    return ImmutablePortLayout.of(value, position, normal);
  }

  V value();

  Vector2D position();

  Vector2D normal();
}
