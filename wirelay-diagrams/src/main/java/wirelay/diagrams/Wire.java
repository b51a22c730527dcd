package wirelay.diagrams;

import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

/**
 * A directed connection between two {@link Port ports}. Wires carry no geometry: routing is left to renderers.
 */
@Value.Immutable
@Tuple
public interface Wire {
  static Wire of(Port source, Port target) {
    return ImmutableWire.of(source, target);
  }

  static Wire of(int sourceBox, int sourceIndex, int targetBox, int targetIndex) {
    return of(Port.of(sourceBox, sourceIndex), Port.of(targetBox, targetIndex));
  }

  Port source();

  Port target();

  default boolean touches(int box) {
    return source().box() == box || target().box() == box;
  }
}
