package wirelay.diagrams;

import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

/**
 * An endpoint of a {@link Wire}: the {@link #index}-th port of box {@link #box}.
 * <p/>
 * As a wire source, a port refers to an output port of a box, or to an input port of the enclosing diagram when
 * {@code box} is {@link WiringDiagram#INPUT_ID}. As a wire target, it refers to an input port of a box, or to an
 * output port of the enclosing diagram when {@code box} is {@link WiringDiagram#OUTPUT_ID}.
 */
@Value.Immutable
@Tuple
public interface Port {
  static Port of(int box, int index) {
    return ImmutablePort.of(box, index);
  }

  int box();

  int index();

  @Value.Check
  default void checkIndex() {
    assert index() >= 0 : "Negative port index: " + this;
  }
}
