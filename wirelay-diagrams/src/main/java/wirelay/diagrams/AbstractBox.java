package wirelay.diagrams;

import java.util.List;
import java.util.function.Function;

/**
 * A node of a {@link WiringDiagram}: either an atomic {@link Box} or a nested {@link WiringDiagram}. Both carry a
 * value {@link V} and ordered input and output ports with values {@link P}.
 */
public abstract class AbstractBox<V, P> {
  AbstractBox() {
  }

  public abstract V value();

  public abstract List<P> inputPorts();

  public abstract List<P> outputPorts();

  public abstract <R> R visit(Function<? super Box<V, P>, R> onBox, Function<? super WiringDiagram<V, P>, R> onDiagram);

  public boolean isDiagram() {
    return visit(box -> false, diagram -> true);
  }
}
