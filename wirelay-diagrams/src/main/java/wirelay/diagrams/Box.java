package wirelay.diagrams;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

import java.util.function.Function;

@Value.Immutable
@Tuple
public abstract class Box<V, P> extends AbstractBox<V, P> {
  public static <V, P> Box<V, P> of(V value, Iterable<? extends P> inputPorts, Iterable<? extends P> outputPorts) {
    return ImmutableBox.of(value, inputPorts, outputPorts);
  }

  @Override
  public abstract V value();

  @Override
  public abstract ImmutableList<P> inputPorts();

  @Override
  public abstract ImmutableList<P> outputPorts();

  public abstract Box<V, P> withValue(V value);

  @Override
  public <R> R visit(Function<? super Box<V, P>, R> onBox, Function<? super WiringDiagram<V, P>, R> onDiagram) {
    return onBox.apply(this);
  }
}
