package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

/**
 * The symmetry {@code first ⊗ second → second ⊗ first}.
 */
@Value.Immutable
@Tuple
public abstract class Braid<O, G> extends HomExpr<O, G> {
  public abstract ImmutableList<O> first();

  public abstract ImmutableList<O> second();

  @Override
  public ImmutableList<O> dom() {
    return ImmutableList.<O>builder().addAll(first()).addAll(second()).build();
  }

  @Override
  public ImmutableList<O> codom() {
    return ImmutableList.<O>builder().addAll(second()).addAll(first()).build();
  }

  @Override
  public <R> R visit(Visitor<O, G, R> visitor) {
    return visitor.braid(this);
  }
}
