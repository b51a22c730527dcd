package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkState;

/**
 * Monoidal (parallel) product {@code f ⊗ g ⊗ ...}, kept in associative normal form: no argument is itself a
 * {@link Tensor}.
 */
@Value.Immutable
@Tuple
public abstract class Tensor<O, G> extends HomExpr<O, G> {
  public abstract ImmutableList<HomExpr<O, G>> args();

  @Override
  public ImmutableList<O> dom() {
    return concat(HomExpr::dom);
  }

  @Override
  public ImmutableList<O> codom() {
    return concat(HomExpr::codom);
  }

  @Override
  public <R> R visit(Visitor<O, G, R> visitor) {
    return visitor.otimes(this);
  }

  private ImmutableList<O> concat(Function<HomExpr<O, G>, ImmutableList<O>> objects) {
    ImmutableList.Builder<O> builder = ImmutableList.builder();
    args().forEach(arg -> builder.addAll(objects.apply(arg)));
    return builder.build();
  }

  @Value.Check
  protected void checkArity() {
    checkState(args().size() >= 2, "Tensor requires at least two arguments: %s", args());
  }
}
