package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

import static com.google.common.base.Preconditions.checkState;

/**
 * Sequential composition {@code f ; g ; ...}, kept in associative normal form: no argument is itself a
 * {@link Composition}.
 */
@Value.Immutable
@Tuple
public abstract class Composition<O, G> extends HomExpr<O, G> {
  public abstract ImmutableList<HomExpr<O, G>> args();

  @Override
  public ImmutableList<O> dom() {
    return args().get(0).dom();
  }

  @Override
  public ImmutableList<O> codom() {
    return Iterables.getLast(args()).codom();
  }

  @Override
  public <R> R visit(Visitor<O, G, R> visitor) {
    return visitor.compose(this);
  }

  @Value.Check
  protected void checkArity() {
    checkState(args().size() >= 2, "Composition requires at least two arguments: %s", args());
  }
}
