package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

/**
 * An atomic morphism: drawn as a single box.
 */
@Value.Immutable
@Tuple
public abstract class Generator<O, G> extends HomExpr<O, G> {
  public abstract G value();

  @Override
  public abstract ImmutableList<O> dom();

  @Override
  public abstract ImmutableList<O> codom();

  @Override
  public <R> R visit(Visitor<O, G, R> visitor) {
    return visitor.generator(this);
  }
}
