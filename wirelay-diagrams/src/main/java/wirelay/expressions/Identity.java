package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import wirelay.util.annotations.Tuple;

@Value.Immutable
@Tuple
public abstract class Identity<O, G> extends HomExpr<O, G> {
  public abstract ImmutableList<O> objects();

  @Override
  public ImmutableList<O> dom() {
    return objects();
  }

  @Override
  public ImmutableList<O> codom() {
    return objects();
  }

  @Override
  public <R> R visit(Visitor<O, G, R> visitor) {
    return visitor.identity(this);
  }
}
