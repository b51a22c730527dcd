package wirelay.expressions;

import com.google.common.collect.ImmutableList;

/**
 * A symbolic morphism in a strict monoidal category, built from generators, identities and braids by sequential
 * composition and monoidal product.
 * <p/>
 * Objects are represented by their normal form: the ordered list of basic objects {@link O} in the product, with the
 * monoidal unit as the empty list. Generator payloads are of type {@link G}.
 * <p/>
 * The set of expression kinds is closed; consumers dispatch over it with a {@link Visitor}. Instances are created
 * via {@link HomExprs}.
 */
public abstract class HomExpr<O, G> {
  HomExpr() {
  }

  public abstract ImmutableList<O> dom();

  public abstract ImmutableList<O> codom();

  public abstract <R> R visit(Visitor<O, G, R> visitor);

  public interface Visitor<O, G, R> {
    R generator(Generator<O, G> generator);

    R identity(Identity<O, G> identity);

    R braid(Braid<O, G> braid);

    R compose(Composition<O, G> composition);

    R otimes(Tensor<O, G> tensor);
  }
}
