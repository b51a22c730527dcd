package wirelay.expressions;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Constructors for {@link HomExpr morphism expressions}.
 * <p/>
 * Composition and monoidal product are associative at the syntactic level: nested applications of the same operation
 * are flattened into a single n-ary node, and applying either operation to a single expression returns that
 * expression unchanged. No other equations (unit laws, interchange, symmetry) are applied.
 */
public final class HomExprs {
  private HomExprs() {
  }

  public static <O, G> Generator<O, G> generator(G value, List<? extends O> dom, List<? extends O> codom) {
    return ImmutableGenerator.of(value, dom, codom);
  }

  public static <O, G> Identity<O, G> id(List<? extends O> objects) {
    return ImmutableIdentity.of(objects);
  }

  public static <O, G> Braid<O, G> braid(List<? extends O> first, List<? extends O> second) {
    return ImmutableBraid.of(first, second);
  }

  @SafeVarargs
  public static <O, G> HomExpr<O, G> compose(HomExpr<O, G>... args) {
    return compose(Arrays.asList(args));
  }

  /**
   * @throws IllegalArgumentException if the codomain of any argument differs from the domain of its successor
   */
  public static <O, G> HomExpr<O, G> compose(List<? extends HomExpr<O, G>> args) {
    checkArgument(!args.isEmpty(), "compose requires at least one argument");
    for (int i = 1; i < args.size(); i++) {
      HomExpr<O, G> f = args.get(i - 1);
      HomExpr<O, G> g = args.get(i);
      checkArgument(f.codom().equals(g.dom()),
              "Incompatible domains: codom(%s) = %s, dom(%s) = %s", f, f.codom(), g, g.dom());
    }
    if (args.size() == 1) return args.get(0);

    ImmutableList.Builder<HomExpr<O, G>> terms = ImmutableList.builder();
    for (HomExpr<O, G> arg : args) {
      if (arg instanceof Composition) {
        terms.addAll(((Composition<O, G>) arg).args());
      } else {
        terms.add(arg);
      }
    }
    return ImmutableComposition.of(terms.build());
  }

  @SafeVarargs
  public static <O, G> HomExpr<O, G> otimes(HomExpr<O, G>... args) {
    return otimes(Arrays.asList(args));
  }

  public static <O, G> HomExpr<O, G> otimes(List<? extends HomExpr<O, G>> args) {
    checkArgument(!args.isEmpty(), "otimes requires at least one argument");
    if (args.size() == 1) return args.get(0);

    ImmutableList.Builder<HomExpr<O, G>> terms = ImmutableList.builder();
    for (HomExpr<O, G> arg : args) {
      if (arg instanceof Tensor) {
        terms.addAll(((Tensor<O, G>) arg).args());
      } else {
        terms.add(arg);
      }
    }
    return ImmutableTensor.of(terms.build());
  }
}
