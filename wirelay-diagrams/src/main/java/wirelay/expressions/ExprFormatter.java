package wirelay.expressions;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Textual forms of {@link HomExpr expressions}, for logging and diagnostics.
 * <ul>
 *   <li>{@link #infix}: {@code (f⋅g)⊗id[A]}, using unicode operators</li>
 *   <li>{@link #signature}: the infix form followed by its type, {@code f⋅g : A → C}</li>
 *   <li>{@link #sexpr}: {@code (otimes (compose f g) (id A))}; domains and codomains of generators are dropped</li>
 * </ul>
 */
public final class ExprFormatter {
  static final String COMPOSE = "⋅";
  static final String OTIMES = "⊗";
  static final String UNIT = "I";

  private ExprFormatter() {
  }

  public static String infix(HomExpr<?, ?> expr) {
    return infix(expr, false);
  }

  public static String signature(HomExpr<?, ?> expr) {
    return infix(expr) + " : " + objectInfix(expr.dom()) + " → " + objectInfix(expr.codom());
  }

  public static String sexpr(HomExpr<?, ?> expr) {
    return sexprOf(expr);
  }

  static String objectInfix(List<?> objects) {
    if (objects.isEmpty()) return UNIT;
    return objects.stream().map(String::valueOf).collect(Collectors.joining(OTIMES));
  }

  static String objectSexpr(List<?> objects) {
    if (objects.isEmpty()) return "(munit)";
    if (objects.size() == 1) return String.valueOf(objects.get(0));
    return objects.stream().map(String::valueOf).collect(Collectors.joining(" ", "(otimes ", ")"));
  }

  private static <O, G> String infix(HomExpr<O, G> expr, boolean parenthesize) {
    return expr.visit(new HomExpr.Visitor<O, G, String>() {
      @Override
      public String generator(Generator<O, G> generator) {
        return String.valueOf(generator.value());
      }

      @Override
      public String identity(Identity<O, G> identity) {
        return "id[" + objectInfix(identity.objects()) + "]";
      }

      @Override
      public String braid(Braid<O, G> braid) {
        return "braid[" + objectInfix(braid.first()) + "," + objectInfix(braid.second()) + "]";
      }

      @Override
      public String compose(Composition<O, G> composition) {
        return join(composition.args(), COMPOSE);
      }

      @Override
      public String otimes(Tensor<O, G> tensor) {
        return join(tensor.args(), OTIMES);
      }

      private String join(List<HomExpr<O, G>> args, String operator) {
        String result = args.stream().map(arg -> infix(arg, true)).collect(Collectors.joining(operator));
        return parenthesize ? "(" + result + ")" : result;
      }
    });
  }

  private static <O, G> String sexprOf(HomExpr<O, G> expr) {
    return expr.visit(new SexprVisitor<O, G>());
  }

  private static class SexprVisitor<O, G> implements HomExpr.Visitor<O, G, String> {
    @Override
    public String generator(Generator<O, G> generator) {
      return String.valueOf(generator.value());
    }

    @Override
    public String identity(Identity<O, G> identity) {
      return "(id " + objectSexpr(identity.objects()) + ")";
    }

    @Override
    public String braid(Braid<O, G> braid) {
      return "(braid " + objectSexpr(braid.first()) + " " + objectSexpr(braid.second()) + ")";
    }

    @Override
    public String compose(Composition<O, G> composition) {
      return apply("compose", composition.args());
    }

    @Override
    public String otimes(Tensor<O, G> tensor) {
      return apply("otimes", tensor.args());
    }

    private String apply(String head, List<HomExpr<O, G>> args) {
      return Stream.concat(Stream.of(head), args.stream().map(arg -> arg.visit(this)))
              .collect(Collectors.joining(" ", "(", ")"));
    }
  }
}
