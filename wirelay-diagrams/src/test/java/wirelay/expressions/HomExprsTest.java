package wirelay.expressions;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static wirelay.expressions.HomExprs.braid;
import static wirelay.expressions.HomExprs.compose;
import static wirelay.expressions.HomExprs.generator;
import static wirelay.expressions.HomExprs.id;
import static wirelay.expressions.HomExprs.otimes;

class HomExprsTest {
  static final HomExpr<String, String> F = generator("f", ImmutableList.of("A"), ImmutableList.of("B"));
  static final HomExpr<String, String> G = generator("g", ImmutableList.of("B"), ImmutableList.of("C"));
  static final HomExpr<String, String> H = generator("h", ImmutableList.of("C"), ImmutableList.of("D"));

  @Test
  void composeIsAssociativeSyntactically() {
    HomExpr<String, String> left = compose(compose(F, G), H);
    HomExpr<String, String> right = compose(F, compose(G, H));

    assertThat(left).isEqualTo(right);
    assertThat(left).isInstanceOf(Composition.class);
    assertThat(((Composition<String, String>) left).args()).containsExactly(F, G, H).inOrder();
    assertThat(left.dom()).containsExactly("A");
    assertThat(left.codom()).containsExactly("D");
  }

  @Test
  void singleArgumentIsReturnedUnchanged() {
    assertThat(compose(F)).isSameInstanceAs(F);
    assertThat(otimes(G)).isSameInstanceAs(G);
  }

  @Test
  void composeRejectsMismatchedTypes() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> compose(F, H));
    assertThat(e).hasMessageThat().contains("Incompatible domains");
  }

  @Test
  void composeRequiresArguments() {
    assertThrows(IllegalArgumentException.class, () -> compose(ImmutableList.<HomExpr<String, String>>of()));
    assertThrows(IllegalArgumentException.class, () -> otimes(ImmutableList.<HomExpr<String, String>>of()));
  }

  @Test
  void otimesConcatenatesTypesAndFlattens() {
    HomExpr<String, String> product = otimes(otimes(F, G), H);

    assertThat(product).isEqualTo(otimes(F, otimes(G, H)));
    assertThat(((Tensor<String, String>) product).args()).hasSize(3);
    assertThat(product.dom()).containsExactly("A", "B", "C").inOrder();
    assertThat(product.codom()).containsExactly("B", "C", "D").inOrder();
  }

  @Test
  void monoidalUnitIsElided() {
    HomExpr<String, String> product = otimes(F, id(ImmutableList.<String>of()));

    assertThat(product.dom()).containsExactly("A");
    assertThat(product.codom()).containsExactly("B");
  }

  @Test
  void braidSwapsFactors() {
    Braid<String, String> braid = braid(ImmutableList.of("A"), ImmutableList.of("B", "C"));

    assertThat(braid.dom()).containsExactly("A", "B", "C").inOrder();
    assertThat(braid.codom()).containsExactly("B", "C", "A").inOrder();
  }

  @Test
  void composeAcceptsWiringBetweenBoxes() {
    HomExpr<String, String> swapped = compose(
            otimes(F, G),
            braid(ImmutableList.of("B"), ImmutableList.of("C")),
            otimes(H, id(ImmutableList.of("B")))
    );

    assertThat(swapped.dom()).containsExactly("A", "B").inOrder();
    assertThat(swapped.codom()).containsExactly("D", "B").inOrder();
  }

  @Test
  void visitorDispatchesOnKind() {
    HomExpr.Visitor<String, String, Integer> generatorCount = new HomExpr.Visitor<>() {
      @Override
      public Integer generator(Generator<String, String> generator) {
        return 1;
      }

      @Override
      public Integer identity(Identity<String, String> identity) {
        return 0;
      }

      @Override
      public Integer braid(Braid<String, String> braid) {
        return 0;
      }

      @Override
      public Integer compose(Composition<String, String> composition) {
        return composition.args().stream().mapToInt(arg -> arg.visit(this)).sum();
      }

      @Override
      public Integer otimes(Tensor<String, String> tensor) {
        return tensor.args().stream().mapToInt(arg -> arg.visit(this)).sum();
      }
    };

    HomExpr<String, String> expr = compose(otimes(F, id(ImmutableList.of("X"))), otimes(G, id(ImmutableList.of("X"))), otimes(H, id(ImmutableList.of("X"))));
    assertThat(expr.visit(generatorCount)).isEqualTo(3);
  }
}
