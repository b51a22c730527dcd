package wirelay.diagrams;

import com.google.common.collect.ImmutableList;
import wirelay.expressions.Braid;
import wirelay.expressions.Composition;
import wirelay.expressions.Generator;
import wirelay.expressions.HomExpr;
import wirelay.expressions.Identity;
import wirelay.expressions.Tensor;

import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

import static com.google.common.base.Preconditions.checkArgument;
import static wirelay.diagrams.WiringDiagram.INPUT_ID;
import static wirelay.diagrams.WiringDiagram.OUTPUT_ID;

/**
 * Sequential and parallel composition of {@link WiringDiagram wiring diagrams}, and conversion of
 * {@link HomExpr morphism expressions} into diagrams.
 */
public final class WiringDiagrams {
  private WiringDiagrams() {
  }

  /**
   * Composes {@code d1 ; d2} without inlining: the result holds {@code d1} and {@code d2} as nested boxes (with ids
   * 0 and 1), wired input → d1 → d2 → output.
   */
  public static <V, P> WiringDiagram<V, P> compose(WiringDiagram<V, P> d1, WiringDiagram<V, P> d2, V value) {
    checkArgument(d1.outputPorts().size() == d2.inputPorts().size(),
            "Cannot compose: %s outputs into %s inputs", d1.outputPorts().size(), d2.inputPorts().size());
    WiringDiagram<V, P> result = new WiringDiagram<>(value, d1.inputPorts(), d2.outputPorts());
    int v1 = result.addBox(d1);
    int v2 = result.addBox(d2);
    for (int i = 0; i < d1.inputPorts().size(); i++) {
      result.addWire(Wire.of(INPUT_ID, i, v1, i));
    }
    for (int i = 0; i < d1.outputPorts().size(); i++) {
      result.addWire(Wire.of(v1, i, v2, i));
    }
    for (int i = 0; i < d2.outputPorts().size(); i++) {
      result.addWire(Wire.of(v2, i, OUTPUT_ID, i));
    }
    return result;
  }

  /**
   * Places {@code d1} and {@code d2} side by side without inlining: the result holds them as nested boxes (with ids
   * 0 and 1); its inputs are those of {@code d1} followed by those of {@code d2}, and likewise for outputs.
   */
  public static <V, P> WiringDiagram<V, P> otimes(WiringDiagram<V, P> d1, WiringDiagram<V, P> d2, V value) {
    WiringDiagram<V, P> result = new WiringDiagram<>(value,
            concat(d1.inputPorts(), d2.inputPorts()),
            concat(d1.outputPorts(), d2.outputPorts()));
    int v1 = result.addBox(d1);
    int v2 = result.addBox(d2);
    int n1 = d1.inputPorts().size();
    int m1 = d1.outputPorts().size();
    for (int i = 0; i < n1; i++) {
      result.addWire(Wire.of(INPUT_ID, i, v1, i));
    }
    for (int i = 0; i < d2.inputPorts().size(); i++) {
      result.addWire(Wire.of(INPUT_ID, n1 + i, v2, i));
    }
    for (int i = 0; i < m1; i++) {
      result.addWire(Wire.of(v1, i, OUTPUT_ID, i));
    }
    for (int i = 0; i < d2.outputPorts().size(); i++) {
      result.addWire(Wire.of(v2, i, OUTPUT_ID, m1 + i));
    }
    return result;
  }

  /**
   * Builds the flat wiring diagram denoted by {@code expr}. Each generator becomes a box whose value is the
   * generator's payload; identities and braids contribute only wires. The diagram itself, and any intermediate
   * container, has an empty value.
   */
  public static <O, G> WiringDiagram<Optional<G>, O> fromExpression(HomExpr<O, G> expr) {
    return expr.visit(new HomExpr.Visitor<O, G, WiringDiagram<Optional<G>, O>>() {
      @Override
      public WiringDiagram<Optional<G>, O> generator(Generator<O, G> generator) {
        return WiringDiagram.<Optional<G>, O>singleton(Optional.empty(),
                Box.<Optional<G>, O>of(Optional.of(generator.value()), generator.dom(), generator.codom()));
      }

      @Override
      public WiringDiagram<Optional<G>, O> identity(Identity<O, G> identity) {
        WiringDiagram<Optional<G>, O> diagram = new WiringDiagram<>(Optional.empty(), identity.dom(), identity.codom());
        for (int i = 0; i < identity.objects().size(); i++) {
          diagram.addWire(Wire.of(INPUT_ID, i, OUTPUT_ID, i));
        }
        return diagram;
      }

      @Override
      public WiringDiagram<Optional<G>, O> braid(Braid<O, G> braid) {
        WiringDiagram<Optional<G>, O> diagram = new WiringDiagram<>(Optional.empty(), braid.dom(), braid.codom());
        int first = braid.first().size();
        int second = braid.second().size();
        for (int i = 0; i < first; i++) {
          diagram.addWire(Wire.of(INPUT_ID, i, OUTPUT_ID, second + i));
        }
        for (int i = 0; i < second; i++) {
          diagram.addWire(Wire.of(INPUT_ID, first + i, OUTPUT_ID, i));
        }
        return diagram;
      }

      @Override
      public WiringDiagram<Optional<G>, O> compose(Composition<O, G> composition) {
        return fold(composition.args(), (d1, d2) -> WiringDiagrams.compose(d1, d2, Optional.empty()));
      }

      @Override
      public WiringDiagram<Optional<G>, O> otimes(Tensor<O, G> tensor) {
        return fold(tensor.args(), (d1, d2) -> WiringDiagrams.otimes(d1, d2, Optional.empty()));
      }

      private WiringDiagram<Optional<G>, O> fold(
              List<HomExpr<O, G>> args,
              BinaryOperator<WiringDiagram<Optional<G>, O>> join
      ) {
        WiringDiagram<Optional<G>, O> result = args.get(0).visit(this);
        for (HomExpr<O, G> arg : args.subList(1, args.size())) {
          result = join.apply(result, arg.visit(this));
          result.substitute(result.boxIds());
        }
        return result;
      }
    });
  }

  private static <P> ImmutableList<P> concat(List<P> first, List<P> second) {
    return ImmutableList.<P>builder().addAll(first).addAll(second).build();
  }
}
