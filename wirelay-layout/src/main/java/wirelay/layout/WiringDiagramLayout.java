package wirelay.layout;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wirelay.diagrams.Box;
import wirelay.diagrams.WiringDiagram;
import wirelay.diagrams.WiringDiagrams;
import wirelay.expressions.Braid;
import wirelay.expressions.Composition;
import wirelay.expressions.ExprFormatter;
import wirelay.expressions.Generator;
import wirelay.expressions.HomExpr;
import wirelay.expressions.Identity;
import wirelay.expressions.Tensor;
import wirelay.util.geometry.Vector2D;

import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Lays out a {@link HomExpr morphism expression} as a {@link WiringDiagram} whose boxes carry {@link BoxLayout}s and
 * whose ports carry {@link PortLayout}s, independent of any graphics system.
 * <p/>
 * The layout follows the structure of the expression: each generator becomes a box sized by
 * {@link LayoutOptions#defaultBoxSize}; the factors of a composition are placed side by side along the primary axis,
 * and the factors of a monoidal product along the secondary axis. After each such merge the container is
 * {@link DiagramLayouts#sizeToFit sized to fit} its contents and the factors are
 * {@link DiagramLayouts#substituteWithLayout inlined}, so the result is a single flat diagram.
 * <p/>
 * Coordinates are relative to the center of the diagram, with boxes positioned by their centers. With a vertical
 * {@link Orientation}, renderers conventionally draw the positive y axis pointing down. Wires are copied without any
 * geometry; routing them is left to the renderer.
 */
public class WiringDiagramLayout {
  private static final Logger LOG = LoggerFactory.getLogger(WiringDiagramLayout.class);
  private final LayoutOptions options;

  public WiringDiagramLayout(LayoutOptions options) {
    this.options = options;
  }

  public WiringDiagramLayout(Config config) {
    this(LayoutOptions.fromConfig(config));
  }

  public static <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutDiagram(HomExpr<O, G> expr, LayoutOptions options) {
    return new WiringDiagramLayout(options).layout(expr);
  }

  public static <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutDiagram(HomExpr<O, G> expr) {
    return layoutDiagram(expr, LayoutOptions.defaults());
  }

  public LayoutOptions options() {
    return options;
  }

  /**
   * Lays out {@code expr}, including the ports on the boundary of the resulting diagram.
   */
  public <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layout(HomExpr<O, G> expr) {
    WiringDiagram<BoxLayout<G>, PortLayout<O>> diagram = layoutHomExpr(expr);
    layoutPorts(diagram);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Laid out {}: {} boxes within {}", ExprFormatter.signature(expr), diagram.boxCount(), diagram.value().size());
    }
    return diagram;
  }

  /**
   * Lays out {@code expr} recursively. The ports on the boundary of the result are left as they were laid out for
   * the outermost factor they came from; {@link #layout} lays them out afresh.
   */
  public <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutHomExpr(HomExpr<O, G> expr) {
    return expr.visit(new ExprLayoutVisitor<O, G>());
  }

  /**
   * Creates a diagram holding a single box with the given value and ports, sized by
   * {@link LayoutOptions#defaultBoxSize}.
   */
  public <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutBox(G value, List<? extends O> inputs, List<? extends O> outputs) {
    Vector2D size = options.defaultBoxSize(inputs.size(), outputs.size());
    Box<BoxLayout<G>, PortLayout<O>> box = Box.of(
            BoxLayout.of(value, size),
            PortLayouts.<O>layoutPorts(PortKind.Input, inputs, size, options),
            PortLayouts.<O>layoutPorts(PortKind.Output, outputs, size, options)
    );
    return DiagramLayouts.sizeToFit(WiringDiagram.singleton(BoxLayout.container(), box), options);
  }

  /**
   * Lays out a diagram consisting only of wires (identities and braids): it has no boxes, so it is simply given the
   * minimum size for its ports.
   */
  public <O, G> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutPureWiring(WiringDiagram<?, O> wiring) {
    checkArgument(wiring.boxCount() == 0, "Expected pure wiring, found %s boxes", wiring.boxCount());
    Vector2D size = options.defaultBoxSize(wiring.inputPorts().size(), wiring.outputPorts().size());
    WiringDiagram<BoxLayout<G>, PortLayout<O>> result = new WiringDiagram<>(
            BoxLayout.container(size),
            PortLayouts.layoutPorts(PortKind.Input, wiring.inputPorts(), size, options),
            PortLayouts.layoutPorts(PortKind.Output, wiring.outputPorts(), size, options)
    );
    // wires get no layout data
    result.addWires(wiring.wires());
    return result;
  }

  /**
   * Composes two laid-out diagrams in sequence, {@code d1} upstream of {@code d2}, separated by
   * {@link LayoutOptions#sequencePad}.
   *
   * @throws DegenerateDiagramException if the outputs of {@code d1} do not match the inputs of {@code d2} in number
   */
  public <G, P> WiringDiagram<BoxLayout<G>, P> composeWithLayout(WiringDiagram<BoxLayout<G>, P> d1, WiringDiagram<BoxLayout<G>, P> d2) {
    checkDistinct(d1, d2);
    if (d1.outputPorts().size() != d2.inputPorts().size()) {
      throw new DegenerateDiagramException("Cannot compose a diagram with %s outputs into one with %s inputs",
              d1.outputPorts().size(), d2.inputPorts().size());
    }
    WiringDiagram<BoxLayout<G>, P> diagram = WiringDiagrams.compose(d1, d2, BoxLayout.container());
    return merge(diagram, options.orientation().primaryDirection(), options.sequencePad());
  }

  public <G, P> WiringDiagram<BoxLayout<G>, P> composeWithLayout(List<WiringDiagram<BoxLayout<G>, P>> diagrams) {
    return fold(diagrams, this::composeWithLayout);
  }

  /**
   * Places two laid-out diagrams side by side, {@code d1} before {@code d2} along the secondary axis, separated by
   * {@link LayoutOptions#parallelPad}.
   */
  public <G, P> WiringDiagram<BoxLayout<G>, P> otimesWithLayout(WiringDiagram<BoxLayout<G>, P> d1, WiringDiagram<BoxLayout<G>, P> d2) {
    checkDistinct(d1, d2);
    WiringDiagram<BoxLayout<G>, P> diagram = WiringDiagrams.otimes(d1, d2, BoxLayout.container());
    return merge(diagram, options.orientation().secondaryDirection(), options.parallelPad());
  }

  public <G, P> WiringDiagram<BoxLayout<G>, P> otimesWithLayout(List<WiringDiagram<BoxLayout<G>, P>> diagrams) {
    return fold(diagrams, this::otimesWithLayout);
  }

  /**
   * Lays out the ports on the boundary of {@code diagram} along the edges of its current size.
   *
   * @throws DegenerateDiagramException if either side has too many ports for the diagram's size; the diagram is then
   * left unchanged
   */
  public <G, O> WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutPorts(WiringDiagram<BoxLayout<G>, PortLayout<O>> diagram) {
    Vector2D size = diagram.value().size();
    // both sides are checked before either is replaced
    List<PortLayout<O>> inputs = PortLayouts.layoutPorts(PortKind.Input, portValues(diagram.inputPorts()), size, options);
    List<PortLayout<O>> outputs = PortLayouts.layoutPorts(PortKind.Output, portValues(diagram.outputPorts()), size, options);
    diagram.setInputPorts(inputs);
    diagram.setOutputPorts(outputs);
    return diagram;
  }

  private <G, P> WiringDiagram<BoxLayout<G>, P> merge(WiringDiagram<BoxLayout<G>, P> diagram, Vector2D direction, double pad) {
    List<Integer> operands = diagram.boxIds();
    checkState(operands.size() == 2, "Expected two operands, found %s", operands);
    DiagramLayouts.placeAdjacent(diagram, operands.get(0), operands.get(1), direction, pad);
    DiagramLayouts.sizeToFit(diagram, options);
    DiagramLayouts.substituteWithLayout(diagram);
    LOG.trace("Merged {} boxes into {}", diagram.boxCount(), diagram.value().size());
    return diagram;
  }

  private static <T> T fold(List<T> items, BinaryOperator<T> combine) {
    checkArgument(!items.isEmpty(), "Nothing to combine");
    T result = items.get(0);
    for (T item : items.subList(1, items.size())) {
      result = combine.apply(result, item);
    }
    return result;
  }

  private static void checkDistinct(WiringDiagram<?, ?> d1, WiringDiagram<?, ?> d2) {
    if (d1 == d2) {
      throw new DegenerateDiagramException("Cannot combine a diagram with itself: %s", d1);
    }
  }

  private static <O> List<O> portValues(List<PortLayout<O>> ports) {
    return ports.stream().map(PortLayout::value).collect(Collectors.toList());
  }

  private class ExprLayoutVisitor<O, G> implements HomExpr.Visitor<O, G, WiringDiagram<BoxLayout<G>, PortLayout<O>>> {
    @Override
    public WiringDiagram<BoxLayout<G>, PortLayout<O>> generator(Generator<O, G> generator) {
      return layoutBox(generator.value(), generator.dom(), generator.codom());
    }

    @Override
    public WiringDiagram<BoxLayout<G>, PortLayout<O>> identity(Identity<O, G> identity) {
      return layoutPureWiring(identity);
    }

    @Override
    public WiringDiagram<BoxLayout<G>, PortLayout<O>> braid(Braid<O, G> braid) {
      return layoutPureWiring(braid);
    }

    @Override
    public WiringDiagram<BoxLayout<G>, PortLayout<O>> compose(Composition<O, G> composition) {
      return composeWithLayout(layoutArgs(composition.args()));
    }

    @Override
    public WiringDiagram<BoxLayout<G>, PortLayout<O>> otimes(Tensor<O, G> tensor) {
      return otimesWithLayout(layoutArgs(tensor.args()));
    }

    private WiringDiagram<BoxLayout<G>, PortLayout<O>> layoutPureWiring(HomExpr<O, G> expr) {
      WiringDiagram<Optional<G>, O> wiring = WiringDiagrams.fromExpression(expr);
      return WiringDiagramLayout.this.layoutPureWiring(wiring);
    }

    private List<WiringDiagram<BoxLayout<G>, PortLayout<O>>> layoutArgs(List<HomExpr<O, G>> args) {
      return args.stream().map(arg -> arg.visit(this)).collect(Collectors.toList());
    }
  }
}
