package wirelay.layout;

import com.google.common.collect.ImmutableList;
import wirelay.diagrams.AbstractBox;
import wirelay.diagrams.WiringDiagram;
import wirelay.util.geometry.Vector2D;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Geometric operations on wiring diagrams whose boxes carry {@link BoxLayout layouts}.
 */
public final class DiagramLayouts {
  private DiagramLayouts() {
  }

  /**
   * The element-wise minimum of the lower corners of the diagram's boxes, or empty if it has no boxes.
   */
  public static <V, P> Optional<Vector2D> contentsLowerCorner(WiringDiagram<BoxLayout<V>, P> diagram) {
    return corners(diagram, BoxLayout::lowerCorner).stream().reduce(Vector2D::min);
  }

  /**
   * The element-wise maximum of the upper corners of the diagram's boxes, or empty if it has no boxes.
   */
  public static <V, P> Optional<Vector2D> contentsUpperCorner(WiringDiagram<BoxLayout<V>, P> diagram) {
    return corners(diagram, BoxLayout::upperCorner).stream().reduce(Vector2D::max);
  }

  public static <V, P> WiringDiagram<BoxLayout<V>, P> sizeToFit(WiringDiagram<BoxLayout<V>, P> diagram, LayoutOptions options) {
    return sizeToFit(diagram, options, Vector2D.ZERO);
  }

  /**
   * Sizes a diagram to fit its contents, and recenters the contents on the diagram's origin.
   * <p/>
   * The new size is the larger, along each axis, of the bounding box of the contents (plus {@code padding} on every
   * side) and the {@link LayoutOptions#defaultBoxSize minimum size} for the diagram's own ports. Only the size of the
   * diagram's layout changes; its value and position are kept. Applying this twice with the same padding changes
   * nothing the second time.
   */
  public static <V, P> WiringDiagram<BoxLayout<V>, P> sizeToFit(
          WiringDiagram<BoxLayout<V>, P> diagram,
          LayoutOptions options,
          Vector2D padding
  ) {
    Vector2D size = options.defaultBoxSize(diagram.inputPorts().size(), diagram.outputPorts().size());
    Optional<Vector2D> lower = contentsLowerCorner(diagram);
    Optional<Vector2D> upper = contentsUpperCorner(diagram);
    if (lower.isPresent() && upper.isPresent()) {
      Vector2D contentSize = upper.get().minus(lower.get());
      size = size.max(contentSize.plus(padding.times(2)));
      Vector2D contentCenter = lower.get().plus(upper.get()).dividedBy(2);
      shiftBoxes(diagram, contentCenter.negate());
    }
    diagram.setValue(diagram.value().withSize(size));
    return diagram;
  }

  public static <V, P> WiringDiagram<BoxLayout<V>, P> shiftBoxes(WiringDiagram<BoxLayout<V>, P> diagram, Vector2D offset) {
    diagram.updateBoxValues(layout -> layout.translate(offset));
    return diagram;
  }

  /**
   * Places two boxes of a diagram next to each other along {@code direction}, separated by a gap of {@code pad}:
   * the first box is centered at {@code -(size1 + pad) / 2} and the second at {@code (size2 + pad) / 2}, measured
   * along {@code direction}. Only the relative placement is meaningful.
   */
  public static <V, P> void placeAdjacent(
          WiringDiagram<BoxLayout<V>, P> diagram,
          int first,
          int second,
          Vector2D direction,
          double pad
  ) {
    Vector2D padding = Vector2D.of(pad, pad);
    diagram.updateBoxValue(first, layout -> layout.withPosition(layout.size().plus(padding).times(direction).times(-0.5)));
    diagram.updateBoxValue(second, layout -> layout.withPosition(layout.size().plus(padding).times(direction).times(0.5)));
  }

  /**
   * Inlines every nested diagram into {@code diagram}, preserving geometry: before a nested diagram is inlined, its
   * boxes are shifted by the nested diagram's own position, so that they end up expressed in {@code diagram}'s
   * coordinate frame. Nested diagrams are flattened depth-first.
   */
  public static <V, P> WiringDiagram<BoxLayout<V>, P> substituteWithLayout(WiringDiagram<BoxLayout<V>, P> diagram) {
    List<Integer> nested = diagram.boxIds().stream()
            .filter(id -> diagram.box(id).isDiagram())
            .collect(ImmutableList.toImmutableList());
    for (Integer id : nested) {
      WiringDiagram<BoxLayout<V>, P> sub = asDiagram(diagram.box(id));
      substituteWithLayout(sub);
      shiftBoxes(sub, sub.value().position());
    }
    diagram.substitute(nested);
    return diagram;
  }

  private static <V, P> WiringDiagram<V, P> asDiagram(AbstractBox<V, P> box) {
    return box.visit(
            atomic -> {
              throw new IllegalStateException("Not a wiring diagram: " + atomic);
            },
            diagram -> diagram
    );
  }

  private static <V, P> List<Vector2D> corners(
          WiringDiagram<BoxLayout<V>, P> diagram,
          Function<BoxLayout<V>, Vector2D> corner
  ) {
    return diagram.boxes().stream()
            .map(box -> corner.apply(box.value()))
            .collect(ImmutableList.toImmutableList());
  }
}
