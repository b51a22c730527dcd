package wirelay.layout;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Truth8;
import org.junit.jupiter.api.Test;
import wirelay.diagrams.Box;
import wirelay.diagrams.Wire;
import wirelay.diagrams.WiringDiagram;
import wirelay.util.geometry.Vector2D;

import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;
import static wirelay.layout.Vector2DSubject.assertThat;

class DiagramLayoutsTest {
  private final LayoutOptions options = LayoutOptions.builder().build();

  @Test
  void contentsCornersOfEmptyDiagram() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of(), ImmutableList.of());

    Truth8.assertThat(DiagramLayouts.contentsLowerCorner(diagram)).isEmpty();
    Truth8.assertThat(DiagramLayouts.contentsUpperCorner(diagram)).isEmpty();
  }

  @Test
  void contentsCornersSpanAllBoxes() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of(), ImmutableList.of());
    diagram.addBox(box("f", Vector2D.of(-2, 0), Vector2D.of(2, 2)));
    diagram.addBox(box("g", Vector2D.of(3, 1), Vector2D.of(2, 4)));

    assertThat(DiagramLayouts.contentsLowerCorner(diagram).get()).isApproximately(-3, -1);
    assertThat(DiagramLayouts.contentsUpperCorner(diagram).get()).isApproximately(4, 3);
  }

  @Test
  void sizeToFitRecentersContents() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of("A"), ImmutableList.of("B"));
    int f = diagram.addBox(box("f", Vector2D.of(1, 1), Vector2D.of(2, 2)));
    int g = diagram.addBox(box("g", Vector2D.of(5, 1), Vector2D.of(2, 2)));

    DiagramLayouts.sizeToFit(diagram, options);

    assertThat(diagram.value().size()).isApproximately(6, 2);
    assertThat(diagram.box(f).value().position()).isApproximately(-2, 0);
    assertThat(diagram.box(g).value().position()).isApproximately(2, 0);
  }

  @Test
  void sizeToFitKeepsValueAndPosition() {
    WiringDiagram<BoxLayout<String>, String> diagram = new WiringDiagram<>(
            BoxLayout.of(Optional.of("outer"), Vector2D.of(7, 7), Vector2D.ZERO),
            ImmutableList.of("A"),
            ImmutableList.of("B"));
    diagram.addBox(box("f", Vector2D.ZERO, Vector2D.of(2, 2)));

    DiagramLayouts.sizeToFit(diagram, options);

    Truth8.assertThat(diagram.value().value()).hasValue("outer");
    assertThat(diagram.value().position()).isApproximately(7, 7);
  }

  @Test
  void sizeToFitAddsPadding() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of("A"), ImmutableList.of("B"));
    diagram.addBox(box("f", Vector2D.ZERO, Vector2D.of(2, 2)));

    DiagramLayouts.sizeToFit(diagram, options, Vector2D.of(1, 0.5));

    assertThat(diagram.value().size()).isApproximately(4, 3);
  }

  @Test
  void sizeToFitNeverShrinksBelowPortMinimum() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of("A", "B", "C"), ImmutableList.of());
    diagram.addBox(box("f", Vector2D.ZERO, Vector2D.of(1, 1)));

    DiagramLayouts.sizeToFit(diagram, options);

    assertThat(diagram.value().size()).isApproximately(2, 8);
  }

  @Test
  void sizeToFitEmptyDiagramUsesMinimumSize() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of("A", "B"), ImmutableList.of("C"));

    DiagramLayouts.sizeToFit(diagram, options);

    assertThat(diagram.value().size()).isEqualTo(options.defaultBoxSize(2, 1));
  }

  @Test
  void sizeToFitIsIdempotent() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of("A"), ImmutableList.of("B"));
    int f = diagram.addBox(box("f", Vector2D.of(1, 3), Vector2D.of(2, 2)));
    int g = diagram.addBox(box("g", Vector2D.of(4, -2), Vector2D.of(2, 6)));

    DiagramLayouts.sizeToFit(diagram, options, Vector2D.of(1, 1));
    Vector2D size = diagram.value().size();
    Vector2D fPosition = diagram.box(f).value().position();
    Vector2D gPosition = diagram.box(g).value().position();
    DiagramLayouts.sizeToFit(diagram, options, Vector2D.of(1, 1));

    assertThat(diagram.value().size()).isApproximately(size);
    assertThat(diagram.box(f).value().position()).isApproximately(fPosition);
    assertThat(diagram.box(g).value().position()).isApproximately(gPosition);
  }

  @Test
  void placeAdjacentSeparatesBoxesByPad() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of(), ImmutableList.of());
    int f = diagram.addBox(box("f", Vector2D.of(9, 9), Vector2D.of(2, 2)));
    int g = diagram.addBox(box("g", Vector2D.of(-9, 9), Vector2D.of(4, 2)));

    DiagramLayouts.placeAdjacent(diagram, f, g, Vector2D.of(1, 0), 2);

    BoxLayout<String> first = diagram.box(f).value();
    BoxLayout<String> second = diagram.box(g).value();
    assertThat(first.position()).isApproximately(-2, 0);
    assertThat(second.position()).isApproximately(3, 0);
    assertThat(second.lowerCorner().x() - first.upperCorner().x()).isWithin(1e-9).of(2.0);
  }

  @Test
  void placeAdjacentAlongSecondaryAxis() {
    WiringDiagram<BoxLayout<String>, String> diagram = container(ImmutableList.of(), ImmutableList.of());
    int f = diagram.addBox(box("f", Vector2D.ZERO, Vector2D.of(2, 2)));
    int g = diagram.addBox(box("g", Vector2D.ZERO, Vector2D.of(2, 2)));

    DiagramLayouts.placeAdjacent(diagram, f, g, Vector2D.of(0, 1), 1);

    assertThat(diagram.box(f).value().position()).isApproximately(0, -1.5);
    assertThat(diagram.box(g).value().position()).isApproximately(0, 1.5);
  }

  @Test
  void substituteWithLayoutMovesNestedBoxesIntoParentFrame() {
    WiringDiagram<BoxLayout<String>, String> inner = new WiringDiagram<>(
            BoxLayout.of(Optional.empty(), Vector2D.of(10, 5), Vector2D.of(4, 4)),
            ImmutableList.of("A"),
            ImmutableList.of("B"));
    int f = inner.addBox(box("f", Vector2D.of(1, -1), Vector2D.of(2, 2)));
    inner.addWire(Wire.of(WiringDiagram.INPUT_ID, 0, f, 0));
    inner.addWire(Wire.of(f, 0, WiringDiagram.OUTPUT_ID, 0));

    WiringDiagram<BoxLayout<String>, String> outer = WiringDiagram.singleton(BoxLayout.container(), inner);

    DiagramLayouts.substituteWithLayout(outer);

    assertThat(outer.boxCount()).isEqualTo(1);
    BoxLayout<String> layout = outer.boxes().iterator().next().value();
    Truth8.assertThat(layout.value()).hasValue("f");
    assertThat(layout.position()).isApproximately(11, 4);
    assertThat(outer.boxes().iterator().next().isDiagram()).isFalse();
  }

  @Test
  void substituteWithLayoutFlattensDepthFirst() {
    WiringDiagram<BoxLayout<String>, String> innermost = new WiringDiagram<>(
            BoxLayout.of(Optional.empty(), Vector2D.of(1, 0), Vector2D.of(2, 2)),
            ImmutableList.of(),
            ImmutableList.of());
    innermost.addBox(box("f", Vector2D.of(0, 1), Vector2D.of(2, 2)));
    WiringDiagram<BoxLayout<String>, String> middle = new WiringDiagram<>(
            BoxLayout.of(Optional.empty(), Vector2D.of(0, 2), Vector2D.of(2, 2)),
            ImmutableList.of(),
            ImmutableList.of());
    middle.addBox(innermost);
    WiringDiagram<BoxLayout<String>, String> outer = new WiringDiagram<>(BoxLayout.container(), ImmutableList.of(), ImmutableList.of());
    outer.addBox(middle);

    DiagramLayouts.substituteWithLayout(outer);

    assertThat(outer.boxCount()).isEqualTo(1);
    assertThat(outer.boxes().iterator().next().value().position()).isApproximately(1, 3);
  }

  private static WiringDiagram<BoxLayout<String>, String> container(ImmutableList<String> inputs, ImmutableList<String> outputs) {
    return new WiringDiagram<>(BoxLayout.container(), inputs, outputs);
  }

  private static Box<BoxLayout<String>, String> box(String value, Vector2D position, Vector2D size) {
    return Box.of(BoxLayout.of(Optional.of(value), position, size), ImmutableList.of("A"), ImmutableList.of("B"));
  }
}
