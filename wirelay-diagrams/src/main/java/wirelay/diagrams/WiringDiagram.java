package wirelay.diagrams;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A mutable graph of boxes connected by wires, with its own ordered input and output ports. A wiring diagram is itself
 * a box, so diagrams nest; {@link #substitute} inlines nested diagrams into their parent.
 * <p/>
 * Boxes are addressed by integer ids, assigned in insertion order and never reused within one diagram. The
 * diagram's own ports are addressed through the reserved ids {@link #INPUT_ID} and {@link #OUTPUT_ID}.
 * <p/>
 * Not thread-safe.
 */
public class WiringDiagram<V, P> extends AbstractBox<V, P> {
  public static final int INPUT_ID = -2;
  public static final int OUTPUT_ID = -1;

  private V value;
  private ImmutableList<P> inputPorts;
  private ImmutableList<P> outputPorts;
  private final Map<Integer, AbstractBox<V, P>> boxes = new LinkedHashMap<>();
  private final Set<Wire> wires = new LinkedHashSet<>();
  private int nextBoxId = 0;

  public WiringDiagram(V value, Iterable<? extends P> inputPorts, Iterable<? extends P> outputPorts) {
    this.value = checkNotNull(value, "value");
    this.inputPorts = ImmutableList.copyOf(inputPorts);
    this.outputPorts = ImmutableList.copyOf(outputPorts);
  }

  /**
   * A diagram containing just {@code box}, with the diagram's ports wired straight through to the box's ports.
   */
  public static <V, P> WiringDiagram<V, P> singleton(V value, AbstractBox<V, P> box) {
    WiringDiagram<V, P> diagram = new WiringDiagram<>(value, box.inputPorts(), box.outputPorts());
    int id = diagram.addBox(box);
    for (int i = 0; i < box.inputPorts().size(); i++) {
      diagram.addWire(Wire.of(INPUT_ID, i, id, i));
    }
    for (int i = 0; i < box.outputPorts().size(); i++) {
      diagram.addWire(Wire.of(id, i, OUTPUT_ID, i));
    }
    return diagram;
  }

  @Override
  public V value() {
    return value;
  }

  public void setValue(V value) {
    this.value = checkNotNull(value, "value");
  }

  @Override
  public ImmutableList<P> inputPorts() {
    return inputPorts;
  }

  @Override
  public ImmutableList<P> outputPorts() {
    return outputPorts;
  }

  public void setInputPorts(Iterable<? extends P> ports) {
    ImmutableList<P> replacement = ImmutableList.copyOf(ports);
    checkArgument(replacement.size() == inputPorts.size(),
            "Cannot change the number of input ports (%s -> %s)", inputPorts.size(), replacement.size());
    inputPorts = replacement;
  }

  public void setOutputPorts(Iterable<? extends P> ports) {
    ImmutableList<P> replacement = ImmutableList.copyOf(ports);
    checkArgument(replacement.size() == outputPorts.size(),
            "Cannot change the number of output ports (%s -> %s)", outputPorts.size(), replacement.size());
    outputPorts = replacement;
  }

  @Override
  public <R> R visit(Function<? super Box<V, P>, R> onBox, Function<? super WiringDiagram<V, P>, R> onDiagram) {
    return onDiagram.apply(this);
  }

  public int addBox(AbstractBox<V, P> box) {
    checkArgument(box != this, "A diagram cannot contain itself");
    int id = nextBoxId++;
    boxes.put(id, checkNotNull(box, "box"));
    return id;
  }

  public AbstractBox<V, P> box(int id) {
    AbstractBox<V, P> box = boxes.get(id);
    checkArgument(box != null, "No box with id %s", id);
    return box;
  }

  public boolean hasBox(int id) {
    return boxes.containsKey(id);
  }

  /**
   * Removes the box and every wire attached to it.
   */
  public AbstractBox<V, P> removeBox(int id) {
    AbstractBox<V, P> removed = box(id);
    boxes.remove(id);
    wires.removeIf(wire -> wire.touches(id));
    return removed;
  }

  public List<Integer> boxIds() {
    return ImmutableList.copyOf(boxes.keySet());
  }

  public Collection<AbstractBox<V, P>> boxes() {
    return Collections.unmodifiableCollection(boxes.values());
  }

  public int boxCount() {
    return boxes.size();
  }

  /**
   * Replaces the value of the box with the given id. Atomic boxes are replaced by an updated copy; nested diagrams
   * are updated in place.
   */
  public void updateBoxValue(int id, UnaryOperator<V> update) {
    AbstractBox<V, P> updated = box(id).visit(
            box -> box.withValue(update.apply(box.value())),
            diagram -> {
              diagram.setValue(update.apply(diagram.value()));
              return diagram;
            }
    );
    boxes.put(id, updated);
  }

  /**
   * Applies {@code update} to the value of every box in this diagram (but not to boxes nested more deeply).
   */
  public void updateBoxValues(UnaryOperator<V> update) {
    for (Integer id : boxIds()) {
      updateBoxValue(id, update);
    }
  }

  public void addWire(Port source, Port target) {
    addWire(Wire.of(source, target));
  }

  public void addWire(Wire wire) {
    checkArgument(wire.source().box() != OUTPUT_ID, "Wire cannot start at an output of the diagram: %s", wire);
    checkArgument(wire.target().box() != INPUT_ID, "Wire cannot end at an input of the diagram: %s", wire);
    checkPort(wire.source(), wire.source().box() == INPUT_ID ? inputPorts : sourcePortsOf(wire.source().box()), wire);
    checkPort(wire.target(), wire.target().box() == OUTPUT_ID ? outputPorts : targetPortsOf(wire.target().box()), wire);
    wires.add(wire);
  }

  public void addWires(Iterable<Wire> wires) {
    wires.forEach(this::addWire);
  }

  public Set<Wire> wires() {
    return Collections.unmodifiableSet(wires);
  }

  public Stream<Wire> inWires(int boxId) {
    return wires.stream().filter(wire -> wire.target().box() == boxId);
  }

  public Stream<Wire> outWires(int boxId) {
    return wires.stream().filter(wire -> wire.source().box() == boxId);
  }

  /**
   * Inlines each of the given nested-diagram boxes, in order. Each nested diagram's boxes are added to this diagram
   * (under fresh ids), and wires passing through its boundary are joined with the wires that were attached to it.
   * Boxes nested more than one level deep are not inlined.
   */
  public void substitute(Iterable<Integer> ids) {
    for (Integer id : ids) {
      substitute(id);
    }
  }

  public void substitute(int id) {
    WiringDiagram<V, P> sub = box(id).visit(
            box -> {
              throw new IllegalArgumentException("Box " + id + " is not a wiring diagram: " + box);
            },
            diagram -> diagram
    );
    checkArgument(wires.stream().noneMatch(wire -> wire.source().box() == id && wire.target().box() == id),
            "Cannot substitute box %s: it is wired to itself", id);

    ListMultimap<Integer, Port> outerSources = ArrayListMultimap.create();
    ListMultimap<Integer, Port> outerTargets = ArrayListMultimap.create();
    inWires(id).forEach(wire -> outerSources.put(wire.target().index(), wire.source()));
    outWires(id).forEach(wire -> outerTargets.put(wire.source().index(), wire.target()));

    removeBox(id);

    Map<Integer, Integer> renumbered = new HashMap<>();
    sub.boxes.forEach((subId, box) -> renumbered.put(subId, addBox(box)));

    for (Wire wire : sub.wires) {
      List<Port> sources = wire.source().box() == INPUT_ID
              ? outerSources.get(wire.source().index())
              : ImmutableList.of(Port.of(renumbered.get(wire.source().box()), wire.source().index()));
      List<Port> targets = wire.target().box() == OUTPUT_ID
              ? outerTargets.get(wire.target().index())
              : ImmutableList.of(Port.of(renumbered.get(wire.target().box()), wire.target().index()));
      for (Port source : sources) {
        for (Port target : targets) {
          wires.add(Wire.of(source, target));
        }
      }
    }
  }

  private List<P> sourcePortsOf(int boxId) {
    return box(boxId).outputPorts();
  }

  private List<P> targetPortsOf(int boxId) {
    return box(boxId).inputPorts();
  }

  private static void checkPort(Port port, List<?> ports, Wire wire) {
    checkArgument(port.index() < ports.size(), "Port %s out of range (%s ports) for wire %s", port, ports.size(), wire);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("value", value)
            .add("inputs", inputPorts)
            .add("outputs", outputPorts)
            .add("boxes", boxes)
            .add("wires", wires.stream()
                    .map(wire -> wire.source().box() + ":" + wire.source().index()
                            + "->" + wire.target().box() + ":" + wire.target().index())
                    .collect(Collectors.joining(", ", "[", "]")))
            .toString();
  }
}
