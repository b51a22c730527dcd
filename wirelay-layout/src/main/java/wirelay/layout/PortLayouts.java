package wirelay.layout;

import com.google.common.collect.ImmutableList;
import wirelay.util.geometry.Vector2D;

import java.util.List;

public final class PortLayouts {
  private static final double TOLERANCE = 1e-9;

  private PortLayouts() {
  }

  /**
   * Lays out the ports of one kind along the corresponding edge of a box of the given size.
   * <p/>
   * Input ports sit on the upstream edge and output ports on the downstream edge, each with the edge's outward
   * normal. Along the secondary axis, the {@code k}-th of {@code n} ports sits at offset
   * {@code (2k - (n - 1)) * spacing / 2} from the box center, where {@code spacing} is
   * {@link LayoutOptions#portSpacing}: consecutive ports are exactly {@code spacing} apart and the offsets sum to zero.
   *
   * @throws DegenerateDiagramException if the box is smaller than {@link LayoutOptions#defaultBoxSize} for {@code n}
   * ports along the secondary axis
   */
  public static <V> ImmutableList<PortLayout<V>> layoutPorts(
          PortKind kind,
          List<? extends V> values,
          Vector2D boxSize,
          LayoutOptions options
  ) {
    Orientation orientation = options.orientation();
    int n = values.size();
    double required = orientation.secondary(options.defaultBoxSize(n, n));
    if (orientation.secondary(boxSize) + TOLERANCE < required) {
      throw new DegenerateDiagramException("Box of size %s is too small for %s %s ports (needs %s)",
              boxSize, n, kind, required);
    }

    int side = kind.sign() * orientation.sign();
    Vector2D normal = orientation.vector(side, 0);
    double edge = side * orientation.primary(boxSize) / 2;
    double spacing = options.portSpacing();

    ImmutableList.Builder<PortLayout<V>> ports = ImmutableList.builderWithExpectedSize(n);
    for (int k = 0; k < n; k++) {
      double offset = (2 * k - (n - 1)) * spacing / 2;
      ports.add(PortLayout.of(values.get(k), orientation.vector(edge, offset), normal));
    }
    return ports.build();
  }
}
