package wirelay.layout;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.immutables.value.Value;
import wirelay.util.Validation;
import wirelay.util.geometry.Vector2D;

/**
 * Tunable parameters for {@link WiringDiagramLayout}. All lengths are dimensionless.
 * <p/>
 * Instances are validated when built: a non-positive {@link #baseBoxSize} or a negative padding is rejected with an
 * {@link IllegalArgumentException} that lists every violated constraint.
 * <p/>
 * Options may also be read from typesafe-config, under {@value #CONFIG_PATH}; see {@code reference.conf} for the
 * available keys and their defaults.
 */
@Value.Immutable
public abstract class LayoutOptions {
  public static final String CONFIG_PATH = "wirelay.layout";

  public static ImmutableLayoutOptions.Builder builder() {
    return ImmutableLayoutOptions.builder();
  }

  public static LayoutOptions defaults() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Reads options from the {@value #CONFIG_PATH} section of {@code config}, falling back to {@code reference.conf}
   * for missing keys.
   */
  public static LayoutOptions fromConfig(Config config) {
    Config layout = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
    return builder()
            .orientation(layout.getEnum(Orientation.class, "orientation"))
            .junctions(layout.getBoolean("junctions"))
            .baseBoxSize(layout.getDouble("base-box-size"))
            .sequencePad(layout.getDouble("sequence-pad"))
            .parallelPad(layout.getDouble("parallel-pad"))
            .build();
  }

  @Value.Default
  public Orientation orientation() {
    return Orientation.LeftToRight;
  }

  /**
   * Whether copy/merge points should be drawn as explicit junction boxes. None of the expression kinds handled by
   * {@link WiringDiagramLayout} produce junctions; the flag is carried through for renderers.
   */
  @Value.Default
  public boolean junctions() {
    return true;
  }

  @Value.Default
  public double baseBoxSize() {
    return 2;
  }

  /**
   * Gap between sequentially composed boxes.
   */
  @Value.Default
  public double sequencePad() {
    return 2;
  }

  /**
   * Gap between boxes in a monoidal product, and between adjacent ports on one side of a box.
   */
  @Value.Default
  public double parallelPad() {
    return 1;
  }

  /**
   * Distance between the centers of adjacent ports on one side of a box.
   */
  public double portSpacing() {
    return baseBoxSize() + parallelPad();
  }

  /**
   * The minimum size of a box with the given numbers of ports.
   * <p/>
   * The extent along the secondary axis is {@code n * base + (n - 1) * parallelPad}, with
   * {@code n = max(1, inputs, outputs)}: exactly the extent of a monoidal product of {@code n} single-port boxes.
   * Hence the size of a product of boxes depends only on the total number of ports, not on how they are grouped into
   * boxes.
   */
  public Vector2D defaultBoxSize(int inputs, int outputs) {
    int n = Math.max(1, Math.max(inputs, outputs));
    return orientation().vector(baseBoxSize(), n * baseBoxSize() + (n - 1) * parallelPad());
  }

  @Value.Check
  protected void validate() {
    Validation.success()
            .confirm(baseBoxSize() > 0 && Double.isFinite(baseBoxSize()), "base-box-size must be positive: %s", baseBoxSize())
            .confirm(sequencePad() >= 0 && Double.isFinite(sequencePad()), "sequence-pad must be non-negative: %s", sequencePad())
            .confirm(parallelPad() >= 0 && Double.isFinite(parallelPad()), "parallel-pad must be non-negative: %s", parallelPad())
            .throwIllegalArguments();
  }
}
