package wirelay.layout;

import wirelay.util.geometry.Vector2D;

/**
 * Direction of sequential flow in a laid-out diagram.
 * <p/>
 * The <em>primary</em> axis is the axis of sequential composition; the <em>secondary</em> axis, perpendicular to it,
 * is the axis along which monoidal products are stacked. Layout code works in (primary, secondary) magnitudes and
 * converts them to (x, y) with {@link #vector}.
 */
public enum Orientation {
  LeftToRight(true, 1),
  RightToLeft(true, -1),
  TopToBottom(false, 1),
  BottomToTop(false, -1);

  private final boolean horizontal;
  private final int sign;

  Orientation(boolean horizontal, int sign) {
    this.horizontal = horizontal;
    this.sign = sign;
  }

  public boolean isHorizontal() {
    return horizontal;
  }

  public boolean isVertical() {
    return !horizontal;
  }

  /**
   * +1 if sequential flow runs toward increasing coordinates (left-to-right, top-to-bottom), -1 otherwise.
   */
  public int sign() {
    return sign;
  }

  public Vector2D vector(double primary, double secondary) {
    return horizontal ? Vector2D.of(primary, secondary) : Vector2D.of(secondary, primary);
  }

  /**
   * Unit vector pointing in the direction of sequential flow.
   */
  public Vector2D primaryDirection() {
    return vector(sign, 0);
  }

  public Vector2D secondaryDirection() {
    return vector(0, 1);
  }

  public double primary(Vector2D vector) {
    return horizontal ? vector.x() : vector.y();
  }

  public double secondary(Vector2D vector) {
    return horizontal ? vector.y() : vector.x();
  }
}
