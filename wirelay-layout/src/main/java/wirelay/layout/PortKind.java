package wirelay.layout;

public enum PortKind {
  Input(-1),
  Output(1);

  private final int sign;

  PortKind(int sign) {
    this.sign = sign;
  }

  /**
   * Which side of a box, relative to the direction of flow, ports of this kind sit on.
   */
  public int sign() {
    return sign;
  }
}
