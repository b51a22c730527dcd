package wirelay.layout;

/**
 * Thrown when a wiring diagram handed to the layout engine directly, rather than built from a well-typed expression,
 * cannot be sized or placed: its port counts do not line up, it is combined with itself, or a box is too small for
 * its ports.
 */
public class DegenerateDiagramException extends RuntimeException {
  public DegenerateDiagramException(String format, Object... args) {
    super(String.format(format, args));
  }
}
