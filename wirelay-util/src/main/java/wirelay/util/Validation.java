package wirelay.util;

import com.google.common.base.Strings;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every failed check on an input, so that all of them are reported in one exception.
 * <pre>{@code
 * Validation.success()
 *     .confirm(size > 0, "size must be positive: %s", size)
 *     .confirm(pad >= 0, "pad must be non-negative: %s", pad)
 *     .throwIllegalArguments();
 * }</pre>
 * Not thread-safe; intended to be used within a single expression as above.
 */
public final class Validation {
  private final List<String> errors = new ArrayList<>();

  private Validation() {
  }

  public static Validation success() {
    return new Validation();
  }

  /**
   * Records {@code message}, formatted with {@link Strings#lenientFormat}, unless {@code condition} holds.
   */
  public Validation confirm(boolean condition, String message, Object... args) {
    if (!condition) {
      errors.add(Strings.lenientFormat(message, args));
    }
    return this;
  }

  /**
   * @throws IllegalArgumentException listing every recorded failure, one per line, if there were any
   */
  public void throwIllegalArguments() {
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException("Validation failure(s):\n" + String.join("\n", errors));
    }
  }
}
