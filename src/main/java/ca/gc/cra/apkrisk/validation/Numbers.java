package ca.gc.cra.apkrisk.validation;

/**
 * Numeric range checks for CLI and YAML settings such as windows, timeouts and pool sizes.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value lies within an inclusive range.
   *
   * @param name parameter name for diagnostics; blank defaults to {@code "value"}
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and checks its range.
   *
   * @param name parameter name for diagnostics
   * @param raw textual value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    String text = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + text + "')", ex);
    }
    return requireRange(name, value, min, max);
  }
}
