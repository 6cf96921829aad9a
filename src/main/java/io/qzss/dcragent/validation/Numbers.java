package io.qzss.dcragent.validation;

/**
 * Numeric range checks shared by configuration parsing.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies in {@code [min, max]}.
   *
   * @param name option name used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }
}
