package io.qzss.dcragent.validation;

import java.util.Objects;

/**
 * String sanitation for CLI arguments and configuration values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Returns the trimmed value, rejecting blanks and control characters.
   *
   * @param name option name used in error messages
   * @param value value to check
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Like {@link #requireNonBlank} but additionally restricted to printable ASCII and a maximum length.
   *
   * @param name option name used in error messages
   * @param value value to check
   * @param maxLength maximum length after trimming
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Reports whether {@code value} contains an ISO control character.
   *
   * @param value text to scan
   * @return {@code true} if any control character is present
   */
  public static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
