package io.qzss.dcragent.logging;

/**
 * Logging hygiene helpers: bounded payload dumps and secret redaction.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxChars} characters, noting the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to keep; must be positive
   * @return the original value, or its prefix followed by {@code "... (truncated, N chars)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + value.length() + " chars)";
  }

  /**
   * Renders a byte payload as lowercase hex, bounded like {@link #truncate(String, int)}.
   *
   * @param payload bytes; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of hex characters to keep
   * @return hex rendering
   */
  public static String hex(byte[] payload, int maxChars) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder sb = new StringBuilder(payload.length * 2);
    for (byte b : payload) {
      sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
    }
    return truncate(sb.toString(), maxChars);
  }

  /**
   * Returns the redaction placeholder for a secret, or an empty marker when nothing is set.
   *
   * @param value secret value; only its presence is inspected
   * @return {@code "[REDACTED]"} when {@code value} is non-empty, otherwise {@code "<unset>"}
   */
  public static String redact(String value) {
    if (value == null || value.isEmpty()) {
      return "<unset>";
    }
    return REDACTED_PLACEHOLDER;
  }
}
