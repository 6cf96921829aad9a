package io.qzss.dcragent.domain.report;

import java.util.Locale;

/**
 * Output format of the producer subprocess.
 *
 * @since 0.1.0
 */
public enum SourceType {
  /** {@code gpsmon -a} dump carrying u-blox SFRBX frames as hex. */
  GPSMON,
  /** One pre-decoded report per line as a JSON object. */
  JSONL;

  /**
   * Parses a configuration value.
   *
   * @param value textual value such as {@code gpsmon} or {@code jsonl}; must not be {@code null}
   * @return matching source type
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static SourceType fromString(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "gpsmon", "ublox" -> GPSMON;
      case "jsonl", "json", "json-lines" -> JSONL;
      default -> throw new IllegalArgumentException(
          "source.type must be one of gpsmon or jsonl (was " + value + ")");
    };
  }
}
