package io.qzss.dcragent.api;

import io.qzss.dcragent.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into configuration overrides.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * <p>Values may themselves contain {@code '='}, as in {@code otelResourceAttributes=a=b}. An empty value is
   * kept so that {@code mail.id=} can clear a YAML setting.</p>
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException if an argument lacks {@code '='} or has an invalid name or value
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (key.startsWith("--")) {
        key = key.substring(2);
      }
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (Strings.containsControl(value)) {
      throw new IllegalArgumentException("argument " + key + " must not contain control characters");
    }
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }
}
