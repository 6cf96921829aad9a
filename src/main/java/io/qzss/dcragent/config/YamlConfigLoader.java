package io.qzss.dcragent.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the agent YAML file and flattens it into dotted keys.
 *
 * <p>Nested mappings become {@code section.key}; sequences of scalars are joined with commas so keyword lists can be
 * written either as {@code regions: 東京都,大阪府} or as a YAML list.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Reads {@code path}.
   *
   * @param path YAML file
   * @return flattened entries, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or has an unsupported shape
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flattened);
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("YAML list for " + composite + " must contain scalars");
          }
          joined.add(item == null ? "" : item.toString());
        }
        target.put(composite, joined.toString());
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
