package io.qzss.dcragent.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private static final Map<String, String> ALIASES = Map.of(
      "cache.validPeriodHour", "cache.validPeriodHours");

  private ConfigMerger() {}

  /**
   * Builds the effective key/value map.
   *
   * @param yaml flattened YAML entries, if a file was read
   * @param cli CLI {@code key=value} overrides
   * @param defaults default values
   * @param warn receives notices about overridden and unrecognised keys
   * @return immutable merged map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> sink = warn == null ? message -> { } : warn;
    Map<String, String> yamlCopy = canonicalize(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = canonicalize(cli == null ? Map.of() : cli);

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey())) {
        sink.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    Set<String> known = AgentConfig.knownKeys();
    for (String key : merged.keySet()) {
      if (!known.contains(key)) {
        sink.accept("Ignoring unrecognised configuration key: " + key);
      }
    }
    return Map.copyOf(merged);
  }

  private static Map<String, String> canonicalize(Map<String, String> source) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : source.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      out.put(ALIASES.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
    }
    return out;
  }
}
