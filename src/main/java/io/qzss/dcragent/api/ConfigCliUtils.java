package io.qzss.dcragent.api;

import io.qzss.dcragent.config.AgentConfig;
import java.nio.file.Path;
import java.util.Map;

/**
 * Maps CLI shortcuts onto configuration keys before they are merged with the YAML file.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from {@code args}.
   *
   * @param args mutable CLI map
   * @return configuration file to read; {@link AgentConfig#DEFAULT_CONFIG_PATH} when absent
   */
  static Path extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return AgentConfig.DEFAULT_CONFIG_PATH;
    }
    return Path.of(value.trim());
  }

  /**
   * Rewrites {@code report=}, {@code cache=} and the {@code --no-*} flags as configuration overrides.
   *
   * @param args mutable CLI map
   * @param input parsed command line
   */
  static void applyShortcuts(Map<String, String> args, AgentArgs input) {
    rename(args, "report", "report.path");
    rename(args, "cache", "cache.path");
    if (input.noReport()) {
      args.put("report.use", "false");
    }
    if (input.noLoadCache()) {
      args.put("cache.load", "false");
    }
    if (input.noDumpCache()) {
      args.put("cache.dump", "false");
    }
  }

  private static void rename(Map<String, String> args, String shortcut, String key) {
    String value = args.remove(shortcut);
    if (value != null && !args.containsKey(key)) {
      args.put(key, value);
    }
  }
}
