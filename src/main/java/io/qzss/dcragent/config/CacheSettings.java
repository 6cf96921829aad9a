package io.qzss.dcragent.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Duplicate cache settings.
 *
 * @param path dump file
 * @param validity how long a report suppresses its duplicates
 * @param load restore the dump at startup
 * @param dump write the dump at shutdown
 * @since 0.1.0
 */
public record CacheSettings(Path path, Duration validity, boolean load, boolean dump) {
  public CacheSettings {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(validity, "validity");
  }
}
