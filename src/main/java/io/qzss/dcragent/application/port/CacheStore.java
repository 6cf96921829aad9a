package io.qzss.dcragent.application.port;

import io.qzss.dcragent.domain.report.CacheEntry;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port persisting the duplicate cache across restarts.
 * <p><strong>Why:</strong> Without it a restarted agent would re-announce every report still being broadcast.</p>
 * <p><strong>Thread-safety:</strong> Called from the startup thread and the shutdown hook, never concurrently.</p>
 *
 * @since 0.1.0
 */
public interface CacheStore {
  /**
   * Loads the previously dumped entries in arrival order.
   *
   * @return entries, or empty when no dump exists
   * @throws IOException if the dump exists but cannot be read or parsed
   */
  Optional<List<CacheEntry>> load() throws IOException;

  /**
   * Replaces the dump with {@code entries}.
   *
   * @param entries entries in arrival order
   * @throws IOException if writing fails; an existing dump is left untouched
   */
  void save(List<CacheEntry> entries) throws IOException;
}
