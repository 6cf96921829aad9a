package io.qzss.dcragent.application.pipeline;

import io.qzss.dcragent.application.dedup.DedupCache;
import io.qzss.dcragent.application.port.CacheStore;
import io.qzss.dcragent.application.port.ClockPort;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.domain.report.CacheEntry;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores the duplicate cache at startup and dumps it at shutdown.
 *
 * <p>Both directions are best effort: an unreadable dump starts the agent with an empty cache, a failed dump is
 * logged and counted.</p>
 *
 * @since 0.1.0
 */
public final class CacheCheckpoint {
  private static final Logger log = LoggerFactory.getLogger(CacheCheckpoint.class);

  private final CacheStore store;
  private final DedupCache cache;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public CacheCheckpoint(CacheStore store, DedupCache cache, ClockPort clock, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Loads the dump into the cache and evicts entries that expired while the agent was down.
   *
   * @return number of entries kept
   */
  public int restore() {
    Optional<List<CacheEntry>> loaded;
    try {
      loaded = store.load();
    } catch (IOException ex) {
      log.warn("Cache restore failed; starting with an empty cache", ex);
      return 0;
    }
    if (loaded.isEmpty()) {
      log.info("No cache dump found");
      return 0;
    }
    cache.restore(loaded.get());
    int evicted = cache.evictExpired(clock.now());
    log.info("Cache restored: {} entries kept, {} expired", cache.size(), evicted);
    return cache.size();
  }

  /**
   * Writes the current cache contents.
   *
   * @return {@code true} on success
   */
  public boolean dump() {
    List<CacheEntry> entries = cache.snapshot();
    try {
      store.save(entries);
      log.info("Cache dumped: {} entries", entries.size());
      return true;
    } catch (IOException ex) {
      log.error("Cache dump failed", ex);
      metrics.increment("agent.cache.dump.failed");
      return false;
    }
  }
}
