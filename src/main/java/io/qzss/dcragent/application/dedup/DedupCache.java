package io.qzss.dcragent.application.dedup;

import io.qzss.dcragent.domain.report.CacheEntry;
import io.qzss.dcragent.domain.report.Report;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Arrival-ordered cache of recently seen reports used to suppress re-delivery.
 * <p><strong>Why:</strong> Satellites rebroadcast the same report many times; operators must be notified once per
 * validity window.</p>
 * <p><strong>Role:</strong> Application state owned by {@code ReportPipeline}; persisted by
 * {@code CacheCheckpoint}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer "seen within the window?" with a linear scan over structurally equal reports.</li>
 *   <li>Evict from the head while the oldest entry is older than the window.</li>
 *   <li>Expose ordered snapshots for persistence and accept restored entries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Methods synchronize on the instance so the shutdown hook can snapshot while the
 * pipeline thread is still draining.</p>
 * <p><strong>Performance:</strong> Lookup is O(n) in cache size; n stays small at broadcast rates.</p>
 *
 * @since 0.1.0
 */
public final class DedupCache {
  private final Duration validity;
  private final Deque<CacheEntry> entries = new ArrayDeque<>();

  /**
   * Creates an empty cache.
   *
   * @param validity how long an entry suppresses equal reports; must be positive
   */
  public DedupCache(Duration validity) {
    this.validity = Objects.requireNonNull(validity, "validity");
    if (validity.isNegative() || validity.isZero()) {
      throw new IllegalArgumentException("validity must be positive");
    }
  }

  /**
   * Records {@code report} unless an equal report is already cached.
   *
   * @param report decoded report
   * @param now arrival time stored with a new entry
   * @return {@code true} when the report is new and was appended; {@code false} for a duplicate
   */
  public synchronized boolean lookupOrInsert(Report report, Instant now) {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(now, "now");
    for (CacheEntry entry : entries) {
      if (entry.report().equals(report)) {
        return false;
      }
    }
    entries.addLast(new CacheEntry(now, report));
    return true;
  }

  /**
   * Removes head entries whose age exceeds the validity window.
   *
   * @param now reference time
   * @return number of entries removed
   */
  public synchronized int evictExpired(Instant now) {
    Instant cutoff = now.minus(validity);
    int removed = 0;
    while (!entries.isEmpty() && entries.peekFirst().arrival().isBefore(cutoff)) {
      entries.removeFirst();
      removed++;
    }
    return removed;
  }

  /**
   * Returns the entries in arrival order.
   *
   * @return immutable copy; head first
   */
  public synchronized List<CacheEntry> snapshot() {
    return List.copyOf(entries);
  }

  /**
   * Replaces the cache contents with previously persisted entries.
   *
   * @param restored entries in arrival order
   */
  public synchronized void restore(List<CacheEntry> restored) {
    Objects.requireNonNull(restored, "restored");
    entries.clear();
    entries.addAll(restored);
  }

  public synchronized int size() {
    return entries.size();
  }

  public Duration validity() {
    return validity;
  }
}
