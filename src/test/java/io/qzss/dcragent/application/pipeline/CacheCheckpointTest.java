package io.qzss.dcragent.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.qzss.dcragent.application.dedup.DedupCache;
import io.qzss.dcragent.application.port.CacheStore;
import io.qzss.dcragent.domain.report.CacheEntry;
import io.qzss.dcragent.testutil.MutableClock;
import io.qzss.dcragent.testutil.RecordingMetrics;
import io.qzss.dcragent.testutil.Reports;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CacheCheckpointTest {
  private static final Logger CHECKPOINT_LOGGER = (Logger) LoggerFactory.getLogger(CacheCheckpoint.class);
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @BeforeAll
  static void silence() {
    CHECKPOINT_LOGGER.setLevel(Level.OFF);
  }

  @AfterAll
  static void restore() {
    CHECKPOINT_LOGGER.setLevel(null);
  }

  @Test
  void restoreEvictsExpiredEntries() {
    FakeStore store = new FakeStore();
    store.stored = List.of(
        new CacheEntry(NOW.minus(Duration.ofHours(25)), Reports.tsunami("old")),
        new CacheEntry(NOW.minus(Duration.ofHours(23)), Reports.tsunami("recent")));
    DedupCache cache = new DedupCache(Duration.ofHours(24));

    int kept = checkpoint(store, cache).restore();

    assertEquals(1, kept);
    assertFalse(cache.lookupOrInsert(Reports.tsunami("recent"), NOW));
    assertTrue(cache.lookupOrInsert(Reports.tsunami("old"), NOW));
  }

  @Test
  void unreadableDumpStartsEmpty() {
    FakeStore store = new FakeStore();
    store.loadFailure = new IOException("corrupt");
    DedupCache cache = new DedupCache(Duration.ofHours(24));

    assertEquals(0, checkpoint(store, cache).restore());
    assertEquals(0, cache.size());
  }

  @Test
  void dumpWritesSnapshotInArrivalOrder() {
    FakeStore store = new FakeStore();
    DedupCache cache = new DedupCache(Duration.ofHours(24));
    cache.lookupOrInsert(Reports.tsunami("a"), NOW);
    cache.lookupOrInsert(Reports.tsunami("b"), NOW.plusSeconds(1));

    assertTrue(checkpoint(store, cache).dump());
    assertEquals(cache.snapshot(), store.stored);
  }

  @Test
  void dumpFailureIsReportedNotThrown() {
    FakeStore store = new FakeStore();
    store.saveFailure = new IOException("disk full");
    RecordingMetrics metrics = new RecordingMetrics();
    CacheCheckpoint checkpoint =
        new CacheCheckpoint(store, new DedupCache(Duration.ofHours(1)), new MutableClock(NOW), metrics);

    assertFalse(checkpoint.dump());
    assertEquals(1, metrics.count("agent.cache.dump.failed"));
  }

  private static CacheCheckpoint checkpoint(CacheStore store, DedupCache cache) {
    return new CacheCheckpoint(store, cache, new MutableClock(NOW), new RecordingMetrics());
  }

  private static final class FakeStore implements CacheStore {
    private List<CacheEntry> stored;
    private IOException loadFailure;
    private IOException saveFailure;

    @Override
    public Optional<List<CacheEntry>> load() throws IOException {
      if (loadFailure != null) {
        throw loadFailure;
      }
      return Optional.ofNullable(stored);
    }

    @Override
    public void save(List<CacheEntry> entries) throws IOException {
      if (saveFailure != null) {
        throw saveFailure;
      }
      stored = entries;
    }
  }
}
