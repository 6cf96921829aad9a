package io.qzss.dcragent.application.dedup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.qzss.dcragent.domain.report.CacheEntry;
import io.qzss.dcragent.domain.report.Report;
import io.qzss.dcragent.testutil.Reports;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DedupCacheTest {
  private static final Instant T = Instant.parse("2024-06-01T12:00:00Z");

  @Test
  void secondIdenticalReportIsDuplicate() {
    DedupCache cache = new DedupCache(Duration.ofHours(24));
    Report report = Reports.tsunami("伊勢・三河湾");

    assertTrue(cache.lookupOrInsert(report, T));
    assertFalse(cache.lookupOrInsert(Reports.tsunami("伊勢・三河湾"), T.plusSeconds(30)));
    assertEquals(1, cache.size());
  }

  @Test
  void differentReportIsStoredSeparately() {
    DedupCache cache = new DedupCache(Duration.ofHours(24));

    assertTrue(cache.lookupOrInsert(Reports.tsunami("伊勢・三河湾"), T));
    assertTrue(cache.lookupOrInsert(Reports.tsunami("大阪府"), T));
    assertEquals(2, cache.size());
  }

  @Test
  void evictionDropsEntriesOlderThanValidity() {
    DedupCache cache = new DedupCache(Duration.ofHours(24));
    Report old = Reports.tsunami("old");
    Report recent = Reports.tsunami("recent");
    cache.lookupOrInsert(old, T.minus(Duration.ofHours(25)));
    cache.lookupOrInsert(recent, T.minus(Duration.ofHours(23)));

    assertEquals(1, cache.evictExpired(T));

    List<CacheEntry> left = cache.snapshot();
    assertEquals(1, left.size());
    assertEquals(recent, left.get(0).report());
    assertTrue(cache.lookupOrInsert(old, T), "evicted report is new again");
  }

  @Test
  void entryExactlyAtBoundaryIsKept() {
    DedupCache cache = new DedupCache(Duration.ofHours(24));
    cache.lookupOrInsert(Reports.tsunami("edge"), T.minus(Duration.ofHours(24)));

    assertEquals(0, cache.evictExpired(T));
    assertEquals(1, cache.size());
  }

  @Test
  void restoreReplacesContents() {
    DedupCache cache = new DedupCache(Duration.ofHours(1));
    cache.lookupOrInsert(Reports.tsunami("a"), T);

    cache.restore(List.of(new CacheEntry(T, Reports.tsunami("b")), new CacheEntry(T, Reports.tsunami("c"))));

    assertEquals(2, cache.size());
    assertTrue(cache.lookupOrInsert(Reports.tsunami("a"), T));
    assertFalse(cache.lookupOrInsert(Reports.tsunami("b"), T));
  }

  @Test
  void rejectsNonPositiveValidity() {
    assertThrows(IllegalArgumentException.class, () -> new DedupCache(Duration.ZERO));
  }
}
