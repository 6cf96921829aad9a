package io.qzss.dcragent.domain.report;

import java.time.Instant;
import java.util.Objects;

/**
 * Report remembered by the duplicate cache together with its arrival time.
 *
 * @param arrival wall-clock time the report was first received
 * @param report cached report
 * @since 0.1.0
 */
public record CacheEntry(Instant arrival, Report report) {
  public CacheEntry {
    Objects.requireNonNull(arrival, "arrival");
    Objects.requireNonNull(report, "report");
  }
}
