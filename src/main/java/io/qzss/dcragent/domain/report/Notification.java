package io.qzss.dcragent.domain.report;

import java.time.Instant;
import java.util.Objects;

/**
 * Report handed to the notification channels with its disposition and arrival time.
 *
 * @param report delivered report
 * @param disposition filter outcome
 * @param receivedAt arrival time of the report
 * @since 0.1.0
 */
public record Notification(Report report, Disposition disposition, Instant receivedAt) {
  public Notification {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(disposition, "disposition");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  /**
   * Returns the report's own event time, falling back to the arrival time.
   *
   * @return timestamp to show operators
   */
  public Instant eventTime() {
    return report.eventTime().orElse(receivedAt);
  }
}
