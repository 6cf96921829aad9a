package io.qzss.dcragent.application.dispatch;

import io.qzss.dcragent.domain.report.Disposition;
import java.util.Optional;

/**
 * Per-channel suppression rules layered over the shared {@link Disposition}.
 *
 * @param enabled channel switch
 * @param reportIncompleteInfo deliver partial multi-part transmissions
 * @param reportTraining deliver drills
 * @param ignoreFilter deliver reports the category filter rejected
 * @since 0.1.0
 */
public record DeliveryPolicy(
    boolean enabled, boolean reportIncompleteInfo, boolean reportTraining, boolean ignoreFilter) {

  /** Policy of a disabled channel. */
  public static final DeliveryPolicy DISABLED = new DeliveryPolicy(false, false, true, false);

  /**
   * Explains why the channel withholds a report.
   *
   * @param disposition filter outcome
   * @return first applicable reason, or empty when the report is delivered
   */
  public Optional<String> suppressionReason(Disposition disposition) {
    if (!enabled) {
      return Optional.of("channel disabled");
    }
    if (disposition.incomplete() && !reportIncompleteInfo) {
      return Optional.of("incomplete report");
    }
    if (disposition.training() && !reportTraining) {
      return Optional.of("training report");
    }
    if (disposition.filtered() && !ignoreFilter) {
      return Optional.of("filtered report");
    }
    return Optional.empty();
  }

  /**
   * Convenience inverse of {@link #suppressionReason(Disposition)}.
   *
   * @param disposition filter outcome
   * @return {@code true} when the channel delivers the report
   */
  public boolean allows(Disposition disposition) {
    return suppressionReason(disposition).isEmpty();
  }
}
