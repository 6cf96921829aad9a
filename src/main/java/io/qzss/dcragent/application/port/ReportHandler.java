package io.qzss.dcragent.application.port;

import io.qzss.dcragent.domain.report.Report;

/**
 * Callback receiving each report a decoder extracts from the producer stream.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ReportHandler {
  /**
   * Processes one decoded report on the decoding thread.
   *
   * @param report decoded report; never {@code null}
   */
  void onReport(Report report);
}
