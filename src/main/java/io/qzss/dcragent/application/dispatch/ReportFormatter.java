package io.qzss.dcragent.application.dispatch;

import io.qzss.dcragent.domain.report.Notification;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders a notification for the report file and the console: a timestamped separator line followed by the
 * report text.
 *
 * @since 0.1.0
 */
public final class ReportFormatter {
  private static final DateTimeFormatter SEPARATOR_TIME = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

  private final ZoneId zone;

  public ReportFormatter(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Formats {@code notification}.
   *
   * @param notification delivered notification
   * @return separator line, newline and report text (without trailing newline)
   */
  public String format(Notification notification) {
    String when = SEPARATOR_TIME.format(notification.receivedAt().atZone(zone));
    return "---------- " + when + " ----------\n" + notification.report().text();
  }
}
