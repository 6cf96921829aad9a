package io.qzss.dcragent.application.dispatch;

import io.qzss.dcragent.domain.report.Notification;
import io.qzss.dcragent.domain.report.Report;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the subject and body of a notification mail.
 *
 * <p>Extended messages use the fixed label of their category, prefixed with {@value #TRAINING_MARK} for drills.
 * JMA reports use their own header. The body is the report text, optionally without its leading header, followed by
 * a reception time line.</p>
 *
 * @since 0.1.0
 */
public final class MailComposer {
  static final String TRAINING_MARK = "【訓練】";
  private static final DateTimeFormatter RECEIVED_TIME = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

  private final boolean suppressHeaderFromText;
  private final ZoneId zone;

  public MailComposer(boolean suppressHeaderFromText, ZoneId zone) {
    this.suppressHeaderFromText = suppressHeaderFromText;
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public String subject(Report report) {
    Optional<String> label = report.category().mailLabel();
    if (label.isPresent()) {
      return report.training() ? TRAINING_MARK + label.get() : label.get();
    }
    return report.header();
  }

  public String body(Notification notification) {
    Report report = notification.report();
    String text = report.text();
    String header = report.header();
    if (suppressHeaderFromText && !header.isEmpty() && text.startsWith(header)) {
      text = text.substring(header.length());
    }
    String received = RECEIVED_TIME.format(notification.eventTime().atZone(zone));
    return text + "\n\n情報受信時刻: " + received + "\n";
  }
}
