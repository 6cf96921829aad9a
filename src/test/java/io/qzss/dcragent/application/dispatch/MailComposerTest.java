package io.qzss.dcragent.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Disposition;
import io.qzss.dcragent.domain.report.Notification;
import io.qzss.dcragent.domain.report.Report;
import io.qzss.dcragent.testutil.Reports;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class MailComposerTest {
  private static final ZoneId JST = ZoneId.of("Asia/Tokyo");
  private static final Instant RECEIVED = Instant.parse("2024-01-01T07:11:00Z");

  @Test
  void jmaSubjectIsHeaderAndBodyDropsIt() {
    MailComposer composer = new MailComposer(true, JST);
    Report report = Reports.tsunami("伊勢・三河湾");

    assertEquals("津波警報", composer.subject(report));
    assertEquals("\n発表時刻: 1日16時10分\n伊勢・三河湾\n\n情報受信時刻: 2024/01/01 16:10:00\n",
        composer.body(new Notification(report, Disposition.ACCEPTED, RECEIVED)));
  }

  @Test
  void headerKeptWhenSuppressionDisabled() {
    MailComposer composer = new MailComposer(false, JST);
    Report report = Reports.tsunami("伊勢・三河湾");

    String body = composer.body(new Notification(report, Disposition.ACCEPTED, RECEIVED));

    assertEquals(report.text() + "\n\n情報受信時刻: 2024/01/01 16:10:00\n", body);
  }

  @Test
  void extendedCategoriesUseLabelAndTrainingMark() {
    MailComposer composer = new MailComposer(true, JST);

    assertEquals("Jアラート", composer.subject(Reports.jAlert(false)));
    assertEquals("【訓練】Jアラート", composer.subject(Reports.jAlert(true)));
  }

  @Test
  void extendedReportDropsLeadingHeaderToo() {
    MailComposer composer = new MailComposer(true, JST);
    Report report = new Report(Category.J_ALERT, Reports.EVENT_TIME, "Jアラート", "Jアラート\n弾道ミサイル情報",
        0, false, null, List.of("東京都"));

    String body = composer.body(new Notification(report, Disposition.ACCEPTED, RECEIVED));

    assertEquals("Jアラート", composer.subject(report));
    assertEquals("\n弾道ミサイル情報\n\n情報受信時刻: 2024/01/01 16:10:00\n", body);
  }

  @Test
  void receivedTimeFallsBackToArrival() {
    MailComposer composer = new MailComposer(true, JST);
    Report report = Report.of(Category.OUTSIDE_JAPAN, "", "Tsunami information", List.of());

    String body = composer.body(new Notification(report, Disposition.ACCEPTED, RECEIVED));

    assertEquals("Tsunami information\n\n情報受信時刻: 2024/01/01 16:11:00\n", body);
  }
}
