package io.qzss.dcragent.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.application.dispatch.ReportFormatter;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Disposition;
import io.qzss.dcragent.domain.report.Notification;
import io.qzss.dcragent.domain.report.Report;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsoleReportSinkTest {

  @Test
  void printsSameRenderingAsReportFile() {
    StringWriter buffer = new StringWriter();
    ConsoleReportSink sink = new ConsoleReportSink(
        new PrintWriter(buffer), new ReportFormatter(ZoneOffset.UTC), new DeliveryPolicy(true, false, true, false));

    sink.deliver(new Notification(
        Report.of(Category.HYPOCENTER, "震源に関する情報", "震源に関する情報\n震源地: 能登半島", List.of()),
        Disposition.ACCEPTED,
        Instant.parse("2024-01-01T07:10:30Z")));

    assertEquals("console", sink.channel());
    assertEquals(
        "---------- 2024/01/01 07:10:30 ----------\n震源に関する情報\n震源地: 能登半島" + System.lineSeparator(),
        buffer.toString());
  }
}
