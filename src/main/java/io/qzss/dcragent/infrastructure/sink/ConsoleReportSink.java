package io.qzss.dcragent.infrastructure.sink;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.application.dispatch.ReportFormatter;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.domain.report.Notification;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Console channel writing the report rendering to standard output.
 *
 * @since 0.1.0
 */
public final class ConsoleReportSink implements NotificationSink {
  private final PrintWriter out;
  private final ReportFormatter formatter;
  private final DeliveryPolicy policy;

  public ConsoleReportSink(ReportFormatter formatter, DeliveryPolicy policy) {
    this(new PrintWriter(new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8),
        true), formatter, policy);
  }

  public ConsoleReportSink(PrintWriter out, ReportFormatter formatter, DeliveryPolicy policy) {
    this.out = Objects.requireNonNull(out, "out");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  public String channel() {
    return "console";
  }

  @Override
  public DeliveryPolicy policy() {
    return policy;
  }

  @Override
  public void deliver(Notification notification) {
    out.println(formatter.format(notification));
    out.flush();
  }
}
