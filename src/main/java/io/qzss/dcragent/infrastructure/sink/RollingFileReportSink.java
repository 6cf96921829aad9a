package io.qzss.dcragent.infrastructure.sink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.application.dispatch.ReportFormatter;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.domain.report.Notification;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Report file channel backed by a time-rotated Logback appender.
 * <p><strong>Why:</strong> Operators tail and archive the report file independently of the agent's diagnostic log,
 * so it gets its own non-additive logger and appender.</p>
 * <p><strong>Role:</strong> {@link NotificationSink} named {@code file}.</p>
 * <p><strong>Thread-safety:</strong> Logback appenders are thread-safe; {@link #close()} must run once.</p>
 *
 * @since 0.1.0
 */
public final class RollingFileReportSink implements NotificationSink, AutoCloseable {
  private static final AtomicInteger INSTANCES = new AtomicInteger();

  private final ReportFormatter formatter;
  private final DeliveryPolicy policy;
  private final RollingFileAppender<ILoggingEvent> appender;
  private final ch.qos.logback.classic.Logger reportLogger;

  /**
   * Opens the report file.
   *
   * @param file active report file
   * @param fileNamePattern Logback rollover pattern, e.g. {@code /var/log/qzssdcragent.log.%d{yyyy-ww}}
   * @param maxHistory number of archived files to keep
   * @param formatter separator and text rendering
   * @param policy channel delivery policy
   * @throws IllegalStateException if Logback is not the active SLF4J backend or the file cannot be opened
   */
  public RollingFileReportSink(
      Path file, String fileNamePattern, int maxHistory, ReportFormatter formatter, DeliveryPolicy policy) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(fileNamePattern, "fileNamePattern");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.policy = Objects.requireNonNull(policy, "policy");

    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      throw new IllegalStateException("Report file requires Logback; found " + factory.getClass().getName());
    }
    String name = "qzss.report." + INSTANCES.incrementAndGet();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%msg%n");
    encoder.setCharset(StandardCharsets.UTF_8);
    encoder.start();

    appender = new RollingFileAppender<>();
    appender.setContext(context);
    appender.setName(name);
    appender.setFile(file.toString());
    appender.setAppend(true);
    appender.setEncoder(encoder);

    TimeBasedRollingPolicy<ILoggingEvent> rolling = new TimeBasedRollingPolicy<>();
    rolling.setContext(context);
    rolling.setParent(appender);
    rolling.setFileNamePattern(fileNamePattern);
    rolling.setMaxHistory(maxHistory);
    rolling.start();
    appender.setRollingPolicy(rolling);
    appender.start();
    if (!appender.isStarted()) {
      throw new IllegalStateException("Unable to open report file " + file);
    }

    reportLogger = context.getLogger(name);
    reportLogger.setAdditive(false);
    reportLogger.setLevel(Level.INFO);
    reportLogger.addAppender(appender);
  }

  @Override
  public String channel() {
    return "file";
  }

  @Override
  public DeliveryPolicy policy() {
    return policy;
  }

  @Override
  public void deliver(Notification notification) {
    reportLogger.info("{}", formatter.format(notification));
  }

  /**
   * Records a raw QZSS packet ahead of decoding.
   *
   * @param hex packet as lowercase hex
   */
  public void writeRawPacket(String hex) {
    reportLogger.info("Raw packet: {}", hex);
  }

  @Override
  public void close() {
    reportLogger.detachAppender(appender);
    appender.stop();
  }
}
