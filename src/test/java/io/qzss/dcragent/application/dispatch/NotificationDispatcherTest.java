package io.qzss.dcragent.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.domain.report.Disposition;
import io.qzss.dcragent.domain.report.Notification;
import io.qzss.dcragent.testutil.RecordingMetrics;
import io.qzss.dcragent.testutil.Reports;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class NotificationDispatcherTest {
  private static final Logger DISPATCH_LOGGER = (Logger) LoggerFactory.getLogger(NotificationDispatcher.class);
  private static final DeliveryPolicy FILE = new DeliveryPolicy(true, false, true, true);
  private static final DeliveryPolicy MAIL = new DeliveryPolicy(true, false, true, false);
  private static Level originalLevel;

  @BeforeAll
  static void silence() {
    originalLevel = DISPATCH_LOGGER.getLevel();
    DISPATCH_LOGGER.setLevel(Level.OFF);
  }

  @AfterAll
  static void restore() {
    DISPATCH_LOGGER.setLevel(originalLevel);
  }

  @Test
  void filteredReportReachesFileButNotMail() {
    RecordingSink file = new RecordingSink("file", FILE);
    RecordingSink mail = new RecordingSink("mail", MAIL);
    RecordingMetrics metrics = new RecordingMetrics();
    NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(file, mail), metrics);

    int delivered = dispatcher.dispatch(notification(new Disposition(true, false, false)));

    assertEquals(1, delivered);
    assertEquals(1, file.received.size());
    assertTrue(mail.received.isEmpty());
    assertEquals(1, metrics.count("agent.dispatch.file.delivered"));
    assertEquals(1, metrics.count("agent.dispatch.mail.suppressed"));
  }

  @Test
  void failingChannelDoesNotBlockOthers() {
    RecordingSink mail = new RecordingSink("mail", MAIL);
    mail.failure = new IllegalStateException("smtp down");
    RecordingSink console = new RecordingSink("console", MAIL);
    RecordingMetrics metrics = new RecordingMetrics();
    NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(mail, console), metrics);

    int delivered = dispatcher.dispatch(notification(Disposition.ACCEPTED));

    assertEquals(1, delivered);
    assertEquals(1, console.received.size());
    assertEquals(1, metrics.count("agent.dispatch.mail.failed"));
  }

  @Test
  void interruptedDeliveryRestoresInterruptFlag() {
    RecordingSink mail = new RecordingSink("mail", MAIL);
    mail.failure = new InterruptedException("stop");
    NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(mail), new RecordingMetrics());

    try {
      assertEquals(0, dispatcher.dispatch(notification(Disposition.ACCEPTED)));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  private static Notification notification(Disposition disposition) {
    return new Notification(Reports.tsunami("伊勢・三河湾"), disposition, Instant.parse("2024-01-01T07:11:00Z"));
  }

  private static final class RecordingSink implements NotificationSink {
    private final String channel;
    private final DeliveryPolicy policy;
    private final List<Notification> received = new ArrayList<>();
    private Exception failure;

    RecordingSink(String channel, DeliveryPolicy policy) {
      this.channel = channel;
      this.policy = policy;
    }

    @Override
    public String channel() {
      return channel;
    }

    @Override
    public DeliveryPolicy policy() {
      return policy;
    }

    @Override
    public void deliver(Notification notification) throws Exception {
      if (failure != null) {
        throw failure;
      }
      received.add(notification);
    }
  }
}
