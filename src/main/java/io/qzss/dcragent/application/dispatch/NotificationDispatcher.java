package io.qzss.dcragent.application.dispatch;

import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.domain.report.Notification;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fans a notification out to every configured channel.
 * <p><strong>Why:</strong> Channels decide independently; one failing or suppressing channel must not affect the
 * others.</p>
 * <p><strong>Role:</strong> Last stage of {@code ReportPipeline}.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the pipeline thread only.</p>
 * <p><strong>Observability:</strong> Emits {@code agent.dispatch.<channel>.delivered|suppressed|failed}.</p>
 *
 * @since 0.1.0
 */
public final class NotificationDispatcher {
  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationSink> sinks;
  private final MetricsPort metrics;

  public NotificationDispatcher(List<NotificationSink> sinks, MetricsPort metrics) {
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Offers {@code notification} to each channel in registration order.
   *
   * @param notification report with its disposition
   * @return number of channels that delivered it
   */
  public int dispatch(Notification notification) {
    int delivered = 0;
    for (NotificationSink sink : sinks) {
      String channel = sink.channel();
      Optional<String> reason = sink.policy().suppressionReason(notification.disposition());
      if (reason.isPresent()) {
        log.debug("{}: suppressed {} ({})", channel, notification.report().category(), reason.get());
        metrics.increment("agent.dispatch." + channel + ".suppressed");
        continue;
      }
      try {
        sink.deliver(notification);
        delivered++;
        metrics.increment("agent.dispatch." + channel + ".delivered");
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("{}: delivery interrupted", channel);
        metrics.increment("agent.dispatch." + channel + ".failed");
      } catch (Exception ex) {
        log.error("{}: delivery failed for {}", channel, notification.report().category(), ex);
        metrics.increment("agent.dispatch." + channel + ".failed");
      }
    }
    return delivered;
  }

  public List<NotificationSink> sinks() {
    return sinks;
  }
}
