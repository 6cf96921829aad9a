package io.qzss.dcragent.application.port;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.domain.report.Notification;

/**
 * <strong>What:</strong> Notification channel such as the report file, SMTP mail or the console.
 * <p><strong>Why:</strong> The dispatcher applies each channel's {@link DeliveryPolicy} uniformly and isolates
 * failures so one broken channel does not starve the others.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the supervisor thread only.</p>
 *
 * @since 0.1.0
 */
public interface NotificationSink {
  /**
   * Returns the channel name used in logs and metric keys.
   *
   * @return short lowercase name, e.g. {@code mail}
   */
  String channel();

  /**
   * Returns the delivery policy consulted before {@link #deliver(Notification)}.
   *
   * @return channel policy
   */
  DeliveryPolicy policy();

  /**
   * Delivers a notification the policy accepted.
   *
   * @param notification report, disposition and arrival time
   * @throws Exception if delivery fails; the dispatcher logs and continues with the next channel
   */
  void deliver(Notification notification) throws Exception;
}
