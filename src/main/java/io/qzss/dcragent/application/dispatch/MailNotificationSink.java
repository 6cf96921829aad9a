package io.qzss.dcragent.application.dispatch;

import io.qzss.dcragent.application.port.MailDeliveryException;
import io.qzss.dcragent.application.port.MailSender;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.domain.report.Notification;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mail channel: composes the message and hands it to a {@link MailSender}.
 *
 * @since 0.1.0
 */
public final class MailNotificationSink implements NotificationSink {
  private static final Logger log = LoggerFactory.getLogger(MailNotificationSink.class);

  private final MailSender sender;
  private final MailComposer composer;
  private final DeliveryPolicy policy;

  public MailNotificationSink(MailSender sender, MailComposer composer, DeliveryPolicy policy) {
    this.sender = Objects.requireNonNull(sender, "sender");
    this.composer = Objects.requireNonNull(composer, "composer");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  public String channel() {
    return "mail";
  }

  @Override
  public DeliveryPolicy policy() {
    return policy;
  }

  @Override
  public void deliver(Notification notification) throws MailDeliveryException {
    String subject = composer.subject(notification.report());
    sender.send(subject, composer.body(notification));
    log.info("Mail sent: {}", subject);
  }
}
