package io.qzss.dcragent.infrastructure.mail;

import io.qzss.dcragent.application.port.MailDeliveryException;
import io.qzss.dcragent.application.port.MailSender;
import io.qzss.dcragent.config.MailSettings;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;

/**
 * <strong>What:</strong> {@link MailSender} submitting plain-text UTF-8 mail over SMTP with Jakarta Mail.
 * <p><strong>Transport:</strong> implicit TLS when {@code ssl} is set, otherwise plain SMTP upgraded with STARTTLS
 * when {@code tls} is set. Authentication is used whenever an account id is configured.</p>
 * <p><strong>Thread-safety:</strong> A new connection is opened per message; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class JakartaMailSender implements MailSender {
  private final MailSettings settings;
  private final Session session;

  public JakartaMailSender(MailSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.session = Session.getInstance(sessionProperties(settings));
  }

  static Properties sessionProperties(MailSettings settings) {
    Properties props = new Properties();
    String timeout = Long.toString(settings.timeout().toMillis());
    props.put("mail.transport.protocol", "smtp");
    props.put("mail.smtp.host", settings.host());
    props.put("mail.smtp.port", Integer.toString(settings.port()));
    props.put("mail.smtp.auth", Boolean.toString(settings.authenticated()));
    props.put("mail.smtp.connectiontimeout", timeout);
    props.put("mail.smtp.timeout", timeout);
    props.put("mail.smtp.writetimeout", timeout);
    if (settings.ssl()) {
      props.put("mail.smtp.ssl.enable", "true");
      props.put("mail.smtp.ssl.checkserveridentity", "true");
    } else if (settings.tls()) {
      props.put("mail.smtp.starttls.enable", "true");
      props.put("mail.smtp.starttls.required", "true");
    }
    return props;
  }

  @Override
  public void send(String subject, String body) throws MailDeliveryException {
    try {
      MimeMessage message = new MimeMessage(session);
      message.setFrom(new InternetAddress(settings.from()));
      message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(settings.address()));
      message.setSubject(subject, StandardCharsets.UTF_8.name());
      message.setText(body, StandardCharsets.UTF_8.name());
      message.setSentDate(new Date());
      if (settings.authenticated()) {
        Transport.send(message, settings.username(), settings.password());
      } else {
        Transport.send(message);
      }
    } catch (MessagingException ex) {
      throw new MailDeliveryException(
          "SMTP delivery to " + settings.host() + ":" + settings.port() + " failed: " + ex.getMessage(), ex);
    }
  }
}
