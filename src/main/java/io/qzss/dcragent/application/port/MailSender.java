package io.qzss.dcragent.application.port;

/**
 * Port submitting a composed notification mail.
 *
 * @since 0.1.0
 * @see io.qzss.dcragent.infrastructure.mail.JakartaMailSender
 */
public interface MailSender {
  /**
   * Sends one plain-text mail to the configured recipient.
   *
   * @param subject subject line
   * @param body UTF-8 plain-text body
   * @throws MailDeliveryException if connecting, authenticating or sending fails
   */
  void send(String subject, String body) throws MailDeliveryException;
}
