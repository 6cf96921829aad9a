package io.qzss.dcragent.application.port;

/**
 * Signals that a notification mail could not be submitted to the SMTP server.
 *
 * @since 0.1.0
 */
public class MailDeliveryException extends Exception {
  private static final long serialVersionUID = 1L;

  public MailDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
