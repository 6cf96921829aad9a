package io.qzss.dcragent.application.port;

/**
 * Signals that producer output could not be turned into a report.
 *
 * <p>Raised for malformed frames or lines. The supervisor treats it like a producer crash and restarts the
 * subprocess.</p>
 *
 * @since 0.1.0
 */
public class DecodeException extends Exception {
  private static final long serialVersionUID = 1L;

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
