package io.qzss.dcragent.application.pipeline;

/**
 * Signals that the producer command could not be started at all.
 *
 * <p>Raised only for the first spawn attempt; a command that never starts would otherwise be retried forever.</p>
 *
 * @since 0.1.0
 */
public class ProducerSpawnException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProducerSpawnException(String message, Throwable cause) {
    super(message, cause);
  }
}
