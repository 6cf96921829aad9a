package io.qzss.dcragent.application.port;

import java.io.InputStream;

/**
 * Handle to a running producer subprocess.
 *
 * @since 0.1.0
 */
public interface ProducerProcess extends AutoCloseable {
  /**
   * Returns the subprocess standard output.
   *
   * @return output stream; owned by this handle
   */
  InputStream stdout();

  boolean isAlive();

  /** Terminates the subprocess, escalating to a forced kill if it does not exit promptly. */
  void destroy();

  /** Releases the streams and terminates the subprocess if still alive. */
  @Override
  void close();
}
