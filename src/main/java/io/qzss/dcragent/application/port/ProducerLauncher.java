package io.qzss.dcragent.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Port spawning the external producer whose output carries QZSS messages.
 *
 * @since 0.1.0
 * @see io.qzss.dcragent.infrastructure.process.OsProducerLauncher
 */
public interface ProducerLauncher {
  /**
   * Starts the producer.
   *
   * @param command program and arguments; non-empty
   * @return running process handle
   * @throws IOException if the program cannot be started
   */
  ProducerProcess start(List<String> command) throws IOException;
}
