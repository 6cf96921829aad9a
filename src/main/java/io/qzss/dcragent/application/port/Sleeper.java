package io.qzss.dcragent.application.port;

import java.time.Duration;

/**
 * Blocking delay used for restart back-off; replaced by a recording fake in tests.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks the calling thread for {@code duration}.
   *
   * @param duration delay; zero returns immediately
   * @throws InterruptedException if interrupted while sleeping
   */
  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
