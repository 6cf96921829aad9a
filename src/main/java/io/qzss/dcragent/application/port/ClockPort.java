package io.qzss.dcragent.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the duplicate cache and notification channels.
 * <p><strong>Why:</strong> Cache expiry and mail timestamps depend on "now"; tests inject a fixed clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the shutdown hook reads the clock while the
 * pipeline is still running.</p>
 *
 * @implNote Default implementation delegates to {@link Instant#now()}.
 * @since 0.1.0
 * @see io.qzss.dcragent.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current wall-clock instant.
   *
   * @return current time; subject to system clock adjustments
   */
  Instant now();

  /** Default {@link ClockPort} using the JVM clock. */
  ClockPort SYSTEM = Instant::now;
}
