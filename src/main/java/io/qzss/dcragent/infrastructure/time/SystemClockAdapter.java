package io.qzss.dcragent.infrastructure.time;

import io.qzss.dcragent.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link Clock}; the system UTC clock unless a fixed clock is supplied.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Instant now() {
    return clock.instant();
  }
}
