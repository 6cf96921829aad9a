package io.qzss.dcragent.testutil;

import io.qzss.dcragent.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;

/** Clock moved by hand. */
public final class MutableClock implements ClockPort {
  private Instant now;

  public MutableClock(Instant start) {
    this.now = start;
  }

  @Override
  public Instant now() {
    return now;
  }

  public void advance(Duration duration) {
    now = now.plus(duration);
  }

  public void set(Instant instant) {
    now = instant;
  }
}
