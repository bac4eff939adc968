package com.consullo.autoinject.testsupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Clock that only moves when told to.
 */
public final class MutableClock extends Clock {

  private final ZoneId zone;
  private Instant now;

  public MutableClock(final Instant start, final ZoneId zone) {
    this.now = start;
    this.zone = zone;
  }

  @Override
  public ZoneId getZone() {
    return zone;
  }

  @Override
  public Clock withZone(final ZoneId newZone) {
    return new MutableClock(now, newZone);
  }

  @Override
  public Instant instant() {
    return now;
  }

  public void set(final Instant instant) {
    this.now = instant;
  }

  public void advance(final Duration d) {
    this.now = now.plus(d);
  }
}
