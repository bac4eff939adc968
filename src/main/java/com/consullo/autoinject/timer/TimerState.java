package com.consullo.autoinject.timer;

import java.time.Instant;

/**
 * Immutable copy of the timer for display.
 *
 * @param remaining time left
 * @param phase lifecycle phase
 * @param syncSource origin of the value
 * @param syncTarget reset instant followed in sync mode, otherwise null
 * @since 1.0
 */
public record TimerState(TimerDuration remaining, TimerPhase phase, SyncSource syncSource, Instant syncTarget) {

  public boolean active() {
    return phase == TimerPhase.ACTIVE;
  }

  public boolean expired() {
    return phase == TimerPhase.EXPIRED;
  }

  public int hours() {
    return remaining.hours();
  }

  public int minutes() {
    return remaining.minutes();
  }

  public int seconds() {
    return remaining.seconds();
  }

  @Override
  public String toString() {
    return remaining.format() + " " + phase + (syncSource == SyncSource.USAGE_LIMIT_SYNC ? " (synced)" : "");
  }
}
