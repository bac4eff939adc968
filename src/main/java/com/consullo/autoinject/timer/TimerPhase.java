package com.consullo.autoinject.timer;

/**
 * Countdown lifecycle.
 *
 * @since 1.0
 */
public enum TimerPhase {
  IDLE,
  ACTIVE,
  PAUSED,
  EXPIRED
}
