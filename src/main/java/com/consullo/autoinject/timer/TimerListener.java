package com.consullo.autoinject.timer;

/**
 * Observer of {@link TimerService}.
 *
 * @since 1.0
 */
public interface TimerListener {

  /**
   * Called after every change, including each tick.
   *
   * @param state new state
   */
  default void onStateChanged(TimerState state) {
  }

  /**
   * Called exactly once per countdown when it reaches zero.
   *
   * @param state expired state
   */
  default void onExpired(TimerState state) {
  }
}
