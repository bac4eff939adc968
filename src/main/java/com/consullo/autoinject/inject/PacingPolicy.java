package com.consullo.autoinject.inject;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Delays between the steps of typing a message.
 *
 * @since 1.0
 */
public interface PacingPolicy {

  /**
   * Pause after each typed character.
   *
   * @return delay
   */
  Duration charDelay();

  /**
   * Pause between the last character and the submit keystroke.
   *
   * @return delay
   */
  Duration preSubmitDelay();

  /**
   * Pause after submitting, before the session is released.
   *
   * @return delay
   */
  Duration settleDelay();

  /**
   * Constant delays.
   */
  static PacingPolicy fixed(final Duration charDelay, final Duration preSubmitDelay, final Duration settleDelay) {
    Validate.notNull(charDelay, "charDelay must not be null");
    Validate.notNull(preSubmitDelay, "preSubmitDelay must not be null");
    Validate.notNull(settleDelay, "settleDelay must not be null");
    return new PacingPolicy() {
      @Override
      public Duration charDelay() {
        return charDelay;
      }

      @Override
      public Duration preSubmitDelay() {
        return preSubmitDelay;
      }

      @Override
      public Duration settleDelay() {
        return settleDelay;
      }
    };
  }
}
