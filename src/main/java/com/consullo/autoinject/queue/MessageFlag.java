package com.consullo.autoinject.queue;

/**
 * Markers on a queued message.
 *
 * @since 1.0
 */
public enum MessageFlag {
  /** Synthetic "continue" message sent after a usage limit lifted. */
  AUTO_CONTINUE,
  /** Plan-mode prompt; no message is dispatched for a while after it completes. */
  PLAN_MODE
}
