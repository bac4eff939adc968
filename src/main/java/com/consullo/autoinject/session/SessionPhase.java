package com.consullo.autoinject.session;

/**
 * Single summary of a session's state, in precedence order.
 *
 * @since 1.0
 */
public enum SessionPhase {
  INJECTING,
  BLOCKED,
  AWAITING_CONTINUE,
  RUNNING,
  PROMPTING,
  READY
}
