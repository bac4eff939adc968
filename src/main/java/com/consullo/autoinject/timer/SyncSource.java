package com.consullo.autoinject.timer;

/**
 * Where the timer value comes from.
 *
 * @since 1.0
 */
public enum SyncSource {
  /** Counted down from a value set by the user. */
  MANUAL,
  /** Recomputed from a tracked usage-limit reset instant. */
  USAGE_LIMIT_SYNC
}
