package com.consullo.autoinject.usage;

/**
 * What the tracker did with one detection.
 *
 * @since 1.0
 */
public enum UsageLimitOutcome {
  /** Session flagged and a reset instant resolved. */
  ACCEPTED,
  /** Session flagged; the announced reset time was too close or too far to trust. */
  ACCEPTED_WITHOUT_RESET,
  /** Ignored: inside the cooldown window. */
  COOLDOWN,
  /** Ignored: the auto-disable window elapsed with this detection. Detection stays off. */
  AUTO_DISABLED,
  /** Ignored: detection is off until a new manual cycle. */
  SUPPRESSED;

  public boolean accepted() {
    return this == ACCEPTED || this == ACCEPTED_WITHOUT_RESET;
  }
}
