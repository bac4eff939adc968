package com.consullo.autoinject.usage;

import java.time.Instant;

/**
 * Global usage-limit bookkeeping.
 *
 * @param firstDetectedAt first accepted detection of the current auto-disable window, or null
 * @param cooldownUntil end of the current cooldown, or null
 * @param resetInstant last resolved reset instant, or null
 * @param suppressed true once the auto-disable window elapsed, until a new manual cycle
 * @since 1.0
 */
public record UsageLimitRecord(Instant firstDetectedAt, Instant cooldownUntil, Instant resetInstant, boolean suppressed) {

  public static final UsageLimitRecord EMPTY = new UsageLimitRecord(null, null, null, false);
}
