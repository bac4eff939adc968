package com.consullo.autoinject.usage;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of {@link UsageLimitTracker#onDetection}.
 *
 * @param sessionId session the notice came from
 * @param outcome decision
 * @param resetInstant resolved reset instant, only for {@link UsageLimitOutcome#ACCEPTED}
 * @since 1.0
 */
public record UsageLimitDetection(int sessionId, UsageLimitOutcome outcome, Optional<Instant> resetInstant) {
}
