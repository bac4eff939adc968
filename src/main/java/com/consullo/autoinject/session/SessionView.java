package com.consullo.autoinject.session;

import com.consullo.autoinject.signal.SessionStatus;
import java.time.Instant;

/**
 * Read-only copy of a {@link SessionState}.
 *
 * @since 1.0
 */
public record SessionView(
    int sessionId,
    SessionPhase phase,
    SessionStatus status,
    boolean busy,
    boolean usageLimitReached,
    boolean awaitingContinue,
    boolean blocked,
    Instant lastUpdate) {
}
