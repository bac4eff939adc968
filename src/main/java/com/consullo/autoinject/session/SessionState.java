package com.consullo.autoinject.session;

import com.consullo.autoinject.signal.SessionStatus;
import java.time.Duration;
import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * Mutable state of one session.
 *
 * <p>This record is the only place busy, usage-limit, blocked and responder flags live; every
 * component reads and transitions it through {@link SessionRegistry}. Instances are confined to
 * the automation execution context.
 *
 * @since 1.0
 */
public final class SessionState {

  private final int sessionId;
  private SessionStatus status = SessionStatus.READY;
  private Instant statusSince;
  private Instant lastUpdate;
  private boolean busy;
  private boolean usageLimitReached;
  private boolean awaitingContinue;
  private boolean blocked;
  private boolean responderArmed;
  private int notReadyChecks;

  SessionState(final int sessionId, final Instant createdAt) {
    this.sessionId = sessionId;
    this.statusSince = createdAt;
    this.lastUpdate = createdAt;
  }

  public int sessionId() {
    return sessionId;
  }

  public SessionStatus status() {
    return status;
  }

  public Instant lastUpdate() {
    return lastUpdate;
  }

  /**
   * Records a classification. The stability clock restarts only when the status changes.
   *
   * @param newStatus detector result
   * @param now current time
   */
  void updateStatus(final SessionStatus newStatus, final Instant now) {
    Validate.notNull(newStatus, "newStatus must not be null");
    if (newStatus != this.status) {
      this.status = newStatus;
      this.statusSince = now;
    }
    this.lastUpdate = now;
  }

  /**
   * True when the session has been ready for at least {@code stability}, is not busy and not
   * blocked.
   *
   * @param now current time
   * @param stability required continuous ready time
   * @return dispatch readiness
   */
  public boolean isReadyForDispatch(final Instant now, final Duration stability) {
    if (busy || blocked || status != SessionStatus.READY) {
      return false;
    }
    return !Duration.between(statusSince, now).minus(stability).isNegative();
  }

  public boolean isBusy() {
    return busy;
  }

  /**
   * Claims the single in-flight injection slot.
   *
   * @throws IllegalStateException if an injection is already in flight
   */
  void beginInjection() {
    if (busy) {
      throw new IllegalStateException("Session " + sessionId + " already has an injection in flight");
    }
    busy = true;
    notReadyChecks = 0;
  }

  void endInjection(final Instant now) {
    busy = false;
    // Output produced by our own typing must settle again before the next dispatch.
    statusSince = now;
  }

  public boolean isUsageLimitReached() {
    return usageLimitReached;
  }

  public boolean isAwaitingContinue() {
    return awaitingContinue;
  }

  void markUsageLimit() {
    usageLimitReached = true;
    awaitingContinue = true;
  }

  void clearUsageLimit() {
    usageLimitReached = false;
    awaitingContinue = false;
  }

  public boolean isBlocked() {
    return blocked;
  }

  void setBlocked(final boolean blocked) {
    this.blocked = blocked;
  }

  public boolean isResponderArmed() {
    return responderArmed;
  }

  void setResponderArmed(final boolean armed) {
    this.responderArmed = armed;
  }

  int incrementNotReadyChecks() {
    return ++notReadyChecks;
  }

  void resetNotReadyChecks() {
    notReadyChecks = 0;
  }

  public int notReadyChecks() {
    return notReadyChecks;
  }

  /**
   * Clears every transient flag. Usage-limit flags are kept unless {@code includeUsageLimit}.
   */
  void neutralize(final Instant now, final boolean includeUsageLimit) {
    busy = false;
    blocked = false;
    responderArmed = false;
    notReadyChecks = 0;
    status = SessionStatus.READY;
    statusSince = now;
    lastUpdate = now;
    if (includeUsageLimit) {
      clearUsageLimit();
    }
  }

  public SessionPhase phase() {
    if (busy) {
      return SessionPhase.INJECTING;
    }
    if (blocked) {
      return SessionPhase.BLOCKED;
    }
    if (awaitingContinue) {
      return SessionPhase.AWAITING_CONTINUE;
    }
    switch (status) {
      case RUNNING:
        return SessionPhase.RUNNING;
      case PROMPTING:
        return SessionPhase.PROMPTING;
      default:
        return SessionPhase.READY;
    }
  }

  /**
   * Immutable copy for display.
   *
   * @return view
   */
  public SessionView view() {
    return new SessionView(sessionId, phase(), status, busy, usageLimitReached, awaitingContinue, blocked, lastUpdate);
  }

  @Override
  public String toString() {
    return "SessionState{id=" + sessionId + ", phase=" + phase() + '}';
  }
}
