package com.consullo.autoinject.usage;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.signal.UsageLimitMatch;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Decides which usage-limit notices to act on.
 *
 * <p>The first accepted notice opens an auto-disable window. A notice arriving after the window
 * elapsed turns detection off until {@link #beginManualCycle()}. Each accepted notice starts a
 * cooldown during which repeats of the same on-screen text are ignored. Accepted notices flag the
 * session as awaiting a "continue" message.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class UsageLimitTracker {

  private final Clock clock;
  private final SessionRegistry registry;
  private final ActionLog actionLog;
  private final Duration autoDisableWindow;
  private final Duration minResetLead;
  private final Duration maxResetHorizon;

  private Duration cooldown;
  private Instant firstDetectedAt;
  private Instant cooldownUntil;
  private Instant resetInstant;
  private boolean suppressed;

  /**
   * Creates a tracker.
   *
   * @param clock time source; its zone interprets the announced reset hour
   * @param registry per-session state
   * @param actionLog user-facing log
   * @param cooldown window after an accepted notice during which repeats are ignored
   * @param autoDisableWindow time after the first notice after which detection turns off
   * @param minResetLead reset times closer than this are discarded
   * @param maxResetHorizon reset times further than this are discarded
   */
  public UsageLimitTracker(final Clock clock, final SessionRegistry registry, final ActionLog actionLog,
      final Duration cooldown, final Duration autoDisableWindow, final Duration minResetLead,
      final Duration maxResetHorizon) {
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    Validate.notNull(cooldown, "cooldown must not be null");
    Validate.notNull(autoDisableWindow, "autoDisableWindow must not be null");
    Validate.notNull(minResetLead, "minResetLead must not be null");
    Validate.notNull(maxResetHorizon, "maxResetHorizon must not be null");
    this.clock = clock;
    this.registry = registry;
    this.actionLog = actionLog;
    this.cooldown = cooldown;
    this.autoDisableWindow = autoDisableWindow;
    this.minResetLead = minResetLead;
    this.maxResetHorizon = maxResetHorizon;
  }

  /**
   * Handles one usage-limit notice seen in a session's output.
   *
   * @param sessionId session id
   * @param match parsed notice
   * @return decision and, when accepted, the resolved reset instant
   */
  public UsageLimitDetection onDetection(final int sessionId, final UsageLimitMatch match) {
    Validate.notNull(match, "match must not be null");
    final Instant now = clock.instant();

    if (suppressed) {
      return result(sessionId, UsageLimitOutcome.SUPPRESSED, null);
    }

    if (firstDetectedAt == null) {
      firstDetectedAt = now;
      actionLog.info("Usage limit detected in session " + sessionId + "; detection auto-disables after "
          + formatDuration(autoDisableWindow));
    } else if (!Duration.between(firstDetectedAt, now).minus(autoDisableWindow).isNegative()) {
      firstDetectedAt = null;
      suppressed = true;
      actionLog.info("Usage-limit detection disabled: " + formatDuration(autoDisableWindow)
          + " passed since the first detection. Start the timer to re-enable it.");
      return result(sessionId, UsageLimitOutcome.AUTO_DISABLED, null);
    }

    if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
      actionLog.info("Usage limit in session " + sessionId + " ignored: cooldown active for another "
          + formatDuration(Duration.between(now, cooldownUntil)));
      return result(sessionId, UsageLimitOutcome.COOLDOWN, null);
    }

    registry.markUsageLimit(sessionId);
    cooldownUntil = now.plus(cooldown);

    final Optional<Instant> reset = resolveResetInstant(match, now);
    if (reset.isEmpty()) {
      actionLog.warning("Usage limit in session " + sessionId + ": reset time " + match
          + " ignored as stale; session will get a continue message when the timer expires");
      return result(sessionId, UsageLimitOutcome.ACCEPTED_WITHOUT_RESET, null);
    }
    resetInstant = reset.get();
    actionLog.warning("Usage limit reached in session " + sessionId + "; resets at " + match + " ("
        + formatDuration(Duration.between(now, resetInstant)) + " from now)");
    return result(sessionId, UsageLimitOutcome.ACCEPTED, resetInstant);
  }

  /**
   * Turns an announced reset hour into an instant in the clock's zone, rolling to the next day
   * if the time already passed today. Instants nearer than the minimum lead or beyond the
   * horizon are discarded.
   *
   * @param match parsed notice
   * @param now current instant
   * @return reset instant, empty when discarded
   */
  public Optional<Instant> resolveResetInstant(final UsageLimitMatch match, final Instant now) {
    final ZonedDateTime zonedNow = now.atZone(clock.getZone());
    ZonedDateTime candidate = zonedNow.truncatedTo(ChronoUnit.DAYS).withHour(match.hourOfDay());
    if (!candidate.isAfter(zonedNow)) {
      candidate = candidate.plusDays(1);
    }
    final Duration lead = Duration.between(now, candidate.toInstant());
    if (lead.compareTo(minResetLead) < 0 || lead.compareTo(maxResetHorizon) > 0) {
      return Optional.empty();
    }
    return Optional.of(candidate.toInstant());
  }

  /**
   * Re-enables detection after the auto-disable window closed it.
   */
  public void beginManualCycle() {
    if (suppressed) {
      suppressed = false;
      actionLog.info("Usage-limit detection re-enabled");
    }
  }

  /**
   * Forgets all usage-limit state, including every session's flags.
   */
  public void reset() {
    firstDetectedAt = null;
    cooldownUntil = null;
    resetInstant = null;
    suppressed = false;
    registry.clearAllUsageLimits();
  }

  public void setCooldown(final Duration cooldown) {
    Validate.notNull(cooldown, "cooldown must not be null");
    this.cooldown = cooldown;
  }

  public UsageLimitRecord record() {
    return new UsageLimitRecord(firstDetectedAt, cooldownUntil, resetInstant, suppressed);
  }

  /**
   * One-line status for display.
   *
   * @return description
   */
  public String describe() {
    final Instant now = clock.instant();
    final StringBuilder sb = new StringBuilder("Usage limit: ");
    if (suppressed) {
      sb.append("detection disabled until the timer is started");
    } else if (firstDetectedAt == null) {
      sb.append("not detected");
    } else {
      sb.append("first detected ").append(formatDuration(Duration.between(firstDetectedAt, now))).append(" ago");
    }
    if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
      sb.append(", cooldown ").append(formatDuration(Duration.between(now, cooldownUntil))).append(" left");
    }
    if (resetInstant != null) {
      sb.append(", reset at ").append(resetInstant.atZone(clock.getZone()).toLocalTime());
    }
    sb.append(", awaiting continue: ").append(registry.awaitingContinueIds());
    return sb.toString();
  }

  private UsageLimitDetection result(final int sessionId, final UsageLimitOutcome outcome, final Instant reset) {
    return new UsageLimitDetection(sessionId, outcome, Optional.ofNullable(reset));
  }

  static String formatDuration(final Duration d) {
    final long totalMinutes = Math.max(0, d.toMinutes());
    final long hours = totalMinutes / 60;
    final long minutes = totalMinutes % 60;
    if (hours > 0) {
      return hours + "h " + minutes + "m";
    }
    if (minutes > 0) {
      return minutes + "m";
    }
    return Math.max(0, d.getSeconds()) + "s";
  }
}
