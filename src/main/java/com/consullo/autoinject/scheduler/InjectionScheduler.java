package com.consullo.autoinject.scheduler;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.exec.TaskScheduler;
import com.consullo.autoinject.inject.InjectionResult;
import com.consullo.autoinject.inject.Injector;
import com.consullo.autoinject.notify.Notifier;
import com.consullo.autoinject.queue.Message;
import com.consullo.autoinject.queue.MessageFlag;
import com.consullo.autoinject.queue.MessageQueue;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.session.SessionState;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which queued message goes to which session, and when.
 *
 * <p>A selection pass skips busy sessions, picks for every other session its first due message in
 * delivery order and dispatches it if the session has been ready long enough. Messages not
 * dispatched are revisited by a wake-up scheduled at the earliest future execute time, or after
 * the safety-check interval when a session was not ready. After a plan-mode message completes no
 * message is dispatched until the plan-mode delay has passed. Passes do work only while draining:
 * draining starts with a timer expiry or a manual request and ends when the queue is empty, the
 * timer is stopped or injection is cancelled.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class InjectionScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(InjectionScheduler.class);

  /**
   * Readiness and wake-up tuning.
   *
   * @param readyStability continuous ready time required before dispatch
   * @param safetyCheckInterval delay before re-checking a session that was not ready
   * @param maxSafetyCheckAttempts failed checks between two stalled-session warnings
   * @param minWakeDelay floor of any scheduled wake-up
   * @param planModeDelay hold-off after a plan-mode message completes
   */
  public record Settings(Duration readyStability, Duration safetyCheckInterval, int maxSafetyCheckAttempts,
      Duration minWakeDelay, Duration planModeDelay) {

    public Settings {
      Validate.notNull(readyStability, "readyStability must not be null");
      Validate.notNull(safetyCheckInterval, "safetyCheckInterval must not be null");
      Validate.notNull(minWakeDelay, "minWakeDelay must not be null");
      Validate.notNull(planModeDelay, "planModeDelay must not be null");
      Validate.isTrue(maxSafetyCheckAttempts > 0, "maxSafetyCheckAttempts must be positive");
    }
  }

  private final TaskScheduler scheduler;
  private final MessageQueue queue;
  private final SessionRegistry registry;
  private final Injector injector;
  private final ActionLog actionLog;
  private final Notifier notifier;
  private final Map<Integer, Integer> missingSessionChecks = new HashMap<>();

  private Settings settings;
  private boolean running;
  private boolean draining;
  private Cancellable wake = Cancellable.NONE;
  private Instant wakeAt;
  private Instant planModeCompletedAt;
  private long passCount;

  public InjectionScheduler(final TaskScheduler scheduler, final MessageQueue queue, final SessionRegistry registry,
      final Injector injector, final ActionLog actionLog, final Notifier notifier, final Settings settings) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(queue, "queue must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(injector, "injector must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    Validate.notNull(notifier, "notifier must not be null");
    Validate.notNull(settings, "settings must not be null");
    this.scheduler = scheduler;
    this.queue = queue;
    this.registry = registry;
    this.injector = injector;
    this.actionLog = actionLog;
    this.notifier = notifier;
    this.settings = settings;
  }

  public void updateSettings(final Settings settings) {
    Validate.notNull(settings, "settings must not be null");
    this.settings = settings;
  }

  /**
   * Requests a selection pass. A request made while a pass is running is ignored; the running
   * pass schedules its own follow-up.
   *
   * @param source reason
   */
  public void requestPass(final TriggerSource source) {
    Validate.notNull(source, "source must not be null");
    if (source.startsDrain() && !draining) {
      draining = true;
      actionLog.info("Processing message queue (" + queue.size() + " queued, trigger " + source + ")");
    }
    runPass();
  }

  /**
   * Ends draining and drops the scheduled wake-up. In-flight injections continue.
   */
  public void stopDraining() {
    draining = false;
    cancelWake();
    missingSessionChecks.clear();
    planModeCompletedAt = null;
  }

  public boolean isDraining() {
    return draining;
  }

  /**
   * Time of the next scheduled pass.
   *
   * @return wake-up time, empty if none is scheduled
   */
  public Optional<Instant> nextWakeAt() {
    return Optional.ofNullable(wakeAt);
  }

  /**
   * End of the hold-off started by the last completed plan-mode message.
   *
   * @return hold-off end, empty if none is in effect
   */
  public Optional<Instant> planModeHoldUntil() {
    if (planModeCompletedAt == null) {
      return Optional.empty();
    }
    final Instant until = planModeCompletedAt.plus(settings.planModeDelay());
    return until.isAfter(scheduler.clock().instant()) ? Optional.of(until) : Optional.empty();
  }

  long passCount() {
    return passCount;
  }

  private void runPass() {
    if (running) {
      LOGGER.debug("Selection pass already running, trigger ignored");
      return;
    }
    running = true;
    try {
      selectAndDispatch();
    } finally {
      running = false;
    }
  }

  private void selectAndDispatch() {
    if (!draining) {
      return;
    }
    if (injector.isPaused()) {
      LOGGER.debug("Injection paused, pass skipped");
      return;
    }
    passCount++;
    cancelWake();

    final Instant now = scheduler.clock().instant();
    final Optional<Instant> holdUntil = planModeHoldUntil();
    if (holdUntil.isPresent()) {
      if (queue.isEmpty() && injector.activeCount() == 0) {
        finishDrain();
        return;
      }
      final Duration remaining = Duration.between(now, holdUntil.get());
      actionLog.info("Waiting " + ceilSeconds(remaining) + " more seconds before next injection (plan mode delay)");
      scheduleWakeIn(now, remaining);
      return;
    }
    final Set<Integer> busy = registry.busySessionIds();
    final Map<Integer, Message> candidates = queue.dueCandidates(now, busy);

    boolean waitingForReadiness = false;
    for (final Map.Entry<Integer, Message> e : candidates.entrySet()) {
      final int sessionId = e.getKey();
      final Message message = e.getValue();

      if (registry.channel(sessionId).isEmpty()) {
        waitingForReadiness = true;
        final int checks = missingSessionChecks.merge(sessionId, 1, Integer::sum);
        if (checks >= settings.maxSafetyCheckAttempts()) {
          actionLog.warning("Session " + sessionId + " is not open; message " + message.id() + " stays queued");
          missingSessionChecks.remove(sessionId);
        }
        continue;
      }
      missingSessionChecks.remove(sessionId);

      final SessionState state = registry.get(sessionId).orElseGet(() -> registry.open(sessionId));
      if (!state.isReadyForDispatch(now, settings.readyStability())) {
        waitingForReadiness = true;
        final int checks = registry.recordNotReady(sessionId);
        if (checks >= settings.maxSafetyCheckAttempts()) {
          actionLog.warning("Session " + sessionId + " not ready after " + checks + " checks ("
              + state.phase() + "); message " + message.id() + " stays queued");
          registry.resetNotReady(sessionId);
        }
        continue;
      }

      dispatch(message);
    }

    if (queue.isEmpty() && injector.activeCount() == 0) {
      finishDrain();
      return;
    }
    scheduleWake(now, busy, waitingForReadiness);
  }

  private void dispatch(final Message message) {
    final int sessionId = message.targetSessionId();
    registry.resetNotReady(sessionId);
    // Removed and persisted before typing starts: a crash mid-injection loses the message rather than repeating it.
    queue.remove(message.id());
    LOGGER.debug("Dispatching message {} to session {}", message.id(), sessionId);
    injector.inject(message, result -> onInjectionComplete(message, result));
  }

  private void onInjectionComplete(final Message message, final InjectionResult result) {
    if (!result.success()) {
      LOGGER.debug("Message {} was not delivered: {}", result.messageId(), result.error());
    } else if (message.hasFlag(MessageFlag.PLAN_MODE)) {
      planModeCompletedAt = scheduler.clock().instant();
      actionLog.info("Plan mode injection completed; next injection in " + ceilSeconds(settings.planModeDelay())
          + " seconds");
    }
    if (draining) {
      // Deferred so a pass is never nested inside the injector's own cleanup.
      scheduler.execute(() -> requestPass(TriggerSource.INJECTION_COMPLETE));
    }
  }

  private void scheduleWake(final Instant now, final Set<Integer> busy, final boolean waitingForReadiness) {
    Duration delay = null;
    for (final Message m : queue.all()) {
      if (busy.contains(m.targetSessionId()) || !m.executeAt().isAfter(now)) {
        continue;
      }
      final Duration untilDue = Duration.between(now, m.executeAt());
      if (delay == null || untilDue.compareTo(delay) < 0) {
        delay = untilDue;
      }
    }
    if (waitingForReadiness && (delay == null || settings.safetyCheckInterval().compareTo(delay) < 0)) {
      delay = settings.safetyCheckInterval();
    }
    if (delay == null) {
      // Only busy sessions have work; their completion triggers the next pass.
      return;
    }
    scheduleWakeIn(now, delay);
  }

  private void scheduleWakeIn(final Instant now, final Duration delay) {
    final Duration floored = delay.compareTo(settings.minWakeDelay()) < 0 ? settings.minWakeDelay() : delay;
    wakeAt = now.plus(floored);
    wake = scheduler.schedule(() -> {
      wakeAt = null;
      requestPass(TriggerSource.WAKE);
    }, floored);
  }

  private static long ceilSeconds(final Duration d) {
    return (d.toMillis() + 999) / 1000;
  }

  private void cancelWake() {
    wake.cancel();
    wake = Cancellable.NONE;
    wakeAt = null;
  }

  private void finishDrain() {
    draining = false;
    missingSessionChecks.clear();
    actionLog.success("Message queue processed");
    try {
      notifier.notify("Queue complete", "All queued messages have been sent");
    } catch (final RuntimeException e) {
      LOGGER.warn("Notification failed: {}", e.getMessage(), e);
    }
  }
}
