package com.consullo.autoinject.timer;

import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.exec.TaskScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Countdown that signals expiry to its listeners.
 *
 * <p>Phases: {@code IDLE -> ACTIVE -> EXPIRED}, with {@code PAUSED} between pause and resume. A
 * one-second tick decrements the value. In sync mode the value is additionally recomputed from the
 * tracked reset instant every sync interval; any manual start or edit leaves sync mode.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class TimerService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimerService.class);

  private static final Duration TICK = Duration.ofSeconds(1);

  private final TaskScheduler scheduler;
  private final Duration syncInterval;
  private final List<TimerListener> listeners = new CopyOnWriteArrayList<>();

  private TimerDuration defaultDuration;
  private TimerDuration remaining = TimerDuration.ZERO;
  private TimerPhase phase = TimerPhase.IDLE;
  private SyncSource syncSource = SyncSource.MANUAL;
  private Instant syncTarget;
  private Cancellable tickHandle = Cancellable.NONE;
  private Cancellable syncHandle = Cancellable.NONE;

  /**
   * Creates an idle timer.
   *
   * @param scheduler execution context
   * @param syncInterval period of the sync-mode recompute
   * @param defaultDuration value restored by {@link #reset()}
   */
  public TimerService(final TaskScheduler scheduler, final Duration syncInterval, final TimerDuration defaultDuration) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(syncInterval, "syncInterval must not be null");
    Validate.isTrue(!syncInterval.isNegative() && !syncInterval.isZero(), "syncInterval must be positive");
    this.scheduler = scheduler;
    this.syncInterval = syncInterval;
    this.defaultDuration = defaultDuration != null ? defaultDuration : TimerDuration.ZERO;
    this.remaining = this.defaultDuration;
  }

  public void addListener(final TimerListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public TimerState state() {
    return new TimerState(remaining, phase, syncSource, syncTarget);
  }

  public TimerDuration defaultDuration() {
    return defaultDuration;
  }

  public void setDefaultDuration(final TimerDuration duration) {
    this.defaultDuration = duration != null ? duration : TimerDuration.ZERO;
  }

  /**
   * Manual edit. Values are clamped to their clock ranges. Leaves sync mode; an expired timer
   * returns to idle.
   *
   * @param hours hours, clamped to 0..23
   * @param minutes minutes, clamped to 0..59
   * @param seconds seconds, clamped to 0..59
   */
  public void setDuration(final int hours, final int minutes, final int seconds) {
    leaveSync();
    this.remaining = new TimerDuration(hours, minutes, seconds);
    if (phase == TimerPhase.EXPIRED) {
      phase = TimerPhase.IDLE;
    }
    if (phase == TimerPhase.ACTIVE && remaining.isZero()) {
      expire();
      return;
    }
    changed();
  }

  /**
   * Starts counting down from the current value in manual mode.
   *
   * @throws IllegalStateException if the current value is zero
   */
  public void start() {
    if (remaining.isZero()) {
      throw new IllegalStateException("Cannot start timer with a zero duration");
    }
    leaveSync();
    if (phase == TimerPhase.ACTIVE) {
      return;
    }
    phase = TimerPhase.ACTIVE;
    startTicking();
    LOGGER.info("Timer started at {}", remaining.format());
    changed();
  }

  public void pause() {
    if (phase != TimerPhase.ACTIVE) {
      return;
    }
    tickHandle.cancel();
    phase = TimerPhase.PAUSED;
    changed();
  }

  public void resume() {
    if (phase != TimerPhase.PAUSED) {
      return;
    }
    phase = TimerPhase.ACTIVE;
    startTicking();
    changed();
  }

  /**
   * Zeroes the timer and returns it to idle.
   */
  public void stop() {
    tickHandle.cancel();
    leaveSync();
    remaining = TimerDuration.ZERO;
    phase = TimerPhase.IDLE;
    changed();
  }

  /**
   * Stops, then restores the default duration.
   */
  public void reset() {
    tickHandle.cancel();
    leaveSync();
    remaining = defaultDuration;
    phase = TimerPhase.IDLE;
    changed();
  }

  /**
   * Follows a usage-limit reset instant: sets the remaining time and starts in sync mode.
   * Refused while a manual countdown is running.
   *
   * @param resetInstant instant the limit lifts
   * @return true if the timer now follows the instant
   */
  public boolean syncTo(final Instant resetInstant) {
    Validate.notNull(resetInstant, "resetInstant must not be null");
    if (phase == TimerPhase.ACTIVE && syncSource == SyncSource.MANUAL) {
      LOGGER.info("Timer sync to {} skipped: manual countdown running", resetInstant);
      return false;
    }
    final TimerDuration left = remainingUntil(resetInstant);
    if (left.isZero()) {
      LOGGER.info("Timer sync to {} skipped: instant already passed", resetInstant);
      return false;
    }
    syncHandle.cancel();
    syncSource = SyncSource.USAGE_LIMIT_SYNC;
    syncTarget = resetInstant;
    remaining = left;
    if (phase != TimerPhase.ACTIVE) {
      phase = TimerPhase.ACTIVE;
      startTicking();
    }
    syncHandle = scheduler.scheduleAtFixedRate(this::recompute, syncInterval, syncInterval);
    LOGGER.info("Timer synced to usage-limit reset {} ({} left)", resetInstant, remaining.format());
    changed();
    return true;
  }

  void tick() {
    if (phase != TimerPhase.ACTIVE) {
      return;
    }
    if (syncSource == SyncSource.USAGE_LIMIT_SYNC && syncTarget != null) {
      remaining = remainingUntil(syncTarget);
    } else {
      remaining = remaining.minusOneSecond();
    }
    if (remaining.isZero()) {
      expire();
    } else {
      changed();
    }
  }

  private void recompute() {
    if (syncSource != SyncSource.USAGE_LIMIT_SYNC || syncTarget == null || phase != TimerPhase.ACTIVE) {
      syncHandle.cancel();
      return;
    }
    remaining = remainingUntil(syncTarget);
    if (remaining.isZero()) {
      expire();
    } else {
      changed();
    }
  }

  private void expire() {
    tickHandle.cancel();
    syncHandle.cancel();
    remaining = TimerDuration.ZERO;
    phase = TimerPhase.EXPIRED;
    LOGGER.info("Timer expired");
    final TimerState s = state();
    fire(l -> l.onStateChanged(s));
    fire(l -> l.onExpired(s));
  }

  private void startTicking() {
    tickHandle.cancel();
    tickHandle = scheduler.scheduleAtFixedRate(this::tick, TICK, TICK);
  }

  private void leaveSync() {
    syncHandle.cancel();
    syncSource = SyncSource.MANUAL;
    syncTarget = null;
  }

  private TimerDuration remainingUntil(final Instant target) {
    return TimerDuration.of(Duration.between(scheduler.clock().instant(), target));
  }

  private void changed() {
    final TimerState s = state();
    fire(l -> l.onStateChanged(s));
  }

  private void fire(final Consumer<TimerListener> call) {
    for (final TimerListener l : listeners) {
      try {
        call.accept(l);
      } catch (final RuntimeException e) {
        LOGGER.warn("Timer listener failed: {}", e.getMessage(), e);
      }
    }
  }
}
