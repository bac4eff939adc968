package com.consullo.autoinject.inject;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.event.AutomationEvents;
import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.exec.TaskScheduler;
import com.consullo.autoinject.queue.HistoryEntry;
import com.consullo.autoinject.queue.Message;
import com.consullo.autoinject.queue.MessageHistory;
import com.consullo.autoinject.session.SessionChannel;
import com.consullo.autoinject.session.SessionRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Types messages into sessions one character at a time.
 *
 * <p>Each injection is an {@link InjectionTask} stepping through
 * {@code TYPING -> SUBMITTING -> SETTLING -> DONE}, one scheduled step at a time. The target
 * session is busy from the first character until the task is done, whether it succeeded, failed
 * or was cancelled.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class Injector {

  private static final Logger LOGGER = LoggerFactory.getLogger(Injector.class);

  private final TaskScheduler scheduler;
  private final SessionRegistry registry;
  private final MessageHistory history;
  private final AutomationEvents events;
  private final ActionLog actionLog;
  private final PacingPolicy pacing;

  private final Map<Integer, InjectionTask> active = new LinkedHashMap<>();
  private final Map<InjectionTask, Consumer<InjectionResult>> callbacks = new LinkedHashMap<>();
  private boolean paused;
  private long injectedCount;

  public Injector(final TaskScheduler scheduler, final SessionRegistry registry, final MessageHistory history,
      final AutomationEvents events, final ActionLog actionLog, final PacingPolicy pacing) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(history, "history must not be null");
    Validate.notNull(events, "events must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    Validate.notNull(pacing, "pacing must not be null");
    this.scheduler = scheduler;
    this.registry = registry;
    this.history = history;
    this.events = events;
    this.actionLog = actionLog;
    this.pacing = pacing;
  }

  /**
   * Starts typing a message into its target session.
   *
   * @param message message to type
   * @param onComplete called once when the session is released again
   * @throws IllegalStateException if the target session already has an injection in flight
   */
  public void inject(final Message message, final Consumer<InjectionResult> onComplete) {
    Validate.notNull(message, "message must not be null");
    Validate.notNull(onComplete, "onComplete must not be null");
    final int sessionId = message.targetSessionId();

    final Optional<SessionChannel> channel = registry.channel(sessionId);
    if (channel.isEmpty()) {
      actionLog.error("Cannot inject message " + message.id() + ": session " + sessionId + " is not open");
      deliver(onComplete, InjectionResult.failed(message.id(), sessionId, "session not open"));
      return;
    }

    registry.beginInjection(sessionId);
    final InjectionTask task = new InjectionTask(message, channel.get());
    active.put(sessionId, task);
    callbacks.put(task, onComplete);
    LOGGER.debug("Injecting message {} into session {}", message.id(), sessionId);
    step(task);
  }

  private void step(final InjectionTask task) {
    task.pending(Cancellable.NONE);
    if (task.step() == InjectionStep.DONE) {
      return;
    }
    if (task.token().isCancelled()) {
      finish(task, InjectionResult.failed(task.message().id(), task.message().targetSessionId(), "cancelled"));
      return;
    }
    try {
      switch (task.step()) {
        case TYPING:
          type(task);
          break;
        case SUBMITTING:
          submit(task);
          break;
        case SETTLING:
          finish(task, InjectionResult.ok(task.message().id(), task.message().targetSessionId()));
          break;
        default:
          break;
      }
    } catch (final IOException e) {
      actionLog.error("Failed to inject message " + task.message().id() + " into session "
          + task.message().targetSessionId() + ": " + e.getMessage());
      finish(task, InjectionResult.failed(task.message().id(), task.message().targetSessionId(), e.getMessage()));
    }
  }

  private void type(final InjectionTask task) throws IOException {
    if (paused) {
      task.parked(true);
      return;
    }
    if (task.hasMoreText()) {
      task.channel().write(task.nextChunk());
    }
    if (task.hasMoreText()) {
      later(task, pacing.charDelay());
    } else {
      task.step(InjectionStep.SUBMITTING);
      later(task, pacing.preSubmitDelay());
    }
  }

  private void submit(final InjectionTask task) throws IOException {
    task.channel().write(SessionChannel.SUBMIT);
    injectedCount++;
    final HistoryEntry entry = history.record(task.message());
    events.messageInjected(entry);
    actionLog.success("Injected message " + task.message().id() + " into session "
        + task.message().targetSessionId() + ": " + task.message().preview());
    task.step(InjectionStep.SETTLING);
    later(task, pacing.settleDelay());
  }

  private void later(final InjectionTask task, final Duration delay) {
    task.pending(scheduler.schedule(() -> step(task), delay));
  }

  private void finish(final InjectionTask task, final InjectionResult result) {
    if (task.step() == InjectionStep.DONE) {
      return;
    }
    task.step(InjectionStep.DONE);
    task.cancelPending();
    final int sessionId = task.message().targetSessionId();
    if (active.get(sessionId) == task) {
      active.remove(sessionId);
    }
    registry.endInjection(sessionId);
    deliver(callbacks.remove(task), result);
  }

  private void deliver(final Consumer<InjectionResult> callback, final InjectionResult result) {
    if (callback == null) {
      return;
    }
    try {
      callback.accept(result);
    } catch (final RuntimeException e) {
      LOGGER.warn("Injection completion handler failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Stops typing between characters. Submits and settles already under way complete.
   */
  public void pause() {
    paused = true;
  }

  /**
   * Continues parked injections from their next character.
   */
  public void resume() {
    if (!paused) {
      return;
    }
    paused = false;
    for (final InjectionTask task : new ArrayList<>(active.values())) {
      if (task.isParked()) {
        task.parked(false);
        later(task, Duration.ZERO);
      }
    }
  }

  public boolean isPaused() {
    return paused;
  }

  /**
   * Cancels every in-flight injection. Characters already written stay written.
   *
   * @return number of injections cancelled
   */
  public int cancelAll() {
    final List<InjectionTask> tasks = new ArrayList<>(active.values());
    for (final InjectionTask task : tasks) {
      task.token().cancel();
      finish(task, InjectionResult.failed(task.message().id(), task.message().targetSessionId(), "cancelled"));
    }
    paused = false;
    return tasks.size();
  }

  public int activeCount() {
    return active.size();
  }

  /**
   * Messages submitted since start.
   *
   * @return count
   */
  public long injectedCount() {
    return injectedCount;
  }
}
