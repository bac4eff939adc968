package com.consullo.autoinject.engine;

import com.consullo.autoinject.config.AutomationConfig;
import com.consullo.autoinject.config.Preferences;
import com.consullo.autoinject.config.PreferencesStore;
import com.consullo.autoinject.event.ActionEvent;
import com.consullo.autoinject.event.AutomationEventListener;
import com.consullo.autoinject.exec.TaskScheduler;
import com.consullo.autoinject.inject.PacingPolicy;
import com.consullo.autoinject.keyword.KeywordRule;
import com.consullo.autoinject.keyword.KeywordStats;
import com.consullo.autoinject.notify.Notifier;
import com.consullo.autoinject.queue.Attachment;
import com.consullo.autoinject.queue.HistoryEntry;
import com.consullo.autoinject.queue.Message;
import com.consullo.autoinject.queue.MessageFlag;
import com.consullo.autoinject.queue.QueueStats;
import com.consullo.autoinject.queue.QueueStore;
import com.consullo.autoinject.scheduler.TriggerSource;
import com.consullo.autoinject.session.SessionChannel;
import com.consullo.autoinject.session.SessionOutputListener;
import com.consullo.autoinject.signal.SignalReport;
import com.consullo.autoinject.signal.UsageLimitMatch;
import com.consullo.autoinject.timer.TimerDuration;
import com.consullo.autoinject.timer.TimerListener;
import com.consullo.autoinject.timer.TimerState;
import com.consullo.autoinject.usage.UsageLimitDetection;
import com.consullo.autoinject.usage.UsageLimitOutcome;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the automation.
 *
 * <p>All public methods are thread-safe: each one hands its work to the {@link TaskScheduler} and
 * returns a future completed there. Session output arriving on transport threads is handed over
 * the same way, so the components behind this facade only ever run on one thread.
 *
 * <p>Output of a session is classified on every change. The status feeds dispatch readiness, a
 * usage-limit notice goes to the tracker (and a resolved reset instant to the timer), and prompt
 * signals go to the continuation responder. When the timer expires, sessions waiting for the usage
 * limit to lift get a "continue" message ahead of their queue, then the queue is drained.
 *
 * @since 1.0
 */
public final class AutomationEngine implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutomationEngine.class);

  private final AutomationContext context;
  private final PreferencesStore preferencesStore;
  private final SpecialCommands commands;
  private final Map<Integer, String> lastOutput = new HashMap<>();
  private final Map<Integer, SignalReport> lastReport = new HashMap<>();

  private Preferences preferences;

  private AutomationEngine(final Builder b) {
    this.preferencesStore = b.preferencesStore;
    this.preferences = b.preferences;
    this.context = AutomationContext.builder(b.config, b.scheduler)
        .queueStore(b.queueStore)
        .notifier(b.notifier)
        .pacing(b.pacing)
        .signalSource(this::freshReport)
        .build();
    this.commands = new SpecialCommands(context.usageLimitTracker(), context.actionLog());

    context.keywordRules().setChangeListener(rules -> savePreferences(preferences.withKeywordRules(rules)));
    context.responder().setOnReleased(() -> context.injectionScheduler().requestPass(TriggerSource.RELEASE));
    context.timer().addListener(new TimerListener() {
      @Override
      public void onStateChanged(final TimerState state) {
        context.events().timerStateChanged(state);
      }

      @Override
      public void onExpired(final TimerState state) {
        onTimerExpired();
      }
    });
  }

  /**
   * Starts building an engine. Stored preferences, if any, are overlaid on {@code config}.
   *
   * @param config base configuration
   * @param scheduler execution context
   * @return builder
   */
  public static Builder builder(final AutomationConfig config, final TaskScheduler scheduler) {
    return new Builder(config, scheduler);
  }

  /**
   * Loads the stored queue. Call once after construction.
   *
   * @return future completing with the number of restored messages
   */
  public CompletableFuture<Integer> start() {
    return call(() -> {
      final int restored = context.queue().load();
      if (restored > 0) {
        context.actionLog().info("Restored " + restored + " queued messages");
      }
      return restored;
    });
  }

  /**
   * Direct access to the wired components, for callers already on the execution context.
   *
   * @return context
   */
  public AutomationContext context() {
    return context;
  }

  public void addListener(final AutomationEventListener listener) {
    context.events().addListener(listener);
  }

  public void removeListener(final AutomationEventListener listener) {
    context.events().removeListener(listener);
  }

  /**
   * Starts tracking a session and listening to its output.
   *
   * @param channel session channel
   * @return future completing once attached
   */
  public CompletableFuture<Void> attachSession(final SessionChannel channel) {
    Validate.notNull(channel, "channel must not be null");
    return run(() -> {
      context.registry().attach(channel);
      channel.setOutputListener(new SessionOutputListener() {
        @Override
        public void onOutput(final int sessionId) {
          context.scheduler().execute(() -> onSessionOutput(sessionId));
        }

        @Override
        public void onClosed(final int sessionId) {
          context.scheduler().execute(() -> forgetSession(sessionId));
        }
      });
      context.actionLog().info("Session " + channel.id() + " attached");
      onSessionOutput(channel.id());
    });
  }

  /**
   * Closes a session and forgets its state. Its queued messages stay queued.
   *
   * @param sessionId session id
   * @return future completing once closed
   */
  public CompletableFuture<Void> closeSession(final int sessionId) {
    return run(() -> {
      final Optional<SessionChannel> channel = context.registry().channel(sessionId);
      forgetSession(sessionId);
      channel.ifPresent(SessionChannel::close);
    });
  }

  private void forgetSession(final int sessionId) {
    lastOutput.remove(sessionId);
    lastReport.remove(sessionId);
    if (context.registry().close(sessionId)) {
      context.actionLog().info("Session " + sessionId + " closed");
    }
  }

  /**
   * Classifies the session's current output and reacts to it. Runs on the execution context.
   *
   * @param sessionId session id
   */
  void onSessionOutput(final int sessionId) {
    final Optional<SessionChannel> channel = context.registry().channel(sessionId);
    if (channel.isEmpty()) {
      return;
    }
    final String output = channel.get().recentOutput(context.config().outputWindowChars());
    if (output.equals(lastOutput.get(sessionId))) {
      return;
    }
    lastOutput.put(sessionId, output);

    final SignalReport report = context.detector().analyze(output, context.keywordRules().rules());
    lastReport.put(sessionId, report);
    context.registry().updateStatus(sessionId, report.status());
    LOGGER.trace("Session {}: {}", sessionId, report);

    report.usageLimit().ifPresent(match -> onUsageLimit(sessionId, match));
    context.responder().onReport(sessionId, report);
  }

  private Optional<SignalReport> freshReport(final int sessionId) {
    final Optional<SessionChannel> channel = context.registry().channel(sessionId);
    if (channel.isEmpty()) {
      return Optional.empty();
    }
    final String output = channel.get().recentOutput(context.config().outputWindowChars());
    return Optional.of(context.detector().analyze(output, context.keywordRules().rules()));
  }

  private void onUsageLimit(final int sessionId, final UsageLimitMatch match) {
    final UsageLimitDetection detection = context.usageLimitTracker().onDetection(sessionId, match);
    if (detection.outcome() != UsageLimitOutcome.ACCEPTED) {
      return;
    }
    final Instant reset = detection.resetInstant().orElseThrow();
    context.timer().syncTo(reset);
    savePreferences(preferences.withLastUsageLimitReset(reset));
  }

  private void onTimerExpired() {
    context.actionLog().info("Timer expired");
    notifyUser("Timer expired", "Processing " + context.queue().size() + " queued messages");

    final Instant now = context.scheduler().clock().instant();
    for (final Integer sessionId : context.registry().awaitingContinueIds()) {
      final Instant executeAt = context.queue().earliestExecuteAt(sessionId)
          .map(first -> first.minusMillis(1))
          .filter(t -> t.isBefore(now))
          .orElse(now);
      context.queue().enqueueAt(context.config().continueMessageText(), sessionId, List.of(), executeAt,
          EnumSet.of(MessageFlag.AUTO_CONTINUE));
      context.registry().clearUsageLimit(sessionId);
      context.actionLog().info("Queued continue message for session " + sessionId + " after usage limit");
    }
    context.injectionScheduler().requestPass(TriggerSource.TIMER_EXPIRY);
  }

  /**
   * Queues text for a session, or runs it if it is a special command.
   *
   * @param text message text
   * @param sessionId target session
   * @param attachments files to reference ahead of the text
   * @param delay time before the message becomes due
   * @return the queued message, empty if the text was a command
   */
  public CompletableFuture<Optional<Message>> submit(final String text, final int sessionId,
      final List<Attachment> attachments, final Duration delay) {
    return submit(text, sessionId, attachments, delay, Set.of());
  }

  /**
   * Queues flagged text for a session, or runs it if it is a special command.
   *
   * @param text message text
   * @param sessionId target session
   * @param attachments files to reference ahead of the text
   * @param delay time before the message becomes due
   * @param flags markers, e.g. {@link MessageFlag#PLAN_MODE}
   * @return the queued message, empty if the text was a command
   */
  public CompletableFuture<Optional<Message>> submit(final String text, final int sessionId,
      final List<Attachment> attachments, final Duration delay, final Set<MessageFlag> flags) {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(flags, "flags must not be null");
    return call(() -> {
      if (commands.handle(text)) {
        return Optional.empty();
      }
      if (text.isBlank() && (attachments == null || attachments.isEmpty())) {
        return Optional.empty();
      }
      final Message m = context.queue().enqueue(text, sessionId, attachments, delay, flags);
      context.actionLog().info("Queued message " + m.id() + " for session " + sessionId + ": " + m.preview());
      context.injectionScheduler().requestPass(TriggerSource.ENQUEUE);
      return Optional.of(m);
    });
  }

  public CompletableFuture<Optional<Message>> submit(final String text, final int sessionId) {
    return submit(text, sessionId, List.of(), Duration.ZERO);
  }

  public CompletableFuture<Boolean> removeMessage(final long id) {
    return call(() -> context.queue().remove(id).isPresent());
  }

  public CompletableFuture<Boolean> updateMessage(final long id, final String content) {
    return call(() -> context.queue().updateContent(id, content));
  }

  public CompletableFuture<Boolean> moveMessageEarlier(final long id) {
    return call(() -> context.queue().moveEarlier(id));
  }

  public CompletableFuture<Boolean> moveMessageLater(final long id) {
    return call(() -> context.queue().moveLater(id));
  }

  public CompletableFuture<Integer> clearQueue() {
    return call(() -> {
      final int removed = context.queue().clear();
      context.actionLog().info("Cleared " + removed + " queued messages");
      return removed;
    });
  }

  public CompletableFuture<List<Message>> queuedMessages() {
    return call(() -> context.queue().all());
  }

  public CompletableFuture<QueueStats> queueStats() {
    return call(() -> context.queue().stats());
  }

  public CompletableFuture<List<HistoryEntry>> history() {
    return call(() -> context.history().entries());
  }

  /**
   * Sends due messages now instead of waiting for the timer.
   *
   * @return future completing after the first pass
   */
  public CompletableFuture<Void> drainNow() {
    return run(() -> context.injectionScheduler().requestPass(TriggerSource.MANUAL));
  }

  public CompletableFuture<Void> pauseInjection() {
    return run(() -> {
      context.injector().pause();
      context.actionLog().info("Injection paused");
    });
  }

  public CompletableFuture<Void> resumeInjection() {
    return run(() -> {
      context.injector().resume();
      context.actionLog().info("Injection resumed");
      context.injectionScheduler().requestPass(TriggerSource.RELEASE);
    });
  }

  /**
   * Stops typing, stops draining and returns every session to a neutral state. Bytes already
   * written are not taken back. The timer keeps running.
   *
   * @return future completing once cancelled
   */
  public CompletableFuture<Void> cancelInjection() {
    return run(() -> {
      final int cancelled = context.injector().cancelAll();
      context.responder().cancelAll();
      context.injectionScheduler().stopDraining();
      context.registry().neutralizeAll();
      context.actionLog().warning("Injection cancelled (" + cancelled + " in flight)");
    });
  }

  /**
   * {@link #cancelInjection()} plus clearing the cached classifications, so every session is
   * re-evaluated from its next output.
   *
   * @return future completing once reset
   */
  public CompletableFuture<Void> forceReset() {
    return run(() -> {
      context.injector().cancelAll();
      context.responder().cancelAll();
      context.injectionScheduler().stopDraining();
      context.registry().neutralizeAll();
      lastOutput.clear();
      lastReport.clear();
      context.actionLog().warning("Automation state force-reset");
    });
  }

  /**
   * Starts the countdown manually. Re-enables usage-limit detection if it had auto-disabled.
   *
   * @return future failing with {@link IllegalStateException} if the duration is zero
   */
  public CompletableFuture<Void> startTimer() {
    return run(() -> {
      context.timer().start();
      context.usageLimitTracker().beginManualCycle();
    });
  }

  public CompletableFuture<Void> setTimerDuration(final int hours, final int minutes, final int seconds) {
    return run(() -> {
      context.timer().setDuration(hours, minutes, seconds);
      context.usageLimitTracker().beginManualCycle();
      final TimerDuration d = context.timer().state().remaining();
      context.timer().setDefaultDuration(d);
      savePreferences(preferences.withTimerDuration(d));
    });
  }

  public CompletableFuture<Void> pauseTimer() {
    return run(() -> context.timer().pause());
  }

  public CompletableFuture<Void> resumeTimer() {
    return run(() -> context.timer().resume());
  }

  public CompletableFuture<Void> stopTimer() {
    return run(() -> {
      context.timer().stop();
      context.injectionScheduler().stopDraining();
    });
  }

  public CompletableFuture<Void> resetTimer() {
    return run(() -> {
      context.timer().reset();
      context.injectionScheduler().stopDraining();
    });
  }

  public CompletableFuture<Void> setAutoContinueEnabled(final boolean enabled) {
    return run(() -> {
      context.responder().setAutoContinueEnabled(enabled);
      savePreferences(preferences.withAutoContinueEnabled(enabled));
    });
  }

  public CompletableFuture<KeywordRule> addKeywordRule(final String keyword, final String response) {
    return call(() -> context.keywordRules().add(keyword, response));
  }

  public CompletableFuture<Boolean> removeKeywordRule(final String keyword) {
    return call(() -> context.keywordRules().remove(keyword));
  }

  public CompletableFuture<Boolean> updateKeywordResponse(final String keyword, final String response) {
    return call(() -> context.keywordRules().updateResponse(keyword, response));
  }

  public CompletableFuture<List<KeywordRule>> keywordRules() {
    return call(() -> context.keywordRules().rules());
  }

  public CompletableFuture<KeywordStats> keywordStats() {
    return call(() -> context.keywordRules().stats());
  }

  public CompletableFuture<String> exportKeywordRules() {
    return call(() -> context.keywordRules().exportJson());
  }

  public CompletableFuture<Integer> importKeywordRules(final String json, final boolean replace) {
    return call(() -> context.keywordRules().importJson(json, replace));
  }

  public CompletableFuture<EngineStatus> status() {
    return call(() -> new EngineStatus(
        context.registry().views(),
        context.queue().size(),
        context.timer().state(),
        context.injector().injectedCount(),
        context.injector().isPaused(),
        context.injectionScheduler().isDraining(),
        context.responder().isAutoContinueEnabled(),
        context.usageLimitTracker().record()));
  }

  public List<ActionEvent> recentActions() {
    return context.actionLog().recent();
  }

  /**
   * Closes every attached session.
   */
  @Override
  public void close() {
    run(() -> {
      for (final SessionChannel channel : List.copyOf(context.registry().channels())) {
        channel.close();
      }
    });
  }

  private void savePreferences(final Preferences updated) {
    this.preferences = updated;
    try {
      preferencesStore.save(updated);
    } catch (final IOException | RuntimeException e) {
      LOGGER.warn("Preferences persistence failed: {}", e.getMessage(), e);
      context.actionLog().error("Failed to save preferences: " + e.getMessage());
    }
  }

  private void notifyUser(final String title, final String body) {
    try {
      context.notifier().notify(title, body);
    } catch (final RuntimeException e) {
      LOGGER.warn("Notification failed: {}", e.getMessage(), e);
    }
  }

  private CompletableFuture<Void> run(final Runnable task) {
    return call(() -> {
      task.run();
      return null;
    });
  }

  private <T> CompletableFuture<T> call(final Callable<T> task) {
    final CompletableFuture<T> future = new CompletableFuture<>();
    context.scheduler().execute(() -> {
      try {
        future.complete(task.call());
      } catch (final Exception e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  public static final class Builder {

    private final TaskScheduler scheduler;
    private AutomationConfig config;
    private QueueStore queueStore = QueueStore.NONE;
    private PreferencesStore preferencesStore;
    private Notifier notifier = Notifier.NONE;
    private PacingPolicy pacing;
    private Preferences preferences;

    private Builder(final AutomationConfig config, final TaskScheduler scheduler) {
      Validate.notNull(config, "config must not be null");
      Validate.notNull(scheduler, "scheduler must not be null");
      this.config = config;
      this.scheduler = scheduler;
    }

    public Builder queueStore(final QueueStore store) {
      this.queueStore = store;
      return this;
    }

    public Builder preferencesStore(final PreferencesStore store) {
      this.preferencesStore = store;
      return this;
    }

    public Builder notifier(final Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    public Builder pacing(final PacingPolicy pacing) {
      this.pacing = pacing;
      return this;
    }

    /**
     * Builds the engine, reading stored preferences first. A failing preferences store is logged
     * and the base configuration is used.
     *
     * @return engine
     */
    public AutomationEngine build() {
      if (preferencesStore == null) {
        preferencesStore = new InMemoryPreferencesStore();
      }
      Optional<Preferences> stored = Optional.empty();
      try {
        stored = preferencesStore.load();
      } catch (final IOException | RuntimeException e) {
        LOGGER.warn("Could not load preferences, using defaults: {}", e.getMessage(), e);
      }
      if (stored.isPresent()) {
        config = config.withPreferences(stored.get());
        preferences = stored.get();
      } else {
        preferences = Preferences.from(config);
      }
      return new AutomationEngine(this);
    }
  }

  /**
   * Keeps preferences for the lifetime of the process only.
   */
  private static final class InMemoryPreferencesStore implements PreferencesStore {

    private Preferences stored;

    @Override
    public Optional<Preferences> load() {
      return Optional.ofNullable(stored);
    }

    @Override
    public void save(final Preferences preferences) {
      this.stored = preferences;
    }
  }
}
