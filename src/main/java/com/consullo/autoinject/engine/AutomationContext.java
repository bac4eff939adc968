package com.consullo.autoinject.engine;

import com.consullo.autoinject.config.AutomationConfig;
import com.consullo.autoinject.config.JsonFiles;
import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.event.AutomationEvents;
import com.consullo.autoinject.exec.TaskScheduler;
import com.consullo.autoinject.inject.Injector;
import com.consullo.autoinject.inject.PacingPolicy;
import com.consullo.autoinject.inject.RandomPacingPolicy;
import com.consullo.autoinject.keyword.ContinuationResponder;
import com.consullo.autoinject.keyword.KeywordRuleEngine;
import com.consullo.autoinject.keyword.SignalSource;
import com.consullo.autoinject.notify.Notifier;
import com.consullo.autoinject.queue.MessageHistory;
import com.consullo.autoinject.queue.MessageQueue;
import com.consullo.autoinject.queue.QueueStore;
import com.consullo.autoinject.scheduler.InjectionScheduler;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.signal.SessionSignalDetector;
import com.consullo.autoinject.timer.TimerService;
import com.consullo.autoinject.usage.UsageLimitTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.apache.commons.lang3.Validate;

/**
 * The wired set of automation components.
 *
 * <p>Each component receives only the collaborators it needs at construction; this class is where
 * they are created and connected. Everything here is confined to the {@link TaskScheduler}.
 *
 * @since 1.0
 */
public final class AutomationContext {

  private final AutomationConfig config;
  private final TaskScheduler scheduler;
  private final ObjectMapper objectMapper;
  private final AutomationEvents events;
  private final ActionLog actionLog;
  private final SessionRegistry registry;
  private final SessionSignalDetector detector;
  private final KeywordRuleEngine keywordRules;
  private final UsageLimitTracker usageLimitTracker;
  private final TimerService timer;
  private final MessageQueue queue;
  private final MessageHistory history;
  private final Injector injector;
  private final ContinuationResponder responder;
  private final InjectionScheduler injectionScheduler;
  private final Notifier notifier;

  private AutomationContext(final Builder b) {
    this.config = b.config;
    this.scheduler = b.scheduler;
    this.notifier = b.notifier;
    this.objectMapper = b.objectMapper;

    final Clock clock = scheduler.clock();
    this.events = new AutomationEvents();
    this.actionLog = new ActionLog(clock, events);
    this.registry = new SessionRegistry(clock);
    this.detector = new SessionSignalDetector(config.signalPatterns(), config.outputWindowChars(),
        config.promptFallbackChars());
    this.keywordRules = new KeywordRuleEngine(objectMapper, config.keywordRules());
    this.usageLimitTracker = new UsageLimitTracker(clock, registry, actionLog, config.usageLimitCooldown(),
        config.autoDisableWindow(), config.minResetLead(), config.maxResetHorizon());
    this.timer = new TimerService(scheduler, config.timerSyncInterval(), config.timerDurationOnStart());
    this.queue = new MessageQueue(clock, b.queueStore, actionLog, events);
    this.history = new MessageHistory(clock, config.historyCapacity());
    final PacingPolicy pacing = b.pacing != null ? b.pacing : new RandomPacingPolicy(config);
    this.injector = new Injector(scheduler, registry, history, events, actionLog, pacing);
    this.responder = new ContinuationResponder(scheduler, registry, keywordRules, actionLog,
        new ContinuationResponder.Timing(config.autoContinueStabilization(), config.keywordStabilization(),
            config.submitDelay(), config.keywordSettleDelay(), config.autoContinueRearmDelay(),
            config.autoContinueKeystroke()),
        b.signalSource, config.autoContinueEnabled());
    this.injectionScheduler = new InjectionScheduler(scheduler, queue, registry, injector, actionLog, notifier,
        schedulerSettings(config));
  }

  static InjectionScheduler.Settings schedulerSettings(final AutomationConfig config) {
    return new InjectionScheduler.Settings(config.readyStability(), config.safetyCheckInterval(),
        config.maxSafetyCheckAttempts(), config.minWakeDelay(), config.planModeDelay());
  }

  public static Builder builder(final AutomationConfig config, final TaskScheduler scheduler) {
    return new Builder(config, scheduler);
  }

  public AutomationConfig config() {
    return config;
  }

  public TaskScheduler scheduler() {
    return scheduler;
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public AutomationEvents events() {
    return events;
  }

  public ActionLog actionLog() {
    return actionLog;
  }

  public SessionRegistry registry() {
    return registry;
  }

  public SessionSignalDetector detector() {
    return detector;
  }

  public KeywordRuleEngine keywordRules() {
    return keywordRules;
  }

  public UsageLimitTracker usageLimitTracker() {
    return usageLimitTracker;
  }

  public TimerService timer() {
    return timer;
  }

  public MessageQueue queue() {
    return queue;
  }

  public MessageHistory history() {
    return history;
  }

  public Injector injector() {
    return injector;
  }

  public ContinuationResponder responder() {
    return responder;
  }

  public InjectionScheduler injectionScheduler() {
    return injectionScheduler;
  }

  public Notifier notifier() {
    return notifier;
  }

  public static final class Builder {

    private final AutomationConfig config;
    private final TaskScheduler scheduler;
    private QueueStore queueStore = QueueStore.NONE;
    private Notifier notifier = Notifier.NONE;
    private PacingPolicy pacing;
    private ObjectMapper objectMapper;
    private SignalSource signalSource;

    private Builder(final AutomationConfig config, final TaskScheduler scheduler) {
      Validate.notNull(config, "config must not be null");
      Validate.notNull(scheduler, "scheduler must not be null");
      this.config = config;
      this.scheduler = scheduler;
    }

    public Builder queueStore(final QueueStore store) {
      this.queueStore = store != null ? store : QueueStore.NONE;
      return this;
    }

    public Builder notifier(final Notifier notifier) {
      this.notifier = notifier != null ? notifier : Notifier.NONE;
      return this;
    }

    public Builder pacing(final PacingPolicy pacing) {
      this.pacing = pacing;
      return this;
    }

    public Builder objectMapper(final ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * Source of fresh classifications used to confirm a prompt before answering it.
     */
    public Builder signalSource(final SignalSource source) {
      this.signalSource = source;
      return this;
    }

    public AutomationContext build() {
      if (objectMapper == null) {
        objectMapper = JsonFiles.objectMapper();
      }
      Validate.notNull(signalSource, "signalSource must not be null");
      return new AutomationContext(this);
    }
  }
}
