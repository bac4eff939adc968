package com.consullo.autoinject.keyword;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.exec.TaskScheduler;
import com.consullo.autoinject.session.SessionChannel;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.session.SessionState;
import com.consullo.autoinject.signal.SignalReport;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers prompts found in session output.
 *
 * <p>A keyword rule match wins: the session is blocked, the rule's response is typed after a
 * short stabilization delay and the block is released after the settle delay. Only without a
 * keyword match, and with auto-continue enabled, a continuation prompt is answered with the
 * affirmative keystroke; the session then stays armed until the re-arm delay passes so a
 * re-rendered prompt is not answered twice.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class ContinuationResponder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContinuationResponder.class);

  /**
   * Timing of the responses.
   *
   * @param autoContinueStabilization wait before answering a continuation prompt
   * @param keywordStabilization wait before typing a keyword response
   * @param submitDelay wait between the response text and the submit keystroke
   * @param keywordSettleDelay wait before a keyword block is released
   * @param rearmDelay wait before auto-continue may fire again for the session
   * @param autoContinueKeystroke affirmative keystroke
   */
  public record Timing(Duration autoContinueStabilization, Duration keywordStabilization, Duration submitDelay,
      Duration keywordSettleDelay, Duration rearmDelay, String autoContinueKeystroke) {
  }

  private final TaskScheduler scheduler;
  private final SessionRegistry registry;
  private final KeywordRuleEngine rules;
  private final ActionLog actionLog;
  private final Timing timing;
  private final SignalSource signals;
  private final Map<Integer, Cancellable> pending = new HashMap<>();

  private boolean autoContinueEnabled;
  private Runnable onReleased = () -> {
  };

  public ContinuationResponder(final TaskScheduler scheduler, final SessionRegistry registry,
      final KeywordRuleEngine rules, final ActionLog actionLog, final Timing timing, final SignalSource signals,
      final boolean autoContinueEnabled) {
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(rules, "rules must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    Validate.notNull(timing, "timing must not be null");
    Validate.notNull(signals, "signals must not be null");
    this.scheduler = scheduler;
    this.registry = registry;
    this.rules = rules;
    this.actionLog = actionLog;
    this.timing = timing;
    this.signals = signals;
    this.autoContinueEnabled = autoContinueEnabled;
  }

  /**
   * Called when a session leaves the blocked state, so waiting work can be picked up.
   *
   * @param onReleased callback
   */
  public void setOnReleased(final Runnable onReleased) {
    Validate.notNull(onReleased, "onReleased must not be null");
    this.onReleased = onReleased;
  }

  public boolean isAutoContinueEnabled() {
    return autoContinueEnabled;
  }

  public void setAutoContinueEnabled(final boolean enabled) {
    this.autoContinueEnabled = enabled;
    actionLog.info("Auto-continue " + (enabled ? "enabled" : "disabled"));
  }

  /**
   * Reacts to a new classification of a session's output.
   *
   * @param sessionId session
   * @param report classification
   */
  public void onReport(final int sessionId, final SignalReport report) {
    final Optional<SessionState> state = registry.get(sessionId);
    if (state.isEmpty() || report.promptArea().isEmpty()) {
      return;
    }
    final SessionState s = state.get();
    if (s.isBusy() || s.isBlocked() || s.isResponderArmed()) {
      return;
    }

    final Optional<KeywordRule> keyword = report.keywordMatch();
    if (keyword.isPresent()) {
      respondToKeyword(sessionId, keyword.get());
    } else if (autoContinueEnabled && report.continuationPrompt()) {
      autoContinue(sessionId);
    }
  }

  private void respondToKeyword(final int sessionId, final KeywordRule rule) {
    registry.setBlocked(sessionId, true);
    final int count = rules.recordTrigger(rule.keyword());
    actionLog.info("Keyword '" + rule.keyword() + "' detected in session " + sessionId
        + "; auto-continue blocked (triggered " + count + "x)");
    pending.put(sessionId, scheduler.schedule(() -> typeKeywordResponse(sessionId, rule),
        timing.keywordStabilization()));
  }

  private void typeKeywordResponse(final int sessionId, final KeywordRule rule) {
    try {
      if (!rule.isEscapeOnly()) {
        channel(sessionId).write(rule.response());
      }
      pending.put(sessionId, scheduler.schedule(() -> submitKeywordResponse(sessionId, rule), timing.submitDelay()));
    } catch (final IOException e) {
      fail(sessionId, "keyword response", e);
    }
  }

  private void submitKeywordResponse(final int sessionId, final KeywordRule rule) {
    try {
      channel(sessionId).write(SessionChannel.SUBMIT);
      actionLog.success("Sent keyword response for '" + rule.keyword() + "' to session " + sessionId);
      releaseLater(sessionId);
    } catch (final IOException e) {
      fail(sessionId, "keyword response", e);
    }
  }

  private void releaseLater(final int sessionId) {
    pending.put(sessionId, scheduler.schedule(() -> {
      pending.remove(sessionId);
      registry.setBlocked(sessionId, false);
      LOGGER.debug("Keyword block released for session {}", sessionId);
      onReleased.run();
    }, timing.keywordSettleDelay()));
  }

  private void autoContinue(final int sessionId) {
    registry.setResponderArmed(sessionId, true);
    LOGGER.debug("Continuation prompt in session {}, answering after {}", sessionId,
        timing.autoContinueStabilization());
    pending.put(sessionId, scheduler.schedule(() -> confirmAndAnswer(sessionId), timing.autoContinueStabilization()));
  }

  private void confirmAndAnswer(final int sessionId) {
    final Optional<SignalReport> latest = signals.latest(sessionId);
    if (latest.isEmpty() || !latest.get().continuationPrompt() || latest.get().keywordMatch().isPresent()) {
      LOGGER.debug("Continuation prompt in session {} gone or keyword present, not answering", sessionId);
      pending.remove(sessionId);
      registry.setResponderArmed(sessionId, false);
      return;
    }
    try {
      channel(sessionId).write(timing.autoContinueKeystroke());
      pending.put(sessionId, scheduler.schedule(() -> submitAutoContinue(sessionId), timing.submitDelay()));
    } catch (final IOException e) {
      fail(sessionId, "auto-continue", e);
    }
  }

  private void submitAutoContinue(final int sessionId) {
    try {
      channel(sessionId).write(SessionChannel.SUBMIT);
      actionLog.success("Auto-continued session " + sessionId);
      pending.put(sessionId, scheduler.schedule(() -> {
        pending.remove(sessionId);
        registry.setResponderArmed(sessionId, false);
      }, timing.rearmDelay()));
    } catch (final IOException e) {
      fail(sessionId, "auto-continue", e);
    }
  }

  private SessionChannel channel(final int sessionId) throws IOException {
    return registry.channel(sessionId)
        .orElseThrow(() -> new IOException("session " + sessionId + " is not open"));
  }

  private void fail(final int sessionId, final String what, final IOException e) {
    actionLog.error("Failed to send " + what + " to session " + sessionId + ": " + e.getMessage());
    pending.remove(sessionId);
    registry.setBlocked(sessionId, false);
    registry.setResponderArmed(sessionId, false);
    onReleased.run();
  }

  /**
   * Cancels every pending response and clears blocked and armed flags.
   */
  public void cancelAll() {
    pending.values().forEach(Cancellable::cancel);
    for (final Integer sessionId : pending.keySet()) {
      registry.setBlocked(sessionId, false);
      registry.setResponderArmed(sessionId, false);
    }
    pending.clear();
  }

  public boolean hasPending(final int sessionId) {
    return pending.containsKey(sessionId);
  }
}
