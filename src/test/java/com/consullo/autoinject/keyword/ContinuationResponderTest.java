package com.consullo.autoinject.keyword;

import com.consullo.autoinject.config.JsonFiles;
import com.consullo.autoinject.event.ActionEvent;
import com.consullo.autoinject.event.ActionLevel;
import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.event.AutomationEvents;
import com.consullo.autoinject.session.SessionChannel;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.session.SessionState;
import com.consullo.autoinject.signal.SessionSignalDetector;
import com.consullo.autoinject.signal.SignalPatterns;
import com.consullo.autoinject.signal.SignalReport;
import com.consullo.autoinject.testsupport.ManualTaskScheduler;
import com.consullo.autoinject.testsupport.RecordingSessionChannel;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for keyword responses and auto-continue.
 *
 * @since 1.0
 */
public class ContinuationResponderTest {

  private static final String SAFETY_PHRASE = "No, and tell Claude what to do differently";
  private static final String CONTINUE_PROMPT = "work\n╭ Do you want to make this edit?\n1. Yes\n2. " + SAFETY_PHRASE + "\n╰";
  private static final String KEYWORD_PROMPT =
      "work\n╭ Do you want to make this edit to [Claude Code]?\n1. Yes\n2. " + SAFETY_PHRASE + "\n╰";

  private ManualTaskScheduler scheduler;
  private SessionRegistry registry;
  private RecordingSessionChannel channel;
  private KeywordRuleEngine rules;
  private ActionLog actionLog;
  private SessionSignalDetector detector;
  private ContinuationResponder responder;
  private AtomicInteger released;

  @BeforeEach
  void setUp() {
    scheduler = new ManualTaskScheduler();
    registry = new SessionRegistry(scheduler.clock());
    channel = new RecordingSessionChannel(1);
    registry.attach(channel);
    rules = new KeywordRuleEngine(JsonFiles.objectMapper(), List.of(new KeywordRule("[Claude Code]", "no thanks")));
    actionLog = new ActionLog(scheduler.clock(), new AutomationEvents());
    detector = new SessionSignalDetector(SignalPatterns.claudeCode(), 2000, 1000);
    final ContinuationResponder.Timing timing = new ContinuationResponder.Timing(Duration.ofSeconds(1),
        Duration.ofMillis(500), Duration.ofMillis(200), Duration.ofSeconds(2), Duration.ofSeconds(5), "y");
    responder = new ContinuationResponder(scheduler, registry, rules, actionLog, timing, this::latest, true);
    released = new AtomicInteger();
    responder.setOnReleased(released::incrementAndGet);
  }

  private Optional<SignalReport> latest(final int sessionId) {
    return Optional.of(detector.analyze(channel.recentOutput(2000), rules.rules()));
  }

  private void show(final String output) {
    channel.setOutput(output);
    responder.onReport(1, detector.analyze(output, rules.rules()));
  }

  private SessionState state() {
    return registry.get(1).orElseThrow();
  }

  @Test
  @DisplayName("Should answer a keyword match instead of auto-continuing")
  void onReport_KeywordAndContinuationPrompt_KeywordWins() throws Exception {
    show(KEYWORD_PROMPT);

    assertThat(state().isBlocked()).isTrue();
    assertThat(rules.find("[claude code]")).get().extracting(KeywordRule::timesTriggered).isEqualTo(1);
    assertThat(channel.writes()).isEmpty();

    scheduler.advance(Duration.ofMillis(500));
    assertThat(channel.writes()).containsExactly("no thanks");

    scheduler.advance(Duration.ofMillis(200));
    assertThat(channel.writes()).containsExactly("no thanks", SessionChannel.SUBMIT);
    assertThat(state().isBlocked()).isTrue();

    scheduler.advance(Duration.ofSeconds(2));
    assertThat(state().isBlocked()).isFalse();
    assertThat(released.get()).isEqualTo(1);
    assertThat(channel.writes()).doesNotContain("y");
  }

  @Test
  @DisplayName("Should send only the submit keystroke for a rule without a response")
  void onReport_EscapeOnlyRule_SubmitsWithoutText() throws Exception {
    rules.updateResponse("[Claude Code]", null);
    show(KEYWORD_PROMPT);

    scheduler.advance(Duration.ofMillis(500));
    assertThat(channel.writes()).isEmpty();
    assertThat(state().isBlocked()).isTrue();

    scheduler.advance(Duration.ofMillis(200));
    assertThat(channel.writes()).containsExactly(SessionChannel.SUBMIT);
    assertThat(state().isBlocked()).isTrue();

    scheduler.advance(Duration.ofSeconds(2));
    assertThat(channel.writes()).containsExactly(SessionChannel.SUBMIT);
    assertThat(state().isBlocked()).isFalse();
    assertThat(released.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should answer a continuation prompt once and re-arm after the delay")
  void onReport_ContinuationPrompt_AnswersOnceAndRearms() throws Exception {
    show(CONTINUE_PROMPT);
    assertThat(state().isResponderArmed()).isTrue();

    scheduler.advance(Duration.ofSeconds(1));
    assertThat(channel.writes()).containsExactly("y");
    scheduler.advance(Duration.ofMillis(200));
    assertThat(channel.writes()).containsExactly("y", SessionChannel.SUBMIT);

    // Re-rendered prompt while armed.
    show(CONTINUE_PROMPT);
    scheduler.advance(Duration.ofSeconds(2));
    assertThat(channel.writes()).hasSize(2);

    scheduler.advance(Duration.ofSeconds(3));
    assertThat(state().isResponderArmed()).isFalse();
    assertThat(responder.hasPending(1)).isFalse();
  }

  @Test
  @DisplayName("Should not answer when the prompt disappeared during stabilization")
  void onReport_PromptGoneBeforeConfirmation_DoesNothing() throws Exception {
    show(CONTINUE_PROMPT);
    channel.setOutput("all done\n> ");

    scheduler.advance(Duration.ofSeconds(2));

    assertThat(channel.writes()).isEmpty();
    assertThat(state().isResponderArmed()).isFalse();
  }

  @Test
  @DisplayName("Should ignore continuation prompts while auto-continue is disabled")
  void onReport_AutoContinueDisabled_Ignores() throws Exception {
    responder.setAutoContinueEnabled(false);

    show(CONTINUE_PROMPT);
    scheduler.advance(Duration.ofSeconds(10));

    assertThat(channel.writes()).isEmpty();
    assertThat(state().isResponderArmed()).isFalse();
  }

  @Test
  @DisplayName("Should ignore busy sessions")
  void onReport_BusySession_Ignores() throws Exception {
    registry.beginInjection(1);

    show(KEYWORD_PROMPT);

    assertThat(state().isBlocked()).isFalse();
    assertThat(scheduler.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should log the failure and clear the block when the write fails")
  void onReport_WriteFails_ClearsFlagsAndLogsError() throws Exception {
    channel.failWrites(true);
    show(KEYWORD_PROMPT);

    scheduler.advance(Duration.ofMillis(500));

    assertThat(state().isBlocked()).isFalse();
    assertThat(released.get()).isEqualTo(1);
    assertThat(actionLog.recent()).extracting(ActionEvent::level).contains(ActionLevel.ERROR);
  }

  @Test
  @DisplayName("Should cancel pending responses and clear flags")
  void cancelAll_PendingResponse_ClearsFlags() throws Exception {
    show(KEYWORD_PROMPT);

    responder.cancelAll();
    scheduler.advance(Duration.ofSeconds(5));

    assertThat(channel.writes()).isEmpty();
    assertThat(state().isBlocked()).isFalse();
    assertThat(responder.hasPending(1)).isFalse();
  }
}
