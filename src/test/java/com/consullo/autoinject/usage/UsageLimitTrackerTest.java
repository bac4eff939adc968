package com.consullo.autoinject.usage;

import com.consullo.autoinject.event.ActionEvent;
import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.event.AutomationEvents;
import com.consullo.autoinject.session.SessionRegistry;
import com.consullo.autoinject.session.SessionState;
import com.consullo.autoinject.signal.UsageLimitMatch;
import com.consullo.autoinject.testsupport.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for usage-limit cooldown, reset resolution and auto-disable.
 *
 * @since 1.0
 */
public class UsageLimitTrackerTest {

  private static final UsageLimitMatch THREE_PM = new UsageLimitMatch(3, true);

  private MutableClock clock;
  private SessionRegistry registry;
  private ActionLog actionLog;
  private UsageLimitTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-15T10:30:00Z"), ZoneOffset.UTC);
    registry = new SessionRegistry(clock);
    actionLog = new ActionLog(clock, new AutomationEvents());
    tracker = new UsageLimitTracker(clock, registry, actionLog, Duration.ofMinutes(30), Duration.ofHours(5),
        Duration.ofMinutes(2), Duration.ofHours(5));
  }

  @Test
  @DisplayName("Should act once on a notice repeated within the cooldown")
  void onDetection_RepeatedWithinCooldown_TriggersOnce() throws Exception {
    final UsageLimitDetection first = tracker.onDetection(1, THREE_PM);

    assertThat(first.outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED);
    assertThat(first.resetInstant()).contains(Instant.parse("2026-01-15T15:00:00Z"));
    final SessionState state = registry.get(1).orElseThrow();
    assertThat(state.isUsageLimitReached()).isTrue();
    assertThat(state.isAwaitingContinue()).isTrue();

    clock.advance(Duration.ofMinutes(10));
    final UsageLimitDetection second = tracker.onDetection(1, THREE_PM);

    assertThat(second.outcome()).isEqualTo(UsageLimitOutcome.COOLDOWN);
    assertThat(second.resetInstant()).isEmpty();
    assertThat(actionLog.recent()).extracting(ActionEvent::message)
        .anyMatch(m -> m.contains("ignored: cooldown active"));
    assertThat(tracker.record().cooldownUntil()).isEqualTo(Instant.parse("2026-01-15T11:00:00Z"));
  }

  @Test
  @DisplayName("Should accept the notice again once the cooldown has elapsed")
  void onDetection_AfterCooldown_AcceptsAgain() throws Exception {
    tracker.onDetection(1, THREE_PM);
    clock.advance(Duration.ofMinutes(31));

    assertThat(tracker.onDetection(2, THREE_PM).outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED);
    assertThat(registry.awaitingContinueIds()).containsExactly(1, 2);
  }

  @Test
  @DisplayName("Should flag the session but drop reset times that are too close or too far")
  void onDetection_StaleResetTime_AcceptedWithoutReset() throws Exception {
    // 10am has passed today, so it means tomorrow: far beyond the horizon.
    final UsageLimitDetection far = tracker.onDetection(1, new UsageLimitMatch(10, false));
    assertThat(far.outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED_WITHOUT_RESET);
    assertThat(registry.get(1).orElseThrow().isAwaitingContinue()).isTrue();

    clock.set(Instant.parse("2026-01-15T11:59:00Z"));
    final UsageLimitDetection near = tracker.onDetection(2, new UsageLimitMatch(12, true));
    assertThat(near.outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED_WITHOUT_RESET);
    assertThat(near.resetInstant()).isEmpty();
  }

  @Test
  @DisplayName("Should roll a reset hour that already passed to the next day")
  void resolveResetInstant_PastHour_RollsOver() throws Exception {
    final Instant lateEvening = Instant.parse("2026-01-15T23:00:00Z");

    assertThat(tracker.resolveResetInstant(new UsageLimitMatch(1, false), lateEvening))
        .contains(Instant.parse("2026-01-16T01:00:00Z"));
    assertThat(tracker.resolveResetInstant(new UsageLimitMatch(11, true), lateEvening)).isEmpty();
  }

  @Test
  @DisplayName("Should disable detection five hours after the first notice until a manual cycle")
  void onDetection_AfterAutoDisableWindow_SuppressesUntilManualCycle() throws Exception {
    tracker.onDetection(1, THREE_PM);
    clock.advance(Duration.ofHours(5));

    assertThat(tracker.onDetection(1, new UsageLimitMatch(6, true)).outcome())
        .isEqualTo(UsageLimitOutcome.AUTO_DISABLED);
    assertThat(tracker.record().suppressed()).isTrue();
    assertThat(tracker.record().firstDetectedAt()).isNull();

    clock.advance(Duration.ofHours(1));
    assertThat(tracker.onDetection(1, new UsageLimitMatch(8, true)).outcome())
        .isEqualTo(UsageLimitOutcome.SUPPRESSED);

    tracker.beginManualCycle();
    final UsageLimitDetection renewed = tracker.onDetection(1, new UsageLimitMatch(8, true));
    assertThat(renewed.outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED);
    assertThat(tracker.record().firstDetectedAt()).isEqualTo(clock.instant());
  }

  @Test
  @DisplayName("Should clear all state and every session's flags on reset")
  void reset_ClearsEverything() throws Exception {
    tracker.onDetection(1, THREE_PM);

    tracker.reset();

    assertThat(tracker.record()).isEqualTo(UsageLimitRecord.EMPTY);
    assertThat(registry.awaitingContinueIds()).isEmpty();
    assertThat(tracker.onDetection(1, THREE_PM).outcome()).isEqualTo(UsageLimitOutcome.ACCEPTED);
  }

  @Test
  @DisplayName("Should describe the tracked state in one line")
  void describe_AfterDetection_MentionsCooldownAndSessions() throws Exception {
    tracker.onDetection(4, THREE_PM);

    assertThat(tracker.describe())
        .contains("first detected")
        .contains("cooldown 30m left")
        .contains("reset at 15:00")
        .contains("[4]");
  }
}
