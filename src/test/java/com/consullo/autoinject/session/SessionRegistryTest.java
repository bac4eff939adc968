package com.consullo.autoinject.session;

import com.consullo.autoinject.signal.SessionStatus;
import com.consullo.autoinject.testsupport.MutableClock;
import com.consullo.autoinject.testsupport.RecordingSessionChannel;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SessionRegistry} and the per-session state it holds.
 *
 * @since 1.0
 */
public class SessionRegistryTest {

  private static final Duration STABILITY = Duration.ofSeconds(1);

  private MutableClock clock;
  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
    registry = new SessionRegistry(clock);
  }

  @Test
  @DisplayName("Should be ready only after the status held for the stability window")
  void isReadyForDispatch_RequiresStableReadyStatus() throws Exception {
    registry.attach(new RecordingSessionChannel(1));
    final SessionState state = registry.get(1).orElseThrow();
    assertThat(state.isReadyForDispatch(clock.instant(), STABILITY)).isFalse();

    clock.advance(STABILITY);
    assertThat(state.isReadyForDispatch(clock.instant(), STABILITY)).isTrue();

    registry.updateStatus(1, SessionStatus.RUNNING);
    clock.advance(Duration.ofSeconds(10));
    assertThat(state.isReadyForDispatch(clock.instant(), STABILITY)).isFalse();

    registry.updateStatus(1, SessionStatus.READY);
    clock.advance(Duration.ofMillis(500));
    registry.updateStatus(1, SessionStatus.READY);
    clock.advance(Duration.ofMillis(500));
    assertThat(state.isReadyForDispatch(clock.instant(), STABILITY)).isTrue();
  }

  @Test
  @DisplayName("Should allow one injection at a time and restart stability when it ends")
  void beginInjection_Twice_Throws() throws Exception {
    registry.open(2);
    clock.advance(STABILITY);

    registry.beginInjection(2);
    assertThat(registry.busySessionIds()).containsExactly(2);
    assertThat(registry.get(2).orElseThrow().phase()).isEqualTo(SessionPhase.INJECTING);
    assertThatThrownBy(() -> registry.beginInjection(2)).isInstanceOf(IllegalStateException.class);

    registry.endInjection(2);
    assertThat(registry.busySessionIds()).isEmpty();
    assertThat(registry.get(2).orElseThrow().isReadyForDispatch(clock.instant(), STABILITY)).isFalse();
  }

  @Test
  @DisplayName("Should derive the phase from flags before status")
  void phase_FlagsTakePrecedence() throws Exception {
    registry.open(3);
    registry.updateStatus(3, SessionStatus.PROMPTING);
    assertThat(registry.get(3).orElseThrow().phase()).isEqualTo(SessionPhase.PROMPTING);

    registry.markUsageLimit(3);
    assertThat(registry.views().get(0).phase()).isEqualTo(SessionPhase.AWAITING_CONTINUE);

    registry.setBlocked(3, true);
    assertThat(registry.views().get(0).phase()).isEqualTo(SessionPhase.BLOCKED);
  }

  @Test
  @DisplayName("Should clear transient flags but keep usage-limit flags on neutralize")
  void neutralizeAll_KeepsUsageLimitFlags() throws Exception {
    registry.open(1);
    registry.open(2);
    registry.beginInjection(1);
    registry.setBlocked(2, true);
    registry.setResponderArmed(2, true);
    registry.markUsageLimit(2);
    registry.recordNotReady(2);

    registry.neutralizeAll();

    assertThat(registry.busySessionIds()).isEmpty();
    final SessionState two = registry.get(2).orElseThrow();
    assertThat(two.isBlocked()).isFalse();
    assertThat(two.isResponderArmed()).isFalse();
    assertThat(two.notReadyChecks()).isZero();
    assertThat(two.isAwaitingContinue()).isTrue();
  }

  @Test
  @DisplayName("Should forget state and channel on close")
  void close_RemovesSession() throws Exception {
    registry.attach(new RecordingSessionChannel(8));

    assertThat(registry.close(8)).isTrue();
    assertThat(registry.close(8)).isFalse();
    assertThat(registry.contains(8)).isFalse();
    assertThat(registry.channel(8)).isEmpty();
  }
}
