package com.consullo.autoinject.config;

import com.consullo.autoinject.keyword.KeywordRule;
import com.consullo.autoinject.timer.TimerDuration;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AutomationConfig}.
 *
 * @since 1.0
 */
public class AutomationConfigTest {

  @Test
  @DisplayName("Should provide the documented defaults")
  void defaults_MatchDocumentedValues() throws Exception {
    final AutomationConfig config = AutomationConfig.defaults();

    assertThat(config.autoContinueEnabled()).isFalse();
    assertThat(config.usageLimitCooldown()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.maxSafetyCheckAttempts()).isEqualTo(30);
    assertThat(config.autoDisableWindow()).isEqualTo(Duration.ofHours(5));
    assertThat(config.minResetLead()).isEqualTo(Duration.ofMinutes(2));
    assertThat(config.maxResetHorizon()).isEqualTo(Duration.ofHours(5));
    assertThat(config.outputWindowChars()).isEqualTo(2000);
    assertThat(config.charDelayMin()).isEqualTo(Duration.ofMillis(30));
    assertThat(config.charDelayMax()).isEqualTo(Duration.ofMillis(80));
    assertThat(config.continueMessageText()).isEqualTo("continue");
    assertThat(config.planModeDelay()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("Should reject out-of-range values")
  void build_InvalidValues_Throws() throws Exception {
    assertThatThrownBy(() -> AutomationConfig.builder().maxSafetyCheckAttempts(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AutomationConfig.builder().safetyCheckInterval(Duration.ZERO).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("safetyCheckInterval");
    assertThatThrownBy(() -> AutomationConfig.builder()
        .charDelay(Duration.ofMillis(90), Duration.ofMillis(10)).build())
        .hasMessageContaining("charDelay min must not exceed max");
    assertThatThrownBy(() -> AutomationConfig.builder().planModeDelay(Duration.ofSeconds(-1)).build())
        .hasMessageContaining("planModeDelay must not be negative");
  }

  @Test
  @DisplayName("Should overlay stored preferences and keep everything else")
  void withPreferences_OverridesPersistedSubset() throws Exception {
    final AutomationConfig base = AutomationConfig.builder().outputWindowChars(4000).build();
    final Preferences prefs = new Preferences(true, List.of(new KeywordRule("deploy", "wait")), 10,
        new TimerDuration(1, 30, 0), 12, null);

    final AutomationConfig merged = base.withPreferences(prefs);

    assertThat(merged.autoContinueEnabled()).isTrue();
    assertThat(merged.keywordRules()).extracting(KeywordRule::keyword).containsExactly("deploy");
    assertThat(merged.usageLimitCooldown()).isEqualTo(Duration.ofMinutes(10));
    assertThat(merged.timerDurationOnStart()).isEqualTo(new TimerDuration(1, 30, 0));
    assertThat(merged.maxSafetyCheckAttempts()).isEqualTo(12);
    assertThat(merged.outputWindowChars()).isEqualTo(4000);
    assertThat(Preferences.from(merged)).isEqualTo(prefs);
  }
}
