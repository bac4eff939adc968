package com.consullo.autoinject.config;

import com.consullo.autoinject.keyword.KeywordRule;
import com.consullo.autoinject.timer.TimerDuration;
import java.time.Instant;
import java.util.List;

/**
 * User-editable settings that survive restarts.
 *
 * @param autoContinueEnabled answer continuation prompts automatically
 * @param keywordRules keyword rules with their trigger counters
 * @param usageLimitCooldownMinutes cooldown after an accepted usage-limit detection
 * @param timerDuration countdown used when the timer is started or reset
 * @param maxSafetyCheckAttempts readiness checks before a stalled-session warning
 * @param lastUsageLimitReset last resolved usage-limit reset instant, may be null
 * @since 1.0
 */
public record Preferences(
    boolean autoContinueEnabled,
    List<KeywordRule> keywordRules,
    int usageLimitCooldownMinutes,
    TimerDuration timerDuration,
    int maxSafetyCheckAttempts,
    Instant lastUsageLimitReset) {

  public Preferences {
    keywordRules = keywordRules != null ? List.copyOf(keywordRules) : List.of();
    timerDuration = timerDuration != null ? timerDuration : TimerDuration.ZERO;
    usageLimitCooldownMinutes = Math.max(0, usageLimitCooldownMinutes);
    maxSafetyCheckAttempts = maxSafetyCheckAttempts > 0 ? maxSafetyCheckAttempts : 30;
  }

  /**
   * Preferences matching {@link AutomationConfig#defaults()}.
   *
   * @return defaults
   */
  public static Preferences defaults() {
    return from(AutomationConfig.defaults());
  }

  /**
   * Extracts the persisted subset of a configuration.
   *
   * @param config configuration
   * @return preferences
   */
  public static Preferences from(final AutomationConfig config) {
    return new Preferences(
        config.autoContinueEnabled(),
        config.keywordRules(),
        (int) config.usageLimitCooldown().toMinutes(),
        config.timerDurationOnStart(),
        config.maxSafetyCheckAttempts(),
        null);
  }

  public Preferences withAutoContinueEnabled(final boolean enabled) {
    return new Preferences(enabled, keywordRules, usageLimitCooldownMinutes, timerDuration,
        maxSafetyCheckAttempts, lastUsageLimitReset);
  }

  public Preferences withKeywordRules(final List<KeywordRule> rules) {
    return new Preferences(autoContinueEnabled, rules, usageLimitCooldownMinutes, timerDuration,
        maxSafetyCheckAttempts, lastUsageLimitReset);
  }

  public Preferences withTimerDuration(final TimerDuration duration) {
    return new Preferences(autoContinueEnabled, keywordRules, usageLimitCooldownMinutes, duration,
        maxSafetyCheckAttempts, lastUsageLimitReset);
  }

  public Preferences withLastUsageLimitReset(final Instant reset) {
    return new Preferences(autoContinueEnabled, keywordRules, usageLimitCooldownMinutes, timerDuration,
        maxSafetyCheckAttempts, reset);
  }
}
