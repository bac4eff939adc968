package com.consullo.autoinject.config;

import com.consullo.autoinject.keyword.KeywordRule;
import com.consullo.autoinject.signal.SignalPatterns;
import com.consullo.autoinject.timer.TimerDuration;
import java.time.Duration;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Immutable configuration of the automation core.
 *
 * <p>Holds the user-facing options and the tuning constants of detection, scheduling and typing.
 * Build with {@link #builder()}; {@link #defaults()} gives the values the Claude Code CLI was
 * tuned for.
 *
 * @since 1.0
 */
public final class AutomationConfig {

  private final boolean autoContinueEnabled;
  private final List<KeywordRule> keywordRules;
  private final Duration usageLimitCooldown;
  private final TimerDuration timerDurationOnStart;
  private final int maxSafetyCheckAttempts;
  private final Duration safetyCheckInterval;
  private final Duration readyStability;
  private final int outputWindowChars;
  private final int promptFallbackChars;
  private final Duration autoDisableWindow;
  private final Duration minResetLead;
  private final Duration maxResetHorizon;
  private final Duration timerSyncInterval;
  private final Duration minWakeDelay;
  private final Duration planModeDelay;
  private final Duration autoContinueStabilization;
  private final Duration keywordStabilization;
  private final Duration submitDelay;
  private final Duration keywordSettleDelay;
  private final Duration autoContinueRearmDelay;
  private final Duration charDelayMin;
  private final Duration charDelayMax;
  private final Duration preSubmitDelayMin;
  private final Duration preSubmitDelayMax;
  private final Duration settleDelayMin;
  private final Duration settleDelayMax;
  private final String continueMessageText;
  private final String autoContinueKeystroke;
  private final int historyCapacity;
  private final SignalPatterns signalPatterns;

  private AutomationConfig(final Builder b) {
    this.autoContinueEnabled = b.autoContinueEnabled;
    this.keywordRules = List.copyOf(b.keywordRules);
    this.usageLimitCooldown = b.usageLimitCooldown;
    this.timerDurationOnStart = b.timerDurationOnStart;
    this.maxSafetyCheckAttempts = b.maxSafetyCheckAttempts;
    this.safetyCheckInterval = b.safetyCheckInterval;
    this.readyStability = b.readyStability;
    this.outputWindowChars = b.outputWindowChars;
    this.promptFallbackChars = b.promptFallbackChars;
    this.autoDisableWindow = b.autoDisableWindow;
    this.minResetLead = b.minResetLead;
    this.maxResetHorizon = b.maxResetHorizon;
    this.timerSyncInterval = b.timerSyncInterval;
    this.minWakeDelay = b.minWakeDelay;
    this.planModeDelay = b.planModeDelay;
    this.autoContinueStabilization = b.autoContinueStabilization;
    this.keywordStabilization = b.keywordStabilization;
    this.submitDelay = b.submitDelay;
    this.keywordSettleDelay = b.keywordSettleDelay;
    this.autoContinueRearmDelay = b.autoContinueRearmDelay;
    this.charDelayMin = b.charDelayMin;
    this.charDelayMax = b.charDelayMax;
    this.preSubmitDelayMin = b.preSubmitDelayMin;
    this.preSubmitDelayMax = b.preSubmitDelayMax;
    this.settleDelayMin = b.settleDelayMin;
    this.settleDelayMax = b.settleDelayMax;
    this.continueMessageText = b.continueMessageText;
    this.autoContinueKeystroke = b.autoContinueKeystroke;
    this.historyCapacity = b.historyCapacity;
    this.signalPatterns = b.signalPatterns;
  }

  public static AutomationConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Overlays persisted preferences on this configuration.
   *
   * @param preferences user preferences
   * @return new configuration
   */
  public AutomationConfig withPreferences(final Preferences preferences) {
    Validate.notNull(preferences, "preferences must not be null");
    return toBuilder()
        .autoContinueEnabled(preferences.autoContinueEnabled())
        .keywordRules(preferences.keywordRules())
        .usageLimitCooldown(Duration.ofMinutes(preferences.usageLimitCooldownMinutes()))
        .timerDurationOnStart(preferences.timerDuration())
        .maxSafetyCheckAttempts(preferences.maxSafetyCheckAttempts())
        .build();
  }

  public Builder toBuilder() {
    final Builder b = new Builder();
    b.autoContinueEnabled = autoContinueEnabled;
    b.keywordRules = keywordRules;
    b.usageLimitCooldown = usageLimitCooldown;
    b.timerDurationOnStart = timerDurationOnStart;
    b.maxSafetyCheckAttempts = maxSafetyCheckAttempts;
    b.safetyCheckInterval = safetyCheckInterval;
    b.readyStability = readyStability;
    b.outputWindowChars = outputWindowChars;
    b.promptFallbackChars = promptFallbackChars;
    b.autoDisableWindow = autoDisableWindow;
    b.minResetLead = minResetLead;
    b.maxResetHorizon = maxResetHorizon;
    b.timerSyncInterval = timerSyncInterval;
    b.minWakeDelay = minWakeDelay;
    b.planModeDelay = planModeDelay;
    b.autoContinueStabilization = autoContinueStabilization;
    b.keywordStabilization = keywordStabilization;
    b.submitDelay = submitDelay;
    b.keywordSettleDelay = keywordSettleDelay;
    b.autoContinueRearmDelay = autoContinueRearmDelay;
    b.charDelayMin = charDelayMin;
    b.charDelayMax = charDelayMax;
    b.preSubmitDelayMin = preSubmitDelayMin;
    b.preSubmitDelayMax = preSubmitDelayMax;
    b.settleDelayMin = settleDelayMin;
    b.settleDelayMax = settleDelayMax;
    b.continueMessageText = continueMessageText;
    b.autoContinueKeystroke = autoContinueKeystroke;
    b.historyCapacity = historyCapacity;
    b.signalPatterns = signalPatterns;
    return b;
  }

  public boolean autoContinueEnabled() {
    return autoContinueEnabled;
  }

  public List<KeywordRule> keywordRules() {
    return keywordRules;
  }

  public Duration usageLimitCooldown() {
    return usageLimitCooldown;
  }

  public TimerDuration timerDurationOnStart() {
    return timerDurationOnStart;
  }

  public int maxSafetyCheckAttempts() {
    return maxSafetyCheckAttempts;
  }

  public Duration safetyCheckInterval() {
    return safetyCheckInterval;
  }

  /**
   * Continuous time a session must be classified ready before a message is dispatched to it.
   *
   * @return stability window
   */
  public Duration readyStability() {
    return readyStability;
  }

  public int outputWindowChars() {
    return outputWindowChars;
  }

  public int promptFallbackChars() {
    return promptFallbackChars;
  }

  public Duration autoDisableWindow() {
    return autoDisableWindow;
  }

  /**
   * Reset times closer than this are treated as left over from a limit that already lifted.
   *
   * @return minimum lead
   */
  public Duration minResetLead() {
    return minResetLead;
  }

  public Duration maxResetHorizon() {
    return maxResetHorizon;
  }

  public Duration timerSyncInterval() {
    return timerSyncInterval;
  }

  public Duration minWakeDelay() {
    return minWakeDelay;
  }

  /**
   * Hold-off after a plan-mode message completes, during which no message is dispatched.
   *
   * @return delay
   */
  public Duration planModeDelay() {
    return planModeDelay;
  }

  public Duration autoContinueStabilization() {
    return autoContinueStabilization;
  }

  public Duration keywordStabilization() {
    return keywordStabilization;
  }

  public Duration submitDelay() {
    return submitDelay;
  }

  public Duration keywordSettleDelay() {
    return keywordSettleDelay;
  }

  public Duration autoContinueRearmDelay() {
    return autoContinueRearmDelay;
  }

  public Duration charDelayMin() {
    return charDelayMin;
  }

  public Duration charDelayMax() {
    return charDelayMax;
  }

  public Duration preSubmitDelayMin() {
    return preSubmitDelayMin;
  }

  public Duration preSubmitDelayMax() {
    return preSubmitDelayMax;
  }

  public Duration settleDelayMin() {
    return settleDelayMin;
  }

  public Duration settleDelayMax() {
    return settleDelayMax;
  }

  public String continueMessageText() {
    return continueMessageText;
  }

  public String autoContinueKeystroke() {
    return autoContinueKeystroke;
  }

  public int historyCapacity() {
    return historyCapacity;
  }

  public SignalPatterns signalPatterns() {
    return signalPatterns;
  }

  public static final class Builder {

    private boolean autoContinueEnabled;
    private List<KeywordRule> keywordRules = List.of();
    private Duration usageLimitCooldown = Duration.ofMinutes(30);
    private TimerDuration timerDurationOnStart = TimerDuration.ZERO;
    private int maxSafetyCheckAttempts = 30;
    private Duration safetyCheckInterval = Duration.ofSeconds(1);
    private Duration readyStability = Duration.ofSeconds(1);
    private int outputWindowChars = 2000;
    private int promptFallbackChars = 1000;
    private Duration autoDisableWindow = Duration.ofHours(5);
    private Duration minResetLead = Duration.ofMinutes(2);
    private Duration maxResetHorizon = Duration.ofHours(5);
    private Duration timerSyncInterval = Duration.ofSeconds(5);
    private Duration minWakeDelay = Duration.ofMillis(100);
    private Duration planModeDelay = Duration.ofSeconds(30);
    private Duration autoContinueStabilization = Duration.ofSeconds(1);
    private Duration keywordStabilization = Duration.ofMillis(500);
    private Duration submitDelay = Duration.ofMillis(200);
    private Duration keywordSettleDelay = Duration.ofSeconds(2);
    private Duration autoContinueRearmDelay = Duration.ofSeconds(5);
    private Duration charDelayMin = Duration.ofMillis(30);
    private Duration charDelayMax = Duration.ofMillis(80);
    private Duration preSubmitDelayMin = Duration.ofMillis(150);
    private Duration preSubmitDelayMax = Duration.ofMillis(300);
    private Duration settleDelayMin = Duration.ofMillis(500);
    private Duration settleDelayMax = Duration.ofMillis(800);
    private String continueMessageText = "continue";
    private String autoContinueKeystroke = "y";
    private int historyCapacity = 1000;
    private SignalPatterns signalPatterns = SignalPatterns.claudeCode();

    private Builder() {
    }

    public Builder autoContinueEnabled(final boolean enabled) {
      this.autoContinueEnabled = enabled;
      return this;
    }

    public Builder keywordRules(final List<KeywordRule> rules) {
      this.keywordRules = rules != null ? rules : List.of();
      return this;
    }

    public Builder usageLimitCooldown(final Duration d) {
      this.usageLimitCooldown = d;
      return this;
    }

    public Builder timerDurationOnStart(final TimerDuration d) {
      this.timerDurationOnStart = d != null ? d : TimerDuration.ZERO;
      return this;
    }

    public Builder maxSafetyCheckAttempts(final int attempts) {
      this.maxSafetyCheckAttempts = attempts;
      return this;
    }

    public Builder safetyCheckInterval(final Duration d) {
      this.safetyCheckInterval = d;
      return this;
    }

    public Builder readyStability(final Duration d) {
      this.readyStability = d;
      return this;
    }

    public Builder outputWindowChars(final int chars) {
      this.outputWindowChars = chars;
      return this;
    }

    public Builder promptFallbackChars(final int chars) {
      this.promptFallbackChars = chars;
      return this;
    }

    public Builder autoDisableWindow(final Duration d) {
      this.autoDisableWindow = d;
      return this;
    }

    public Builder minResetLead(final Duration d) {
      this.minResetLead = d;
      return this;
    }

    public Builder maxResetHorizon(final Duration d) {
      this.maxResetHorizon = d;
      return this;
    }

    public Builder timerSyncInterval(final Duration d) {
      this.timerSyncInterval = d;
      return this;
    }

    public Builder minWakeDelay(final Duration d) {
      this.minWakeDelay = d;
      return this;
    }

    public Builder planModeDelay(final Duration d) {
      this.planModeDelay = d;
      return this;
    }

    public Builder autoContinueStabilization(final Duration d) {
      this.autoContinueStabilization = d;
      return this;
    }

    public Builder keywordStabilization(final Duration d) {
      this.keywordStabilization = d;
      return this;
    }

    public Builder submitDelay(final Duration d) {
      this.submitDelay = d;
      return this;
    }

    public Builder keywordSettleDelay(final Duration d) {
      this.keywordSettleDelay = d;
      return this;
    }

    public Builder autoContinueRearmDelay(final Duration d) {
      this.autoContinueRearmDelay = d;
      return this;
    }

    /**
     * Range of the random pause between typed characters.
     */
    public Builder charDelay(final Duration min, final Duration max) {
      this.charDelayMin = min;
      this.charDelayMax = max;
      return this;
    }

    public Builder preSubmitDelay(final Duration min, final Duration max) {
      this.preSubmitDelayMin = min;
      this.preSubmitDelayMax = max;
      return this;
    }

    public Builder settleDelay(final Duration min, final Duration max) {
      this.settleDelayMin = min;
      this.settleDelayMax = max;
      return this;
    }

    public Builder continueMessageText(final String text) {
      this.continueMessageText = text;
      return this;
    }

    public Builder autoContinueKeystroke(final String keystroke) {
      this.autoContinueKeystroke = keystroke;
      return this;
    }

    public Builder historyCapacity(final int capacity) {
      this.historyCapacity = capacity;
      return this;
    }

    public Builder signalPatterns(final SignalPatterns patterns) {
      this.signalPatterns = patterns;
      return this;
    }

    /**
     * Validates and builds.
     *
     * @return configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public AutomationConfig build() {
      Validate.notNull(signalPatterns, "signalPatterns must not be null");
      Validate.notBlank(continueMessageText, "continueMessageText must not be blank");
      Validate.notEmpty(autoContinueKeystroke, "autoContinueKeystroke must not be empty");
      Validate.isTrue(maxSafetyCheckAttempts > 0, "maxSafetyCheckAttempts must be positive");
      Validate.isTrue(outputWindowChars > 0, "outputWindowChars must be positive");
      Validate.isTrue(promptFallbackChars > 0, "promptFallbackChars must be positive");
      Validate.isTrue(historyCapacity > 0, "historyCapacity must be positive");
      requirePositive(safetyCheckInterval, "safetyCheckInterval");
      requirePositive(timerSyncInterval, "timerSyncInterval");
      requirePositive(minWakeDelay, "minWakeDelay");
      requirePositive(autoDisableWindow, "autoDisableWindow");
      requireNonNegative(usageLimitCooldown, "usageLimitCooldown");
      requireNonNegative(readyStability, "readyStability");
      requireNonNegative(planModeDelay, "planModeDelay");
      requireNonNegative(minResetLead, "minResetLead");
      requirePositive(maxResetHorizon, "maxResetHorizon");
      requireNonNegative(autoContinueStabilization, "autoContinueStabilization");
      requireNonNegative(keywordStabilization, "keywordStabilization");
      requireNonNegative(submitDelay, "submitDelay");
      requireNonNegative(keywordSettleDelay, "keywordSettleDelay");
      requireNonNegative(autoContinueRearmDelay, "autoContinueRearmDelay");
      requireRange(charDelayMin, charDelayMax, "charDelay");
      requireRange(preSubmitDelayMin, preSubmitDelayMax, "preSubmitDelay");
      requireRange(settleDelayMin, settleDelayMax, "settleDelay");
      return new AutomationConfig(this);
    }

    private static void requirePositive(final Duration d, final String name) {
      Validate.notNull(d, "%s must not be null", name);
      Validate.isTrue(!d.isNegative() && !d.isZero(), "%s must be positive", name);
    }

    private static void requireNonNegative(final Duration d, final String name) {
      Validate.notNull(d, "%s must not be null", name);
      Validate.isTrue(!d.isNegative(), "%s must not be negative", name);
    }

    private static void requireRange(final Duration min, final Duration max, final String name) {
      requireNonNegative(min, name + " min");
      requireNonNegative(max, name + " max");
      Validate.isTrue(min.compareTo(max) <= 0, "%s min must not exceed max", name);
    }
  }
}
