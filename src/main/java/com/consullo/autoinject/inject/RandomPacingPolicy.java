package com.consullo.autoinject.inject;

import com.consullo.autoinject.config.AutomationConfig;
import java.time.Duration;
import java.util.Random;
import org.apache.commons.lang3.Validate;

/**
 * Uniformly random delays within configured ranges, to resemble a person typing.
 *
 * @since 1.0
 */
public final class RandomPacingPolicy implements PacingPolicy {

  private final Random random;
  private final Duration charMin;
  private final Duration charMax;
  private final Duration submitMin;
  private final Duration submitMax;
  private final Duration settleMin;
  private final Duration settleMax;

  public RandomPacingPolicy(final AutomationConfig config) {
    this(config, new Random());
  }

  public RandomPacingPolicy(final AutomationConfig config, final Random random) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(random, "random must not be null");
    this.random = random;
    this.charMin = config.charDelayMin();
    this.charMax = config.charDelayMax();
    this.submitMin = config.preSubmitDelayMin();
    this.submitMax = config.preSubmitDelayMax();
    this.settleMin = config.settleDelayMin();
    this.settleMax = config.settleDelayMax();
  }

  @Override
  public Duration charDelay() {
    return between(charMin, charMax);
  }

  @Override
  public Duration preSubmitDelay() {
    return between(submitMin, submitMax);
  }

  @Override
  public Duration settleDelay() {
    return between(settleMin, settleMax);
  }

  private Duration between(final Duration min, final Duration max) {
    final long lo = min.toMillis();
    final long span = max.toMillis() - lo;
    if (span <= 0) {
      return min;
    }
    return Duration.ofMillis(lo + (long) (random.nextDouble() * (span + 1)));
  }
}
