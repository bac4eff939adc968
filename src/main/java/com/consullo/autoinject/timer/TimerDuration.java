package com.consullo.autoinject.timer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;

/**
 * Hours, minutes and seconds of a countdown, each kept in its clock range.
 *
 * @param hours 0..23
 * @param minutes 0..59
 * @param seconds 0..59
 * @since 1.0
 */
public record TimerDuration(int hours, int minutes, int seconds) {

  public static final TimerDuration ZERO = new TimerDuration(0, 0, 0);

  public TimerDuration {
    hours = clamp(hours, 23);
    minutes = clamp(minutes, 59);
    seconds = clamp(seconds, 59);
  }

  /**
   * Converts a duration, rounding up to whole seconds and saturating at 23:59:59.
   *
   * @param duration remaining time
   * @return clock value
   */
  public static TimerDuration of(final Duration duration) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      return ZERO;
    }
    long total = duration.getSeconds() + (duration.getNano() > 0 ? 1 : 0);
    if (total >= 24L * 3600) {
      return new TimerDuration(23, 59, 59);
    }
    return new TimerDuration((int) (total / 3600), (int) (total % 3600 / 60), (int) (total % 60));
  }

  public long totalSeconds() {
    return hours * 3600L + minutes * 60L + seconds;
  }

  @JsonIgnore
  public boolean isZero() {
    return totalSeconds() == 0;
  }

  public Duration toDuration() {
    return Duration.ofSeconds(totalSeconds());
  }

  /**
   * One second less, borrowing from minutes and hours. Zero stays zero.
   *
   * @return decremented value
   */
  public TimerDuration minusOneSecond() {
    if (seconds > 0) {
      return new TimerDuration(hours, minutes, seconds - 1);
    }
    if (minutes > 0) {
      return new TimerDuration(hours, minutes - 1, 59);
    }
    if (hours > 0) {
      return new TimerDuration(hours - 1, 59, 59);
    }
    return ZERO;
  }

  /**
   * Formats as {@code HH:MM:SS}.
   *
   * @return display text
   */
  public String format() {
    return String.format("%02d:%02d:%02d", hours, minutes, seconds);
  }

  @Override
  public String toString() {
    return format();
  }

  private static int clamp(final int value, final int max) {
    return Math.max(0, Math.min(max, value));
  }
}
