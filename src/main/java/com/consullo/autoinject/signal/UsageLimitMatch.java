package com.consullo.autoinject.signal;

import org.apache.commons.lang3.Validate;

/**
 * A parsed "usage limit reached, resets at H(am|pm)" notice.
 *
 * @param hour reset hour on the 12-hour clock, 1..12
 * @param pm true for pm
 * @since 1.0
 */
public record UsageLimitMatch(int hour, boolean pm) {

  public UsageLimitMatch {
    Validate.inclusiveBetween(1, 12, hour, "hour must be between 1 and 12");
  }

  /**
   * Hour of day on the 24-hour clock (12am = 0, 12pm = 12).
   *
   * @return hour 0..23
   */
  public int hourOfDay() {
    if (pm) {
      return hour == 12 ? 12 : hour + 12;
    }
    return hour == 12 ? 0 : hour;
  }

  @Override
  public String toString() {
    return hour + (pm ? "pm" : "am");
  }
}
