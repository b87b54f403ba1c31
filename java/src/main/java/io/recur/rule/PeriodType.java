package io.recur.rule;

/** The FREQ of a recurrence rule, ordered from finest to coarsest granularity. */
public enum PeriodType {
  NONE,
  SECONDLY,
  MINUTELY,
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY,
  YEARLY;

  /**
   * Returns true for the periods finer than a day.
   *
   * @return true for secondly, minutely and hourly
   */
  public boolean isSubDaily() {
    return this == SECONDLY || this == MINUTELY || this == HOURLY;
  }
}
