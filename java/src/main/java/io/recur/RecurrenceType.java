package io.recur;

/**
 * Classification of a recurrence by the shape of its first rule, as presented by calendar user
 * interfaces.
 */
public enum RecurrenceType {
  /** No rule, or the first rule has no period. */
  NONE,
  MINUTELY,
  HOURLY,
  DAILY,
  WEEKLY,
  /** Monthly on weekday positions, e.g. the second Tuesday. */
  MONTHLY_POS,
  /** Monthly on days of the month. */
  MONTHLY_DAY,
  /** Yearly on days of given months. */
  YEARLY_MONTH,
  /** Yearly on days of the year. */
  YEARLY_DAY,
  /** Yearly on weekday positions of given months. */
  YEARLY_POS,
  /** Anything not covered by the simple types above. */
  OTHER
}
