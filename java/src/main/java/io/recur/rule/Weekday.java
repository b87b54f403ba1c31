package io.recur.rule;

import java.time.DayOfWeek;
import java.util.Optional;

/** Represents a day of the week, numbered Monday-first as in RFC 5545. */
public enum Weekday {
  MONDAY(1, "MO"),
  TUESDAY(2, "TU"),
  WEDNESDAY(3, "WE"),
  THURSDAY(4, "TH"),
  FRIDAY(5, "FR"),
  SATURDAY(6, "SA"),
  SUNDAY(7, "SU");

  private final int isoNumber;
  private final String code;

  Weekday(int isoNumber, String code) {
    this.isoNumber = isoNumber;
    this.code = code;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the two-letter RFC 5545 code (MO, TU, ...).
   *
   * @return the weekday code
   */
  public String code() {
    return code;
  }

  @Override
  public String toString() {
    return code;
  }

  /**
   * Returns a Weekday from an ISO 8601 day number.
   *
   * @param n the ISO day number (1-7)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 1 || n > 7) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(isoNumber);
  }
}
