package io.recur.rule;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Calendar arithmetic shared by {@link Constraint} and {@link RecurrenceRule}.
 *
 * <p>Week numbering follows RFC 5545: week 1 is the week, starting on the configured week start
 * day, that contains January 4th. A date early in January may therefore belong to the last week of
 * the previous week-year, and a date late in December to week 1 of the next one.
 */
final class DateHelper {
  private DateHelper() {}

  /** A week number together with the year the week belongs to. */
  record YearWeek(int year, int week) {}

  /** Returns the ISO weekday number (1=Monday, 7=Sunday) of a date. */
  static int dayOfWeek(LocalDate date) {
    return date.getDayOfWeek().getValue();
  }

  /** Number of days to go back from a date to reach the start of its week. */
  static int daysSinceWeekStart(LocalDate date, int weekStart) {
    return (7 + dayOfWeek(date) - weekStart) % 7;
  }

  /** Returns the first day of week 1 of the given year. */
  static LocalDate weekOneStart(int year, int weekStart) {
    LocalDate jan4 = LocalDate.of(year, 1, 4);
    return jan4.minusDays(daysSinceWeekStart(jan4, weekStart));
  }

  /**
   * Returns the first day of the given week of a year.
   *
   * @param year the week-year
   * @param weekNumber the week, negative to count back from the last week; must not be zero
   * @param weekStart the first day of the week (1=Monday)
   * @return the first day of that week
   */
  static LocalDate nthWeek(int year, int weekNumber, int weekStart) {
    if (weekNumber > 0) {
      return weekOneStart(year, weekStart).plusDays(7L * (weekNumber - 1));
    }
    if (weekNumber < 0) {
      return weekOneStart(year + 1, weekStart).plusDays(7L * weekNumber);
    }
    return weekOneStart(year, weekStart);
  }

  /** Returns the number of weeks (52 or 53) in a week-year. */
  static int weeksInYear(int year, int weekStart) {
    return (int)
        (ChronoUnit.DAYS.between(weekOneStart(year, weekStart), weekOneStart(year + 1, weekStart))
            / 7);
  }

  /** Returns the week number of a date and the week-year it belongs to. */
  static YearWeek weekNumber(LocalDate date, int weekStart) {
    int year = date.getYear();
    long daysTo = ChronoUnit.DAYS.between(weekOneStart(year, weekStart), date);
    if (daysTo < 0) {
      // Early January, still in the last week of the previous year
      --year;
      daysTo = ChronoUnit.DAYS.between(weekOneStart(year, weekStart), date);
    } else if (daysTo > 355) {
      long daysToNext = ChronoUnit.DAYS.between(weekOneStart(year + 1, weekStart), date);
      if (daysToNext >= 0) {
        ++year;
        daysTo = daysToNext;
      }
    }
    return new YearWeek(year, (int) (daysTo / 7) + 1);
  }

  /** Returns the week number of a date counted from the end of its week-year (-1 = last week). */
  static YearWeek negativeWeekNumber(LocalDate date, int weekStart) {
    YearWeek yw = weekNumber(date, weekStart);
    return new YearWeek(yw.year(), yw.week() - weeksInYear(yw.year(), weekStart) - 1);
  }

  /**
   * Returns a date, allowing a negative day counted from the end of the month (-1 = last day).
   *
   * @return the date, or null if it does not exist
   */
  static LocalDate getDate(int year, int month, int day) {
    if (day >= 0) {
      return tryCreateDate(year, month, day);
    }
    LocalDate firstOfMonth = tryCreateDate(year, month, 1);
    if (firstOfMonth == null) {
      return null;
    }
    return firstOfMonth.plusMonths(1).plusDays(day);
  }

  /** Tries to create a LocalDate, returning null if the date is invalid. */
  static LocalDate tryCreateDate(int year, int month, int day) {
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      return null;
    }
  }

  /**
   * Places a wall-clock time in a zone. A time inside a DST gap is pushed forward by the length of
   * the gap; a time inside a DST overlap takes the earlier offset.
   */
  static ZonedDateTime atZone(LocalDate date, LocalTime time, ZoneId zone) {
    return ZonedDateTime.of(LocalDateTime.of(date, time), zone);
  }
}
