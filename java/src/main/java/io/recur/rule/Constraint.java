package io.recur.rule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A partial date/time: some fields fixed, the rest left open.
 *
 * <p>A {@link RecurrenceRule} expands its BY lists into a set of constraints, and describes each
 * frequency bucket (one month for a monthly rule, one week for a weekly rule, ...) by a constraint
 * holding only the fields coarser than the bucket. Merging the two and enumerating the result gives
 * the occurrences of the bucket.
 *
 * <p>A {@code null} field is unset and never takes part in matching or merging. Negative day,
 * year-day, week-number and weekday-position values count back from the end of the enclosing
 * period.
 *
 * <p>Instances are immutable apart from the lazily computed bucket start returned by {@link
 * #intervalDateTime(PeriodType)}; like the rule that owns them they are not safe for concurrent
 * use until that value has been computed.
 */
final class Constraint {
  private Integer year;
  private Integer month;
  private Integer day;
  private Integer hour;
  private Integer minute;
  private Integer second;
  private Integer weekday;
  private Integer weekdayPos;
  private Integer weekNumber;
  private Integer yearDay;
  private final int weekStart;
  private final ZoneId zone;

  private ZonedDateTime intervalStart;

  private Constraint(ZoneId zone, int weekStart) {
    this.zone = zone;
    this.weekStart = weekStart;
  }

  /**
   * Creates a constraint with every field unset.
   *
   * @param zone the zone in which enumerated date/times are placed
   * @param weekStart the first day of the week (1=Monday)
   * @return the constraint
   */
  static Constraint unbound(ZoneId zone, int weekStart) {
    return new Constraint(zone, weekStart);
  }

  /**
   * Creates the constraint describing the bucket of the given granularity that contains a
   * date/time. Fields at or above the bucket's granularity are taken from {@code dt}: for a weekly
   * bucket the week number and its week-year, for a monthly bucket year and month, for an hourly
   * bucket the full date plus the hour, and so on.
   *
   * @param dt the date/time
   * @param type the bucket granularity
   * @param weekStart the first day of the week (1=Monday)
   * @return the bucket constraint
   */
  static Constraint fromDateTime(ZonedDateTime dt, PeriodType type, int weekStart) {
    Constraint c = new Constraint(dt.getZone(), weekStart);
    switch (type) {
      case NONE -> {}
      case WEEKLY -> {
        DateHelper.YearWeek yw = DateHelper.weekNumber(dt.toLocalDate(), weekStart);
        c.weekNumber = yw.week();
        c.year = yw.year();
      }
      default -> {
        c.year = dt.getYear();
        if (type != PeriodType.YEARLY) {
          c.month = dt.getMonthValue();
        }
        if (type.compareTo(PeriodType.DAILY) <= 0) {
          c.day = dt.getDayOfMonth();
        }
        if (type.compareTo(PeriodType.HOURLY) <= 0) {
          c.hour = dt.getHour();
        }
        if (type.compareTo(PeriodType.MINUTELY) <= 0) {
          c.minute = dt.getMinute();
        }
        if (type == PeriodType.SECONDLY) {
          c.second = dt.getSecond();
        }
      }
    }
    return c;
  }

  private Constraint copy() {
    Constraint c = new Constraint(zone, weekStart);
    c.year = year;
    c.month = month;
    c.day = day;
    c.hour = hour;
    c.minute = minute;
    c.second = second;
    c.weekday = weekday;
    c.weekdayPos = weekdayPos;
    c.weekNumber = weekNumber;
    c.yearDay = yearDay;
    return c;
  }

  private static Integer nonZero(int value) {
    return value == 0 ? null : value;
  }

  Constraint withYear(int value) {
    Constraint c = copy();
    c.year = nonZero(value);
    return c;
  }

  Constraint withMonth(int value) {
    Constraint c = copy();
    c.month = nonZero(value);
    return c;
  }

  Constraint withDay(int value) {
    Constraint c = copy();
    c.day = nonZero(value);
    return c;
  }

  Constraint withHour(int value) {
    Constraint c = copy();
    c.hour = value;
    return c;
  }

  Constraint withMinute(int value) {
    Constraint c = copy();
    c.minute = value;
    return c;
  }

  Constraint withSecond(int value) {
    Constraint c = copy();
    c.second = value;
    return c;
  }

  /** Fixes the weekday; a position of 0 leaves the position unset (every such weekday). */
  Constraint withWeekday(int value, int pos) {
    Constraint c = copy();
    c.weekday = nonZero(value);
    c.weekdayPos = nonZero(pos);
    return c;
  }

  Constraint withWeekNumber(int value) {
    Constraint c = copy();
    c.weekNumber = nonZero(value);
    return c;
  }

  Constraint withYearDay(int value) {
    Constraint c = copy();
    c.yearDay = nonZero(value);
    return c;
  }

  Integer year() {
    return year;
  }

  Integer month() {
    return month;
  }

  Integer day() {
    return day;
  }

  Integer hour() {
    return hour;
  }

  Integer minute() {
    return minute;
  }

  Integer second() {
    return second;
  }

  Integer weekday() {
    return weekday;
  }

  Integer weekdayPos() {
    return weekdayPos;
  }

  Integer weekNumber() {
    return weekNumber;
  }

  Integer yearDay() {
    return yearDay;
  }

  /** True when year and the full time of day are known, the minimum needed to enumerate. */
  boolean isComplete() {
    return year != null && hour != null && minute != null && second != null;
  }

  /** Weekday positions count inside the month for monthly rules and yearly rules with a month. */
  private boolean positionInMonth(PeriodType type) {
    return type == PeriodType.MONTHLY || (type == PeriodType.YEARLY && month != null);
  }

  /**
   * Checks a date against every set date field.
   *
   * @param date the candidate date, in the zone of the rule
   * @param type the rule's period, which decides how a weekday position is counted
   * @return true if no set field contradicts the date
   */
  boolean matches(LocalDate date, PeriodType type) {
    // Around New Year a date can belong to a week of the neighbouring year, so with a week number
    // the year is compared against the week-year.
    if (weekNumber == null) {
      if (year != null && year != date.getYear()) {
        return false;
      }
    } else {
      DateHelper.YearWeek yw =
          weekNumber > 0
              ? DateHelper.weekNumber(date, weekStart)
              : DateHelper.negativeWeekNumber(date, weekStart);
      if (yw.week() != weekNumber) {
        return false;
      }
      if (year != null && year != yw.year()) {
        return false;
      }
    }

    if (month != null && month != date.getMonthValue()) {
      return false;
    }
    if (day != null) {
      if (day > 0 && day != date.getDayOfMonth()) {
        return false;
      }
      if (day < 0 && date.getDayOfMonth() != date.lengthOfMonth() + day + 1) {
        return false;
      }
    }
    if (weekday != null) {
      if (weekday != DateHelper.dayOfWeek(date)) {
        return false;
      }
      if (weekdayPos != null) {
        int index;
        int length;
        if (positionInMonth(type)) {
          index = date.getDayOfMonth();
          length = date.lengthOfMonth();
        } else {
          index = date.getDayOfYear();
          length = date.lengthOfYear();
        }
        if (weekdayPos > 0 && weekdayPos != (index - 1) / 7 + 1) {
          return false;
        }
        if (weekdayPos < 0 && weekdayPos != -((length - index) / 7 + 1)) {
          return false;
        }
      }
    }
    if (yearDay != null) {
      if (yearDay > 0 && yearDay != date.getDayOfYear()) {
        return false;
      }
      if (yearDay < 0 && date.getDayOfYear() != date.lengthOfYear() + yearDay + 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * Checks a wall-clock date/time against every set field.
   *
   * @param dt the candidate, as wall-clock time in the zone of the rule
   * @param type the rule's period
   * @return true if no set field contradicts the candidate
   */
  boolean matches(LocalDateTime dt, PeriodType type) {
    if ((hour != null && hour != dt.getHour())
        || (minute != null && minute != dt.getMinute())
        || (second != null && second != dt.getSecond())) {
      return false;
    }
    return matches(dt.toLocalDate(), type);
  }

  /**
   * Checks a date/time against every set field, using its wall-clock value in its own zone.
   *
   * @param dt the candidate, already converted to the zone of the rule
   * @param type the rule's period
   * @return true if no set field contradicts the candidate
   */
  boolean matches(ZonedDateTime dt, PeriodType type) {
    return matches(dt.toLocalDateTime(), type);
  }

  private static Integer firstSet(Integer a, Integer b) {
    return a != null ? a : b;
  }

  private static boolean conflicts(Integer a, Integer b) {
    return a != null && b != null && !a.equals(b);
  }

  /**
   * Combines the fields of two constraints.
   *
   * @param other the constraint to merge into this one
   * @return the union of both constraints' fields, or empty if both set a field to different
   *     values
   */
  Optional<Constraint> merge(Constraint other) {
    if (conflicts(year, other.year)
        || conflicts(month, other.month)
        || conflicts(day, other.day)
        || conflicts(hour, other.hour)
        || conflicts(minute, other.minute)
        || conflicts(second, other.second)
        || conflicts(weekday, other.weekday)
        || conflicts(weekdayPos, other.weekdayPos)
        || conflicts(weekNumber, other.weekNumber)
        || conflicts(yearDay, other.yearDay)) {
      return Optional.empty();
    }
    Constraint merged = copy();
    merged.year = firstSet(year, other.year);
    merged.month = firstSet(month, other.month);
    merged.day = firstSet(day, other.day);
    merged.hour = firstSet(hour, other.hour);
    merged.minute = firstSet(minute, other.minute);
    merged.second = firstSet(second, other.second);
    merged.weekday = firstSet(weekday, other.weekday);
    merged.weekdayPos = firstSet(weekdayPos, other.weekdayPos);
    merged.weekNumber = firstSet(weekNumber, other.weekNumber);
    merged.yearDay = firstSet(yearDay, other.yearDay);
    return Optional.of(merged);
  }

  /**
   * Checks that the set fields can be satisfied at all: values in range, a month-day that exists
   * in its month in some year, and at most five of any weekday in a month.
   *
   * @param type the rule's period
   * @return false if no date can ever match
   */
  boolean isConsistent(PeriodType type) {
    if (month != null && (month < 1 || month > 12)) {
      return false;
    }
    if (day != null) {
      int maxDay = month != null ? Month.of(month).maxLength() : 31;
      if (Math.abs(day) > maxDay) {
        return false;
      }
    }
    if ((hour != null && (hour < 0 || hour > 23))
        || (minute != null && (minute < 0 || minute > 59))
        || (second != null && (second < 0 || second > 59))) {
      return false;
    }
    if (yearDay != null && Math.abs(yearDay) > 366) {
      return false;
    }
    if (weekNumber != null && Math.abs(weekNumber) > 53) {
      return false;
    }
    if (weekday != null && (weekday < 1 || weekday > 7)) {
      return false;
    }
    if (weekdayPos != null && positionInMonth(type) && Math.abs(weekdayPos) > 5) {
      return false;
    }
    return true;
  }

  /**
   * Returns the start of the bucket described by this constraint: the constraint's values, with
   * time fields finer than the granularity set to zero and date fields finer than it set to the
   * first day of the week, month or year.
   *
   * @param type the bucket granularity
   * @return the bucket start
   */
  ZonedDateTime intervalDateTime(PeriodType type) {
    if (intervalStart != null) {
      return intervalStart;
    }
    int y = year != null ? year : 1;
    LocalTime time =
        switch (type) {
          case SECONDLY -> LocalTime.of(valueOr(hour, 0), valueOr(minute, 0), valueOr(second, 0));
          case MINUTELY -> LocalTime.of(valueOr(hour, 0), valueOr(minute, 0));
          case HOURLY -> LocalTime.of(valueOr(hour, 0), 0);
          default -> LocalTime.MIDNIGHT;
        };
    LocalDate date =
        switch (type) {
          case WEEKLY -> DateHelper.nthWeek(y, valueOr(weekNumber, 1), weekStart);
          case MONTHLY -> LocalDate.of(y, valueOr(month, 1), 1);
          case YEARLY -> LocalDate.of(y, 1, 1);
          default -> {
            LocalDate d = DateHelper.getDate(y, valueOr(month, 1), valueOr(day, 1));
            yield d != null ? d : LocalDate.of(y, valueOr(month, 1), 1);
          }
        };
    intervalStart = DateHelper.atZone(date, time, zone);
    return intervalStart;
  }

  private static int valueOr(Integer value, int fallback) {
    return value != null ? value : fallback;
  }

  /**
   * Moves this bucket constraint by a number of buckets.
   *
   * <p>The bucket start is advanced by {@code freq} units of the granularity (negative to move
   * back) and the fields are read again from the new start. The returned constraint keeps the
   * advanced start as its bucket start, so stepping across a DST overlap does not fall back to the
   * earlier offset.
   *
   * @param type the bucket granularity
   * @param freq the number of units to move
   * @return the constraint of the new bucket
   */
  Constraint increase(PeriodType type, int freq) {
    ZonedDateTime base = intervalDateTime(type);
    ZonedDateTime next =
        switch (type) {
          case SECONDLY -> base.plusSeconds(freq);
          case MINUTELY -> base.plusMinutes(freq);
          case HOURLY -> base.plusHours(freq);
          case DAILY -> base.plusDays(freq);
          case WEEKLY -> base.plusWeeks(freq);
          case MONTHLY -> base.plusMonths(freq);
          case YEARLY -> base.plusYears(freq);
          case NONE -> base;
        };
    Constraint advanced = fromDateTime(next, type, weekStart);
    advanced.intervalStart = next;
    return advanced;
  }

  /**
   * Enumerates every date/time consistent with this constraint.
   *
   * <p>One of five strategies is used, the first that applies: a known month and day give a single
   * date; without weekday, week-number or year-day restrictions the month/day ranges are walked; a
   * year-day gives a single date; a week number gives the up to seven days of that week; a weekday
   * gives its occurrences in the month or year. Candidates are then checked against the full
   * constraint, since the weekday and week strategies over-generate.
   *
   * <p>Requires {@link #isComplete()}. The result is not sorted.
   *
   * @param type the rule's period
   * @return the matching date/times in the constraint's zone
   */
  List<ZonedDateTime> dateTimes(PeriodType type) {
    List<ZonedDateTime> result = new ArrayList<>();
    if (!isComplete() || !isConsistent(type)) {
      return result;
    }
    List<LocalDate> candidates = new ArrayList<>();

    if (day != null && month != null) {
      addIfValid(candidates, DateHelper.getDate(year, month, day));
    } else if (weekday == null && weekNumber == null && yearDay == null) {
      int monthStart = month != null ? month : 1;
      int monthEnd = month != null ? month : 12;
      for (int m = monthStart; m <= monthEnd; m++) {
        int length = YearMonth.of(year, m).lengthOfMonth();
        int dayStart;
        int dayEnd;
        if (day == null) {
          dayStart = 1;
          dayEnd = length;
        } else if (day > 0) {
          dayStart = day;
          dayEnd = day;
        } else {
          dayStart = length + day + 1;
          dayEnd = dayStart;
        }
        for (int d = Math.max(dayStart, 1); d <= dayEnd; d++) {
          addIfValid(candidates, DateHelper.tryCreateDate(year, m, d));
        }
      }
    } else if (yearDay != null) {
      // A negative year-day counts back from January 1st of the next year
      LocalDate d =
          LocalDate.of(year + (yearDay > 0 ? 0 : 1), 1, 1)
              .plusDays(yearDay - (yearDay > 0 ? 1 : 0));
      candidates.add(d);
    } else if (weekNumber != null) {
      LocalDate weekFirst = DateHelper.nthWeek(year, weekNumber, weekStart);
      if (weekday != null) {
        candidates.add(weekFirst.plusDays((7 + weekday - weekStart) % 7));
      } else {
        for (int i = 0; i < 7; i++) {
          candidates.add(weekFirst.plusDays(i));
        }
      }
    } else {
      LocalDate dt = LocalDate.of(year, 1, 1);
      int maxLoop = 53;
      boolean inMonth = positionInMonth(type);
      if (inMonth && month != null) {
        dt = LocalDate.of(year, month, 1);
        maxLoop = 5;
      }
      if (weekdayPos != null && weekdayPos < 0) {
        // From the end of the period: count back from the start of the next one
        dt = inMonth ? dt.plusMonths(1) : dt.plusYears(1);
      }
      dt = dt.plusDays((7 + weekday - DateHelper.dayOfWeek(dt)) % 7);

      if (weekdayPos == null) {
        for (int i = 0; i < maxLoop; i++) {
          candidates.add(dt);
          dt = dt.plusDays(7);
        }
      } else if (weekdayPos > 0) {
        candidates.add(dt.plusDays(7L * (weekdayPos - 1)));
      } else {
        candidates.add(dt.plusDays(7L * weekdayPos));
      }
    }

    LocalTime time = LocalTime.of(hour, minute, second);
    for (LocalDate candidate : candidates) {
      if (matches(candidate, type)) {
        result.add(DateHelper.atZone(candidate, time, zone));
      }
    }
    return result;
  }

  private static void addIfValid(List<LocalDate> list, LocalDate date) {
    if (date != null) {
      list.add(date);
    }
  }

  @Override
  public String toString() {
    return "Y="
        + year
        + ", M="
        + month
        + ", D="
        + day
        + ", H="
        + hour
        + ", m="
        + minute
        + ", S="
        + second
        + ", wd="
        + weekday
        + ", #wd="
        + weekdayPos
        + ", #w="
        + weekNumber
        + ", yd="
        + yearDay;
  }
}
