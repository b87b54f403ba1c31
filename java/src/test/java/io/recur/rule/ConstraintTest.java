package io.recur.rule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Unit tests for partial date/time constraints. */
public class ConstraintTest {
  private static final ZoneId UTC = ZoneOffset.UTC;

  private static Constraint unbound() {
    return Constraint.unbound(UTC, 1);
  }

  private static ZonedDateTime utc(int y, int m, int d, int h, int min) {
    return ZonedDateTime.of(y, m, d, h, min, 0, 0, UTC);
  }

  @Test
  void testFromDateTimeMonthly() {
    Constraint c = Constraint.fromDateTime(utc(2006, 1, 15, 10, 30), PeriodType.MONTHLY, 1);
    assertEquals(2006, c.year());
    assertEquals(1, c.month());
    assertNull(c.day());
    assertNull(c.hour());
  }

  @Test
  void testFromDateTimeWeeklyUsesWeekYear() {
    Constraint c = Constraint.fromDateTime(utc(2006, 1, 1, 10, 0), PeriodType.WEEKLY, 1);
    assertEquals(2005, c.year());
    assertEquals(52, c.weekNumber());
    assertNull(c.month());
  }

  @Test
  void testFromDateTimeHourly() {
    Constraint c = Constraint.fromDateTime(utc(2006, 3, 4, 10, 30), PeriodType.HOURLY, 1);
    assertEquals(4, c.day());
    assertEquals(10, c.hour());
    assertNull(c.minute());
  }

  @Test
  void testMergeUnionsFields() {
    Optional<Constraint> merged = unbound().withMonth(3).merge(unbound().withDay(5).withHour(9));
    assertTrue(merged.isPresent());
    assertEquals(3, merged.get().month());
    assertEquals(5, merged.get().day());
    assertEquals(9, merged.get().hour());
  }

  @Test
  void testMergeConflictFails() {
    assertTrue(unbound().withMonth(3).merge(unbound().withMonth(4)).isEmpty());
    assertTrue(unbound().withMonth(3).merge(unbound().withMonth(3)).isPresent());
  }

  @Test
  void testMatchesNegativeDay() {
    Constraint lastDay = unbound().withDay(-1);
    assertTrue(lastDay.matches(LocalDate.of(2024, 2, 29), PeriodType.MONTHLY));
    assertFalse(lastDay.matches(LocalDate.of(2024, 2, 28), PeriodType.MONTHLY));
    assertTrue(lastDay.matches(LocalDate.of(2023, 2, 28), PeriodType.MONTHLY));
  }

  @Test
  void testMatchesNegativeYearDay() {
    Constraint lastDay = unbound().withYearDay(-1);
    assertTrue(lastDay.matches(LocalDate.of(2024, 12, 31), PeriodType.YEARLY));
    assertFalse(lastDay.matches(LocalDate.of(2024, 12, 30), PeriodType.YEARLY));
    assertTrue(unbound().withYearDay(60).matches(LocalDate.of(2024, 2, 29), PeriodType.YEARLY));
  }

  @Test
  void testMatchesWeekdayPositionInMonth() {
    // 2006-01-10 is the second Tuesday of January
    Constraint secondTuesday = unbound().withWeekday(2, 2);
    assertTrue(secondTuesday.matches(LocalDate.of(2006, 1, 10), PeriodType.MONTHLY));
    assertFalse(secondTuesday.matches(LocalDate.of(2006, 1, 3), PeriodType.MONTHLY));
    assertFalse(secondTuesday.matches(LocalDate.of(2006, 1, 11), PeriodType.MONTHLY));
  }

  @Test
  void testMatchesWeekdayPositionInYear() {
    // Yearly without a month counts positions in the year: the last Tuesday of 2006 is Dec 26
    Constraint lastTuesday = unbound().withWeekday(2, -1);
    assertTrue(lastTuesday.matches(LocalDate.of(2006, 12, 26), PeriodType.YEARLY));
    assertFalse(lastTuesday.matches(LocalDate.of(2006, 1, 31), PeriodType.YEARLY));
    assertTrue(lastTuesday.matches(LocalDate.of(2006, 1, 31), PeriodType.MONTHLY));
  }

  @Test
  void testMatchesWeekNumberAcrossYears() {
    Constraint week1 = unbound().withYear(2009).withWeekNumber(1);
    assertTrue(week1.matches(LocalDate.of(2008, 12, 29), PeriodType.WEEKLY));
    assertFalse(week1.matches(LocalDate.of(2009, 12, 29), PeriodType.WEEKLY));
  }

  @Test
  void testIsConsistent() {
    assertFalse(unbound().withMonth(2).withDay(30).isConsistent(PeriodType.YEARLY));
    assertTrue(unbound().withMonth(2).withDay(29).isConsistent(PeriodType.YEARLY));
    assertFalse(unbound().withMonth(13).isConsistent(PeriodType.YEARLY));
    assertFalse(unbound().withHour(24).isConsistent(PeriodType.DAILY));
    assertFalse(unbound().withWeekday(1, 6).isConsistent(PeriodType.MONTHLY));
    assertTrue(unbound().withWeekday(1, 6).isConsistent(PeriodType.YEARLY));
    assertFalse(unbound().withYearDay(367).isConsistent(PeriodType.YEARLY));
  }

  @Test
  void testIsComplete() {
    Constraint c = unbound().withYear(2006).withHour(9).withMinute(0);
    assertFalse(c.isComplete());
    assertTrue(c.withSecond(0).isComplete());
  }

  @Test
  void testDateTimesLastFridayOfMonth() {
    Constraint bucket = Constraint.fromDateTime(utc(2006, 1, 1, 0, 0), PeriodType.MONTHLY, 1);
    Constraint rule = unbound().withWeekday(5, -1).withHour(9).withMinute(0).withSecond(0);
    List<ZonedDateTime> dts = bucket.merge(rule).orElseThrow().dateTimes(PeriodType.MONTHLY);
    assertEquals(List.of(utc(2006, 1, 27, 9, 0)), dts);
  }

  @Test
  void testDateTimesEveryMondayOfMonth() {
    Constraint bucket = Constraint.fromDateTime(utc(2006, 1, 1, 0, 0), PeriodType.MONTHLY, 1);
    Constraint rule = unbound().withWeekday(1, 0).withHour(8).withMinute(0).withSecond(0);
    List<ZonedDateTime> dts = bucket.merge(rule).orElseThrow().dateTimes(PeriodType.MONTHLY);
    assertEquals(
        List.of(
            utc(2006, 1, 2, 8, 0),
            utc(2006, 1, 9, 8, 0),
            utc(2006, 1, 16, 8, 0),
            utc(2006, 1, 23, 8, 0),
            utc(2006, 1, 30, 8, 0)),
        dts);
  }

  @Test
  void testDateTimesImpossibleDate() {
    Constraint bucket = Constraint.fromDateTime(utc(2006, 2, 1, 0, 0), PeriodType.MONTHLY, 1);
    Constraint rule = unbound().withDay(30).withHour(8).withMinute(0).withSecond(0);
    assertTrue(bucket.merge(rule).orElseThrow().dateTimes(PeriodType.MONTHLY).isEmpty());
  }

  @Test
  void testDateTimesIncompleteIsEmpty() {
    assertTrue(unbound().withYear(2006).dateTimes(PeriodType.YEARLY).isEmpty());
  }

  @Test
  void testIntervalDateTime() {
    Constraint weekly = Constraint.fromDateTime(utc(2006, 1, 5, 10, 0), PeriodType.WEEKLY, 1);
    assertEquals(utc(2006, 1, 2, 0, 0), weekly.intervalDateTime(PeriodType.WEEKLY));

    Constraint hourly = Constraint.fromDateTime(utc(2006, 1, 5, 10, 45), PeriodType.HOURLY, 1);
    assertEquals(utc(2006, 1, 5, 10, 0), hourly.intervalDateTime(PeriodType.HOURLY));
  }

  @Test
  void testIncrease() {
    Constraint jan = Constraint.fromDateTime(utc(2006, 1, 1, 0, 0), PeriodType.MONTHLY, 1);
    Constraint feb = jan.increase(PeriodType.MONTHLY, 1);
    assertEquals(2006, feb.year());
    assertEquals(2, feb.month());

    Constraint dec = jan.increase(PeriodType.MONTHLY, -1);
    assertEquals(2005, dec.year());
    assertEquals(12, dec.month());
    assertEquals(utc(2005, 12, 1, 0, 0), dec.intervalDateTime(PeriodType.MONTHLY));
  }
}
