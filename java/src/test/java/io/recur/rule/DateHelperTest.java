package io.recur.rule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import org.junit.jupiter.api.Test;

/** Tests for week numbering and date arithmetic. */
public class DateHelperTest {

  @Test
  void testDaysSinceWeekStart() {
    LocalDate sunday = LocalDate.of(2006, 1, 1);
    assertEquals(6, DateHelper.daysSinceWeekStart(sunday, 1));
    assertEquals(0, DateHelper.daysSinceWeekStart(sunday, 7));
    assertEquals(1, DateHelper.daysSinceWeekStart(sunday, 6));
  }

  @Test
  void testWeekOneStart() {
    // January 4th 2006 is a Wednesday
    assertEquals(LocalDate.of(2006, 1, 2), DateHelper.weekOneStart(2006, 1));
    assertEquals(LocalDate.of(2006, 1, 1), DateHelper.weekOneStart(2006, 7));
  }

  @Test
  void testWeekNumberAroundNewYear() {
    assertEquals(
        new DateHelper.YearWeek(2005, 52), DateHelper.weekNumber(LocalDate.of(2006, 1, 1), 1));
    assertEquals(
        new DateHelper.YearWeek(2009, 1), DateHelper.weekNumber(LocalDate.of(2008, 12, 29), 1));
    assertEquals(
        new DateHelper.YearWeek(2025, 1), DateHelper.weekNumber(LocalDate.of(2024, 12, 31), 1));
  }

  @Test
  void testWeekNumberMatchesIsoWeeks() {
    LocalDate date = LocalDate.of(2003, 12, 1);
    LocalDate end = LocalDate.of(2010, 2, 1);
    for (; date.isBefore(end); date = date.plusDays(1)) {
      DateHelper.YearWeek yw = DateHelper.weekNumber(date, 1);
      assertEquals(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR), yw.week(), date.toString());
      assertEquals(date.get(IsoFields.WEEK_BASED_YEAR), yw.year(), date.toString());
    }
  }

  @Test
  void testWeeksInYear() {
    assertEquals(53, DateHelper.weeksInYear(2004, 1));
    assertEquals(52, DateHelper.weeksInYear(2006, 1));
    assertEquals(53, DateHelper.weeksInYear(2020, 1));
  }

  @Test
  void testNegativeWeekNumber() {
    assertEquals(
        new DateHelper.YearWeek(2004, -1),
        DateHelper.negativeWeekNumber(LocalDate.of(2004, 12, 27), 1));
    assertEquals(
        new DateHelper.YearWeek(2006, -52),
        DateHelper.negativeWeekNumber(LocalDate.of(2006, 1, 2), 1));
  }

  @Test
  void testNthWeek() {
    assertEquals(LocalDate.of(2006, 1, 2), DateHelper.nthWeek(2006, 1, 1));
    assertEquals(LocalDate.of(2006, 1, 9), DateHelper.nthWeek(2006, 2, 1));
    // 2007 week 1 starts on Monday January 1st
    assertEquals(LocalDate.of(2006, 12, 25), DateHelper.nthWeek(2006, -1, 1));
    assertEquals(LocalDate.of(2004, 12, 27), DateHelper.nthWeek(2004, 53, 1));
  }

  @Test
  void testGetDate() {
    assertEquals(LocalDate.of(2024, 2, 29), DateHelper.getDate(2024, 2, -1));
    assertEquals(LocalDate.of(2023, 2, 28), DateHelper.getDate(2023, 2, -1));
    assertEquals(LocalDate.of(2006, 1, 31), DateHelper.getDate(2006, 1, 31));
    assertNull(DateHelper.getDate(2023, 2, 30));
    assertNull(DateHelper.getDate(2023, 13, -1));
  }
}
