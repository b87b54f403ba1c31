package io.recur.rule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class WeekdayTest {

  @Test
  void testNumbersFollowIso() {
    for (Weekday d : Weekday.values()) {
      assertEquals(d, Weekday.fromDayOfWeek(d.toDayOfWeek()));
      assertEquals(d.toDayOfWeek().getValue(), d.number());
    }
    assertEquals(DayOfWeek.SUNDAY, Weekday.SUNDAY.toDayOfWeek());
  }

  @Test
  void testFromNumber() {
    assertEquals(Optional.of(Weekday.MONDAY), Weekday.fromNumber(1));
    assertEquals(Optional.of(Weekday.SUNDAY), Weekday.fromNumber(7));
    assertTrue(Weekday.fromNumber(0).isEmpty());
    assertTrue(Weekday.fromNumber(8).isEmpty());
  }

  @Test
  void testCodes() {
    assertEquals("MO", Weekday.MONDAY.code());
    assertEquals("TH", Weekday.THURSDAY.toString());
  }

  @Test
  void testWeekdayPosition() {
    WDayPos lastFriday = WDayPos.of(-1, Weekday.FRIDAY);
    assertEquals(5, lastFriday.day());
    assertEquals(-1, lastFriday.pos());
    assertEquals(Weekday.FRIDAY, lastFriday.weekday());
    assertEquals("-1FR", lastFriday.toString());
    assertEquals("SA", WDayPos.every(Weekday.SATURDAY).toString());
  }

  @Test
  void testWeekdayPositionRejectsOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new WDayPos(0, 1));
    assertThrows(IllegalArgumentException.class, () -> new WDayPos(8, 1));
    assertThrows(IllegalArgumentException.class, () -> new WDayPos(1, 54));
    assertThrows(IllegalArgumentException.class, () -> new WDayPos(1, -54));
  }
}
