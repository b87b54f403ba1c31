package io.recur;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

public class PeriodTest {
  private static final ZonedDateTime START =
      ZonedDateTime.of(2006, 1, 20, 10, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void testBetween() {
    Period p = Period.between(START, START.plusHours(2));
    assertFalse(p.hasDuration());
    assertEquals(Duration.ofHours(2), p.duration());
    assertEquals(START.plusHours(2), p.end());
  }

  @Test
  void testOfDuration() {
    Period p = Period.of(START, Duration.ofMinutes(90));
    assertTrue(p.hasDuration());
    assertEquals(START.plusMinutes(90), p.end());
  }

  @Test
  void testRejectsInvalid() {
    assertThrows(
        IllegalArgumentException.class, () -> Period.between(START, START.minusSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> Period.of(START, Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> Period.between(null, START));
  }

  @Test
  void testEqualityUsesInstants() {
    ZoneId berlin = ZoneId.of("Europe/Berlin");
    Period utc = Period.between(START, START.plusHours(1));
    Period local =
        Period.between(
            START.withZoneSameInstant(berlin), START.plusHours(1).withZoneSameInstant(berlin));
    assertEquals(utc, local);
    assertEquals(utc.hashCode(), local.hashCode());
    assertNotEquals(utc, Period.of(START, Duration.ofHours(1)));
  }

  @Test
  void testShiftTimesKeepsWallClock() {
    ZoneId berlin = ZoneId.of("Europe/Berlin");
    Period shifted = Period.between(START, START.plusHours(2)).shiftTimes(ZoneOffset.UTC, berlin);
    assertEquals(ZonedDateTime.of(2006, 1, 20, 10, 0, 0, 0, berlin), shifted.start());
    assertEquals(ZonedDateTime.of(2006, 1, 20, 12, 0, 0, 0, berlin), shifted.end());

    Period byDuration = Period.of(START, Duration.ofHours(3)).shiftTimes(ZoneOffset.UTC, berlin);
    assertEquals(Duration.ofHours(3), byDuration.duration());
  }
}
