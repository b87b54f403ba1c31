package io.recur.display;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.Recurrence;
import io.recur.rule.PeriodType;
import io.recur.rule.RecurrenceRule;
import io.recur.rule.WDayPos;
import io.recur.rule.Weekday;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

public class DisplayTest {
  private static final ZonedDateTime START =
      ZonedDateTime.of(2006, 1, 2, 9, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void testRenderRule() {
    RecurrenceRule rule = new RecurrenceRule();
    rule.setRecurrenceType(PeriodType.MONTHLY);
    rule.setStartDt(START);
    rule.setFrequency(2);
    rule.setDuration(5);
    rule.setByDays(List.of(WDayPos.of(-1, Weekday.FRIDAY), WDayPos.every(Weekday.MONDAY)));
    rule.setRRule("FREQ=MONTHLY;INTERVAL=2;COUNT=5;BYDAY=-1FR,MO");

    String text = Display.render(rule);
    assertTrue(text.startsWith("RecurrenceRule: MONTHLY every 2"));
    assertTrue(text.contains("RRULE: FREQ=MONTHLY;INTERVAL=2;COUNT=5;BYDAY=-1FR,MO"));
    assertTrue(text.contains("duration: 5 times"));
    assertTrue(text.contains("BYDAY: -1FR,MO"));
    assertTrue(text.contains("WKST: MO"));
    assertFalse(text.contains("BYMONTHDAY"));
  }

  @Test
  void testRenderRuleEnd() {
    RecurrenceRule rule = new RecurrenceRule();
    rule.setRecurrenceType(PeriodType.DAILY);
    rule.setStartDt(START);
    assertTrue(Display.render(rule).contains("duration: forever"));

    rule.setEndDt(START.plusDays(3));
    rule.setReadOnly(true);
    String text = Display.render(rule);
    assertTrue(text.contains("duration: until " + START.plusDays(3)));
    assertTrue(text.startsWith("RecurrenceRule: DAILY every 1 (read-only)"));
  }

  @Test
  void testRenderRecurrence() {
    Recurrence r = new Recurrence();
    r.setStartDateTime(START, true);
    r.setDaily(1);
    r.addExDate(LocalDate.of(2006, 1, 3));

    String text = Display.render(r);
    assertTrue(text.startsWith("Recurrence: DAILY"));
    assertTrue(text.contains("(all day)"));
    assertTrue(text.contains("1 RRULEs:"));
    assertTrue(text.contains("0 EXRULEs:"));
    assertTrue(text.contains("1 Exception Dates:"));
    assertTrue(text.contains("2006-01-03"));
    assertFalse(text.contains("Recurrence Dates"));
  }

  @Test
  void testDumpLogsAtFine() {
    Logger recurrenceLogger = Logger.getLogger(Recurrence.class.getName());
    Logger ruleLogger = Logger.getLogger(RecurrenceRule.class.getName());
    List<String> messages = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            messages.add(record.getMessage());
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Level recurrenceLevel = recurrenceLogger.getLevel();
    Level ruleLevel = ruleLogger.getLevel();
    recurrenceLogger.addHandler(handler);
    ruleLogger.addHandler(handler);
    try {
      Recurrence r = new Recurrence();
      r.setStartDateTime(START, false);
      r.setWeekly(1, 1);
      r.dump();
      assertTrue(messages.isEmpty());

      recurrenceLogger.setLevel(Level.FINE);
      ruleLogger.setLevel(Level.FINE);
      r.dump();
      assertEquals(2, messages.size());
      assertTrue(messages.get(0).startsWith("Recurrence: WEEKLY"));
      assertTrue(messages.get(1).startsWith("RecurrenceRule: WEEKLY every 1"));
      assertTrue(messages.get(1).contains("Constraints:"));
    } finally {
      recurrenceLogger.removeHandler(handler);
      ruleLogger.removeHandler(handler);
      recurrenceLogger.setLevel(recurrenceLevel);
      ruleLogger.setLevel(ruleLevel);
    }
  }
}
