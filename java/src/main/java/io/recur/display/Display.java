package io.recur.display;

import io.recur.Recurrence;
import io.recur.rule.RecurrenceRule;
import io.recur.rule.Weekday;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Collectors;

/** Renders rules and recurrences as multi-line diagnostic text. */
public final class Display {
  private static final String INDENT = "   ";

  private Display() {}

  /**
   * Renders a recurrence rule.
   *
   * @param rule the rule to render
   * @return the rendering, one property per line
   */
  public static String render(RecurrenceRule rule) {
    StringBuilder sb = new StringBuilder();
    sb.append("RecurrenceRule: ").append(rule.recurrenceType());
    if (rule.recurs()) {
      sb.append(" every ").append(rule.frequency());
    }
    if (rule.isReadOnly()) {
      sb.append(" (read-only)");
    }
    if (!rule.rrule().isEmpty()) {
      line(sb, "RRULE", rule.rrule());
    }
    line(sb, "start", rule.startDt() != null ? rule.startDt().toString() : "-");
    if (rule.allDay()) {
      sb.append(" (all day)");
    }
    line(sb, "duration", renderDuration(rule));

    list(sb, "BYSECOND", rule.bySeconds());
    list(sb, "BYMINUTE", rule.byMinutes());
    list(sb, "BYHOUR", rule.byHours());
    list(sb, "BYDAY", rule.byDays());
    list(sb, "BYMONTHDAY", rule.byMonthDays());
    list(sb, "BYYEARDAY", rule.byYearDays());
    list(sb, "BYWEEKNO", rule.byWeekNumbers());
    list(sb, "BYMONTH", rule.byMonths());
    list(sb, "BYSETPOS", rule.bySetPos());
    line(sb, "WKST", Weekday.fromNumber(rule.weekStart()).map(Weekday::code).orElse("?"));
    return sb.toString();
  }

  private static String renderDuration(RecurrenceRule rule) {
    if (rule.duration() < 0) {
      return "forever";
    }
    if (rule.duration() == 0) {
      return "until " + rule.endDt().map(ZonedDateTime::toString).orElse("-");
    }
    return rule.duration() + " times";
  }

  /**
   * Renders a recurrence with all its rules and explicit dates.
   *
   * @param recurrence the recurrence to render
   * @return the rendering
   */
  public static String render(Recurrence recurrence) {
    StringBuilder sb = new StringBuilder();
    sb.append("Recurrence: ").append(recurrence.recurrenceType());
    ZonedDateTime start = recurrence.startDateTime();
    line(sb, "start", start != null ? start.toString() : "-");
    if (recurrence.allDay()) {
      sb.append(" (all day)");
    }
    rules(sb, "RRULEs", recurrence.rRules());
    rules(sb, "EXRULEs", recurrence.exRules());
    dates(sb, "Recurrence Dates", recurrence.rDates());
    dates(sb, "Recurrence Date/Times", recurrence.rDateTimes());
    dates(sb, "Exception Dates", recurrence.exDates());
    dates(sb, "Exception Date/Times", recurrence.exDateTimes());
    return sb.toString();
  }

  private static void rules(StringBuilder sb, String label, List<RecurrenceRule> rules) {
    sb.append('\n').append(INDENT).append(rules.size()).append(' ').append(label).append(':');
    for (RecurrenceRule rule : rules) {
      for (String l : render(rule).split("\n")) {
        sb.append('\n').append(INDENT).append(INDENT).append(l);
      }
    }
  }

  private static void dates(StringBuilder sb, String label, List<?> values) {
    if (values.isEmpty()) {
      return;
    }
    sb.append('\n').append(INDENT).append(values.size()).append(' ').append(label).append(':');
    for (Object value : values) {
      sb.append('\n').append(INDENT).append(INDENT).append(value);
    }
  }

  private static void line(StringBuilder sb, String label, String value) {
    sb.append('\n').append(INDENT).append(label).append(": ").append(value);
  }

  private static void list(StringBuilder sb, String label, List<?> values) {
    if (values.isEmpty()) {
      return;
    }
    line(sb, label, values.stream().map(Object::toString).collect(Collectors.joining(",")));
  }
}
