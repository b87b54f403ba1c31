package io.recur;

import io.recur.display.Display;
import io.recur.rule.PeriodType;
import io.recur.rule.RecurrenceRule;
import io.recur.rule.WDayPos;
import io.recur.rule.Weekday;
import io.recur.util.SortedLists;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The recurrence of a calendar event: inclusion rules (RRULE), exclusion rules (EXRULE), explicit
 * inclusion dates (RDATE) and exclusion dates (EXDATE) around a start date/time.
 *
 * <p>A date/time is an occurrence if it is the start, an RDATE or an occurrence of some RRULE, and
 * is neither an EXDATE nor an occurrence of any EXRULE. Exclusions always win. For all-day
 * recurrences an EXRULE matching a day excludes the whole day.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Recurrence r = new Recurrence();
 * r.setStartDateTime(ZonedDateTime.of(2024, 1, 1, 9, 0, 0, 0, ZoneId.of("Europe/Berlin")), false);
 * r.setWeekly(1, EnumSet.of(Weekday.MONDAY, Weekday.WEDNESDAY), 1);
 * r.setDuration(10);
 * Optional<ZonedDateTime> next = r.getNextDateTime(ZonedDateTime.now());
 * }</pre>
 *
 * <h2>Legacy single-rule API</h2>
 *
 * <p>Setters such as {@link #setDaily(int)} or {@link #addMonthlyDate(int)} act on the first RRULE
 * only, creating it when needed. They are thin wrappers over {@link #addRRule(RecurrenceRule)} and
 * the rule's own setters.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <p>SEARCH_LIMIT (1000): Maximum number of candidates tried by {@link
 * #getNextDateTime(ZonedDateTime)} and {@link #getPreviousDateTime(ZonedDateTime)}. An EXRULE can
 * cancel every occurrence of an RRULE; once the limit is hit the search reports no occurrence.
 *
 * <p>Not thread safe; see {@link RecurrenceRule}.
 */
public final class Recurrence {
  private static final Logger LOGGER = Logger.getLogger(Recurrence.class.getName());

  /** Maximum number of candidates tried by the next/previous occurrence searches. */
  public static final int SEARCH_LIMIT = 1000;

  /** Receives a callback whenever a recurrence, or one of its rules, changes. */
  @FunctionalInterface
  public interface Observer {
    /**
     * Called after any change to the recurrence.
     *
     * @param recurrence the recurrence that changed
     */
    void recurrenceUpdated(Recurrence recurrence);
  }

  private final List<RecurrenceRule> rRules = new ArrayList<>();
  private final List<RecurrenceRule> exRules = new ArrayList<>();
  private List<ZonedDateTime> rDateTimes = new ArrayList<>();
  private Map<Instant, Period> rDateTimePeriods = new HashMap<>();
  private List<LocalDate> rDates = new ArrayList<>();
  private List<ZonedDateTime> exDateTimes = new ArrayList<>();
  private List<LocalDate> exDates = new ArrayList<>();
  private ZonedDateTime startDateTime;
  private boolean allDay;
  private boolean readOnly;

  private final List<Observer> observers = new ArrayList<>();
  private final RecurrenceRule.RuleObserver ruleObserver = rule -> updated();

  // null until computed
  private RecurrenceType cachedType;

  /** Creates a recurrence without rules or dates. */
  public Recurrence() {}

  /**
   * Creates a deep copy of another recurrence. Rules are copied; observers are not.
   *
   * @param other the recurrence to copy
   */
  public Recurrence(Recurrence other) {
    rDateTimes = new ArrayList<>(other.rDateTimes);
    rDateTimePeriods = new HashMap<>(other.rDateTimePeriods);
    rDates = new ArrayList<>(other.rDates);
    exDateTimes = new ArrayList<>(other.exDateTimes);
    exDates = new ArrayList<>(other.exDates);
    startDateTime = other.startDateTime;
    allDay = other.allDay;
    readOnly = other.readOnly;
    cachedType = other.cachedType;
    for (RecurrenceRule rule : other.rRules) {
      RecurrenceRule copy = new RecurrenceRule(rule);
      rRules.add(copy);
      copy.addObserver(ruleObserver);
    }
    for (RecurrenceRule rule : other.exRules) {
      RecurrenceRule copy = new RecurrenceRule(rule);
      exRules.add(copy);
      copy.addObserver(ruleObserver);
    }
  }

  // ---------------------------------------------------------------------------
  // Observers

  /**
   * Registers an observer; registering the same observer twice has no effect.
   *
   * @param observer the observer
   */
  public void addObserver(Observer observer) {
    if (!observers.contains(observer)) {
      observers.add(observer);
    }
  }

  public void removeObserver(Observer observer) {
    observers.remove(observer);
  }

  private void updated() {
    cachedType = null;
    for (Observer observer : List.copyOf(observers)) {
      observer.recurrenceUpdated(this);
    }
  }

  // ---------------------------------------------------------------------------
  // Start, all-day, read-only

  /**
   * Returns the start of the recurrence.
   *
   * @return the start, or null if none has been set
   */
  public ZonedDateTime startDateTime() {
    return startDateTime;
  }

  /**
   * Returns the date of the start.
   *
   * @return the start date, or null if no start has been set
   */
  public LocalDate startDate() {
    return startDateTime != null ? startDateTime.toLocalDate() : null;
  }

  /**
   * Sets the start of the recurrence and of all its rules.
   *
   * @param start the first occurrence; its zone is the zone the recurrence is evaluated in
   * @param allDay true if occurrences are whole days
   */
  public void setStartDateTime(ZonedDateTime start, boolean allDay) {
    if (readOnly) {
      return;
    }
    startDateTime = Objects.requireNonNull(start);
    setAllDay(allDay);
    for (RecurrenceRule rule : rRules) {
      rule.setStartDt(start);
    }
    for (RecurrenceRule rule : exRules) {
      rule.setStartDt(start);
    }
    updated();
  }

  public boolean allDay() {
    return allDay;
  }

  /**
   * Sets whether occurrences are whole days, for the recurrence and all its rules.
   *
   * @param allDay true for an all-day recurrence
   */
  public void setAllDay(boolean allDay) {
    if (readOnly || allDay == this.allDay) {
      return;
    }
    this.allDay = allDay;
    for (RecurrenceRule rule : rRules) {
      rule.setAllDay(allDay);
    }
    for (RecurrenceRule rule : exRules) {
      rule.setAllDay(allDay);
    }
    updated();
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  /**
   * Makes every mutator a silent no-op, or lifts that restriction again.
   *
   * @param readOnly true to freeze the recurrence
   */
  public void setReadOnly(boolean readOnly) {
    this.readOnly = readOnly;
  }

  /**
   * Returns true if the recurrence has any RRULE or RDATE.
   *
   * @return false for a single, non-recurring event
   */
  public boolean recurs() {
    return !rRules.isEmpty() || !rDates.isEmpty() || !rDateTimes.isEmpty();
  }

  /** Removes every RRULE, keeping explicit dates and exclusions. */
  public void unsetRecurs() {
    if (readOnly) {
      return;
    }
    for (RecurrenceRule rule : rRules) {
      rule.removeObserver(ruleObserver);
    }
    rRules.clear();
    updated();
  }

  /** Removes every rule and every explicit date. The start is kept. */
  public void clear() {
    if (readOnly) {
      return;
    }
    for (RecurrenceRule rule : rRules) {
      rule.removeObserver(ruleObserver);
    }
    for (RecurrenceRule rule : exRules) {
      rule.removeObserver(ruleObserver);
    }
    rRules.clear();
    exRules.clear();
    rDates.clear();
    rDateTimes.clear();
    rDateTimePeriods.clear();
    exDates.clear();
    exDateTimes.clear();
    updated();
  }

  /**
   * Moves the recurrence to another zone, keeping the wall-clock times every date/time had in
   * {@code oldZone}.
   *
   * @param oldZone the zone whose wall-clock times are kept
   * @param newZone the new zone
   */
  public void shiftTimes(ZoneId oldZone, ZoneId newZone) {
    if (readOnly) {
      return;
    }
    if (startDateTime != null) {
      startDateTime = shift(startDateTime, oldZone, newZone);
    }

    List<ZonedDateTime> shifted = new ArrayList<>(rDateTimes.size());
    Map<Instant, Period> periods = new HashMap<>();
    for (ZonedDateTime rdt : rDateTimes) {
      ZonedDateTime moved = shift(rdt, oldZone, newZone);
      Period period = rDateTimePeriods.get(rdt.toInstant());
      if (period != null) {
        periods.put(moved.toInstant(), period.shiftTimes(oldZone, newZone));
      }
      shifted.add(moved);
    }
    SortedLists.sortAndRemoveDuplicates(shifted, SortedLists.BY_INSTANT);
    rDateTimes = shifted;
    rDateTimePeriods = periods;

    List<ZonedDateTime> shiftedEx = new ArrayList<>(exDateTimes.size());
    for (ZonedDateTime exdt : exDateTimes) {
      shiftedEx.add(shift(exdt, oldZone, newZone));
    }
    SortedLists.sortAndRemoveDuplicates(shiftedEx, SortedLists.BY_INSTANT);
    exDateTimes = shiftedEx;

    for (RecurrenceRule rule : rRules) {
      rule.shiftTimes(oldZone, newZone);
    }
    for (RecurrenceRule rule : exRules) {
      rule.shiftTimes(oldZone, newZone);
    }
    updated();
  }

  private static ZonedDateTime shift(ZonedDateTime dt, ZoneId oldZone, ZoneId newZone) {
    return dt.withZoneSameInstant(oldZone).withZoneSameLocal(newZone);
  }

  // ---------------------------------------------------------------------------
  // Queries

  /**
   * Returns true if the recurrence has an occurrence on a date.
   *
   * @param date the date
   * @param zone the zone the date is taken in; all-day recurrences use the zone of the start
   * @return true if some occurrence falls on the date and is not excluded
   */
  public boolean recursOn(LocalDate date, ZoneId zone) {
    if (startDateTime == null) {
      return false;
    }
    ZoneId tz = queryZone(zone);
    if (endsBeforeStart(date, tz)) {
      return false;
    }
    if (SortedLists.contains(exDates, date)) {
      return false;
    }
    // Exclusions take precedence, so a matching EXRULE rules out the whole all-day date
    if (allDay && exRuleRecursOn(date, tz)) {
      return false;
    }

    boolean recurs =
        startDateTime.withZoneSameInstant(tz).toLocalDate().equals(date)
            || SortedLists.contains(rDates, date);
    for (int i = 0; i < rDateTimes.size() && !recurs; i++) {
      recurs = rDateTimes.get(i).withZoneSameInstant(tz).toLocalDate().equals(date);
    }
    for (int i = 0; i < rRules.size() && !recurs; i++) {
      recurs = rRules.get(i).recursOn(date, tz);
    }
    if (!recurs) {
      return false;
    }

    boolean exon = false;
    for (int i = 0; i < exDateTimes.size() && !exon; i++) {
      exon = exDateTimes.get(i).withZoneSameInstant(tz).toLocalDate().equals(date);
    }
    if (!allDay) {
      for (int i = 0; i < exRules.size() && !exon; i++) {
        exon = exRules.get(i).recursOn(date, tz);
      }
    }
    if (!exon) {
      return true;
    }
    // Some times of the day are excluded; only the full list tells whether any remain
    return !recurTimesOn(date, zone).isEmpty();
  }

  /**
   * Returns true if the recurrence has an occurrence at exactly the given instant.
   *
   * @param dt the date/time
   * @return true if {@code dt} is an occurrence that is not excluded
   */
  public boolean recursAt(ZonedDateTime dt) {
    if (startDateTime == null) {
      return false;
    }
    ZonedDateTime local = dt.withZoneSameInstant(startDateTime.getZone());
    if (isExcluded(local)) {
      return false;
    }
    if (startDateTime.isEqual(local)
        || SortedLists.contains(rDateTimes, local, SortedLists.BY_INSTANT)) {
      return true;
    }
    if (SortedLists.contains(rDates, local.toLocalDate())
        && rDateAtStartTime(local.toLocalDate()).isEqual(local)) {
      return true;
    }
    for (RecurrenceRule rule : rRules) {
      if (rule.recursAt(local)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the times of day of the occurrences on a date.
   *
   * @param date the date
   * @param zone the zone the date and the returned times are taken in; all-day recurrences use the
   *     zone of the start
   * @return the times, ascending and without duplicates
   */
  public List<LocalTime> recurTimesOn(LocalDate date, ZoneId zone) {
    List<LocalTime> times = new ArrayList<>();
    if (startDateTime == null) {
      return times;
    }
    ZoneId tz = queryZone(zone);
    if (endsBeforeStart(date, tz)
        || SortedLists.contains(exDates, date)) {
      return times;
    }
    if (allDay && exRuleRecursOn(date, tz)) {
      return times;
    }

    ZonedDateTime start = startDateTime.withZoneSameInstant(tz);
    if (start.toLocalDate().equals(date)) {
      times.add(start.toLocalTime());
    }
    if (SortedLists.contains(rDates, date)) {
      times.add(startDateTime.toLocalTime());
    }
    addTimesOn(times, rDateTimes, date, tz);
    for (RecurrenceRule rule : rRules) {
      times.addAll(rule.recurTimesOn(date, tz));
    }
    SortedLists.sortAndRemoveDuplicates(times);

    List<LocalTime> exTimes = new ArrayList<>();
    addTimesOn(exTimes, exDateTimes, date, tz);
    if (!allDay) {
      for (RecurrenceRule rule : exRules) {
        exTimes.addAll(rule.recurTimesOn(date, tz));
      }
    }
    SortedLists.sortAndRemoveDuplicates(exTimes);
    SortedLists.setDifference(times, exTimes);
    return times;
  }

  private static void addTimesOn(
      List<LocalTime> times, List<ZonedDateTime> dateTimes, LocalDate date, ZoneId zone) {
    for (ZonedDateTime dt : dateTimes) {
      ZonedDateTime local = dt.withZoneSameInstant(zone);
      if (local.toLocalDate().equals(date)) {
        times.add(local.toLocalTime());
      }
    }
  }

  /**
   * Returns every occurrence between two date/times, both inclusive.
   *
   * @param start the start of the interval
   * @param end the end of the interval
   * @return the occurrences, ascending and without duplicates
   */
  public List<ZonedDateTime> timesInInterval(ZonedDateTime start, ZonedDateTime end) {
    List<ZonedDateTime> times = new ArrayList<>();
    if (startDateTime == null) {
      return times;
    }
    for (RecurrenceRule rule : rRules) {
      times.addAll(rule.timesInInterval(start, end));
    }
    for (ZonedDateTime rdt : rDateTimes) {
      if (isWithin(rdt, start, end)) {
        times.add(rdt);
      }
    }
    for (LocalDate rdate : rDates) {
      ZonedDateTime dt = rDateAtStartTime(rdate);
      if (isWithin(dt, start, end)) {
        times.add(dt);
      }
    }
    if (isWithin(startDateTime, start, end)) {
      times.add(startDateTime);
    }
    SortedLists.sortAndRemoveDuplicates(times, SortedLists.BY_INSTANT);

    ZoneId zone = startDateTime.getZone();
    times.removeIf(
        dt ->
            SortedLists.contains(exDates, dt.withZoneSameInstant(zone).toLocalDate()));
    if (allDay && !exRules.isEmpty()) {
      times.removeIf(dt -> exRuleRecursOn(dt.withZoneSameInstant(zone).toLocalDate(), zone));
    }

    List<ZonedDateTime> exTimes = new ArrayList<>(exDateTimes);
    for (RecurrenceRule rule : exRules) {
      exTimes.addAll(rule.timesInInterval(start, end));
    }
    SortedLists.sortAndRemoveDuplicates(exTimes, SortedLists.BY_INSTANT);
    SortedLists.setDifference(times, exTimes, SortedLists.BY_INSTANT);
    return times;
  }

  /**
   * Returns the first occurrence strictly after a date/time.
   *
   * @param after the reference date/time (exclusive)
   * @return the next occurrence, or empty if there is none or none was found within {@link
   *     #SEARCH_LIMIT} candidates
   */
  public Optional<ZonedDateTime> getNextDateTime(ZonedDateTime after) {
    if (startDateTime == null) {
      return Optional.empty();
    }
    ZonedDateTime nextDT = after;
    for (int loop = 0; loop < SEARCH_LIMIT; loop++) {
      List<ZonedDateTime> candidates = new ArrayList<>();
      if (nextDT.isBefore(startDateTime)) {
        candidates.add(startDateTime);
      }
      int i = SortedLists.upperBound(rDateTimes, nextDT, SortedLists.BY_INSTANT);
      if (i < rDateTimes.size()) {
        candidates.add(rDateTimes.get(i));
      }
      for (LocalDate rdate : rDates) {
        ZonedDateTime dt = rDateAtStartTime(rdate);
        if (dt.isAfter(nextDT)) {
          candidates.add(dt);
          break;
        }
      }
      for (RecurrenceRule rule : rRules) {
        rule.getNextDate(nextDT).ifPresent(candidates::add);
      }

      if (candidates.isEmpty()) {
        return Optional.empty();
      }
      nextDT = Collections.min(candidates, SortedLists.BY_INSTANT);
      if (!isExcluded(nextDT)) {
        return Optional.of(nextDT);
      }
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("No occurrence after " + after + " within " + SEARCH_LIMIT + " candidates");
    }
    return Optional.empty();
  }

  /**
   * Returns the last occurrence strictly before a date/time.
   *
   * @param before the reference date/time (exclusive)
   * @return the previous occurrence, or empty if there is none or none was found within {@link
   *     #SEARCH_LIMIT} candidates
   */
  public Optional<ZonedDateTime> getPreviousDateTime(ZonedDateTime before) {
    if (startDateTime == null) {
      return Optional.empty();
    }
    ZonedDateTime prevDT = before;
    for (int loop = 0; loop < SEARCH_LIMIT; loop++) {
      List<ZonedDateTime> candidates = new ArrayList<>();
      if (prevDT.isAfter(startDateTime)) {
        candidates.add(startDateTime);
      }
      int i = SortedLists.strictLowerBound(rDateTimes, prevDT, SortedLists.BY_INSTANT);
      if (i >= 0) {
        candidates.add(rDateTimes.get(i));
      }
      for (int j = rDates.size() - 1; j >= 0; j--) {
        ZonedDateTime dt = rDateAtStartTime(rDates.get(j));
        if (dt.isBefore(prevDT)) {
          candidates.add(dt);
          break;
        }
      }
      for (RecurrenceRule rule : rRules) {
        rule.getPreviousDate(prevDT).ifPresent(candidates::add);
      }

      if (candidates.isEmpty()) {
        return Optional.empty();
      }
      prevDT = Collections.max(candidates, SortedLists.BY_INSTANT);
      if (!isExcluded(prevDT)) {
        return Optional.of(prevDT);
      }
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("No occurrence before " + before + " within " + SEARCH_LIMIT + " candidates");
    }
    return Optional.empty();
  }

  /**
   * Returns a lazy stream of occurrences strictly after the given time.
   *
   * @param from the reference time (exclusive)
   * @return a stream of occurrences
   */
  public Stream<ZonedDateTime> occurrences(ZonedDateTime from) {
    Iterator<ZonedDateTime> iterator =
        new Iterator<>() {
          private ZonedDateTime current = from;
          private ZonedDateTime next = null;
          private boolean hasNext = false;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              Optional<ZonedDateTime> result = getNextDateTime(current);
              if (result.isPresent()) {
                next = result.get();
                current = next;
                hasNext = true;
              } else {
                hasNext = false;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return hasNext;
          }

          @Override
          public ZonedDateTime next() {
            computeNext();
            if (!hasNext) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns a lazy stream of occurrences where from &lt; occurrence &lt;= to.
   *
   * @param from the start time (exclusive)
   * @param to the end time (inclusive)
   * @return a stream of occurrences in the range
   */
  public Stream<ZonedDateTime> between(ZonedDateTime from, ZonedDateTime to) {
    return occurrences(from).takeWhile(dt -> !dt.isAfter(to));
  }

  private ZoneId queryZone(ZoneId zone) {
    return allDay ? startDateTime.getZone() : zone;
  }

  private boolean endsBeforeStart(LocalDate date, ZoneId zone) {
    return date.atTime(23, 59, 59).atZone(zone).isBefore(startDateTime);
  }

  private boolean exRuleRecursOn(LocalDate date, ZoneId zone) {
    for (RecurrenceRule rule : exRules) {
      if (rule.recursOn(date, zone)) {
        return true;
      }
    }
    return false;
  }

  private boolean isExcluded(ZonedDateTime dt) {
    ZonedDateTime local = dt.withZoneSameInstant(startDateTime.getZone());
    if (SortedLists.contains(exDates, local.toLocalDate())
        || SortedLists.contains(exDateTimes, local, SortedLists.BY_INSTANT)) {
      return true;
    }
    for (RecurrenceRule rule : exRules) {
      if (rule.recursAt(local)) {
        return true;
      }
    }
    return false;
  }

  /** An RDATE date occurs at the wall-clock time of the start. */
  private ZonedDateTime rDateAtStartTime(LocalDate date) {
    return ZonedDateTime.of(date, startDateTime.toLocalTime(), startDateTime.getZone());
  }

  private static boolean isWithin(ZonedDateTime dt, ZonedDateTime start, ZonedDateTime end) {
    return !dt.isBefore(start) && !dt.isAfter(end);
  }

  // ---------------------------------------------------------------------------
  // End and duration

  /**
   * Returns the last occurrence of the whole recurrence: the latest of the start, the last RDATE
   * and every RRULE's end.
   *
   * @return the end, or empty if no start is set or any RRULE is unbounded
   */
  public Optional<ZonedDateTime> endDateTime() {
    if (startDateTime == null) {
      return Optional.empty();
    }
    List<ZonedDateTime> ends = new ArrayList<>();
    ends.add(startDateTime);
    if (!rDates.isEmpty()) {
      ends.add(rDateAtStartTime(rDates.get(rDates.size() - 1)));
    }
    if (!rDateTimes.isEmpty()) {
      ends.add(rDateTimes.get(rDateTimes.size() - 1));
    }
    for (RecurrenceRule rule : rRules) {
      Optional<ZonedDateTime> end = rule.endDt();
      // One unbounded rule makes the whole recurrence unbounded
      if (end.isEmpty()) {
        return Optional.empty();
      }
      ends.add(end.get());
    }
    return Optional.of(Collections.max(ends, SortedLists.BY_INSTANT));
  }

  /**
   * Returns the date of {@link #endDateTime()}.
   *
   * @return the end date, or empty if the recurrence is unbounded
   */
  public Optional<LocalDate> endDate() {
    return endDateTime().map(ZonedDateTime::toLocalDate);
  }

  /**
   * Ends the default rule on a date, at the start's time of day (23:59:59 for all-day
   * recurrences).
   *
   * @param date the end date
   */
  public void setEndDate(LocalDate date) {
    if (startDateTime == null) {
      return;
    }
    LocalTime time = allDay ? LocalTime.of(23, 59, 59) : startDateTime.toLocalTime();
    setEndDateTime(ZonedDateTime.of(date, time, startDateTime.getZone()));
  }

  /**
   * Ends the default rule at a date/time, creating the rule if needed. An occurrence count on the
   * rule is dropped. Passing null makes an end-bounded rule unbounded and leaves a count-bounded
   * rule untouched.
   *
   * @param dateTime the end, or null
   */
  public void setEndDateTime(ZonedDateTime dateTime) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return;
    }
    if (dateTime == null) {
      if (rrule.duration() == 0) {
        rrule.setDuration(-1);
        updated();
      }
      return;
    }
    if (rrule.duration() > 0) {
      rrule.setDuration(-1);
    }
    if (!dateTime.equals(rrule.endDt().orElse(null))) {
      rrule.setEndDt(dateTime);
      updated();
    }
  }

  /**
   * Returns the duration of the default rule.
   *
   * @return -1 for unbounded, 0 for end-bounded, the occurrence count otherwise; 0 without rules
   */
  public int duration() {
    return defaultRRule().map(RecurrenceRule::duration).orElse(0);
  }

  /**
   * Sets the duration of the default rule, creating the rule if needed.
   *
   * @param duration -1 for unbounded or a positive occurrence count
   */
  public void setDuration(int duration) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return;
    }
    if (duration != rrule.duration()) {
      rrule.setDuration(duration);
      updated();
    }
  }

  /**
   * Counts the occurrences of the default rule up to and including a date/time.
   *
   * @param dt the date/time
   * @return the count, 0 without rules
   */
  public int durationTo(ZonedDateTime dt) {
    return defaultRRule().map(rule -> rule.durationTo(dt)).orElse(0);
  }

  /**
   * Counts the occurrences of the default rule up to the end of a date.
   *
   * @param date the date, in the zone of the start
   * @return the count, 0 without rules
   */
  public int durationTo(LocalDate date) {
    if (startDateTime == null) {
      return 0;
    }
    return durationTo(date.atTime(23, 59, 59).atZone(startDateTime.getZone()));
  }

  // ---------------------------------------------------------------------------
  // Rules

  /**
   * Returns the first RRULE, which the legacy single-rule API operates on.
   *
   * @return the default rule, or empty if there are no RRULEs
   */
  public Optional<RecurrenceRule> defaultRRule() {
    return rRules.isEmpty() ? Optional.empty() : Optional.of(rRules.get(0));
  }

  private RecurrenceRule defaultRRule(boolean create) {
    if (!rRules.isEmpty()) {
      return rRules.get(0);
    }
    if (!create || readOnly) {
      return null;
    }
    RecurrenceRule rrule = new RecurrenceRule();
    if (startDateTime != null) {
      rrule.setStartDt(startDateTime);
    }
    addRRule(rrule);
    return rrule;
  }

  public List<RecurrenceRule> rRules() {
    return List.copyOf(rRules);
  }

  /**
   * Adds an inclusion rule. The rule takes the recurrence's all-day flag and is observed for
   * changes.
   *
   * @param rrule the rule
   */
  public void addRRule(RecurrenceRule rrule) {
    if (readOnly || rrule == null) {
      return;
    }
    rrule.setAllDay(allDay);
    rRules.add(rrule);
    rrule.addObserver(ruleObserver);
    updated();
  }

  public void removeRRule(RecurrenceRule rrule) {
    if (readOnly) {
      return;
    }
    if (rRules.remove(rrule)) {
      rrule.removeObserver(ruleObserver);
      updated();
    }
  }

  public List<RecurrenceRule> exRules() {
    return List.copyOf(exRules);
  }

  /**
   * Adds an exclusion rule. The rule takes the recurrence's all-day flag and is observed for
   * changes.
   *
   * @param exrule the rule
   */
  public void addExRule(RecurrenceRule exrule) {
    if (readOnly || exrule == null) {
      return;
    }
    exrule.setAllDay(allDay);
    exRules.add(exrule);
    exrule.addObserver(ruleObserver);
    updated();
  }

  public void removeExRule(RecurrenceRule exrule) {
    if (readOnly) {
      return;
    }
    if (exRules.remove(exrule)) {
      exrule.removeObserver(ruleObserver);
      updated();
    }
  }

  // ---------------------------------------------------------------------------
  // Explicit dates

  public List<ZonedDateTime> rDateTimes() {
    return Collections.unmodifiableList(rDateTimes);
  }

  /**
   * Replaces the RDATE date/times. Any periods attached to the old ones are dropped.
   *
   * @param rdates the new date/times
   */
  public void setRDateTimes(Collection<ZonedDateTime> rdates) {
    if (readOnly) {
      return;
    }
    rDateTimes = new ArrayList<>(rdates);
    SortedLists.sortAndRemoveDuplicates(rDateTimes, SortedLists.BY_INSTANT);
    rDateTimePeriods.clear();
    updated();
  }

  public void addRDateTime(ZonedDateTime rdate) {
    if (readOnly) {
      return;
    }
    SortedLists.setInsert(rDateTimes, Objects.requireNonNull(rdate), SortedLists.BY_INSTANT);
    updated();
  }

  /**
   * Adds an RDATE date/time together with the period it lasts.
   *
   * @param period the period; its start is the RDATE
   */
  public void addRDateTimePeriod(Period period) {
    if (readOnly) {
      return;
    }
    SortedLists.setInsert(rDateTimes, period.start(), SortedLists.BY_INSTANT);
    rDateTimePeriods.put(period.start().toInstant(), period);
    updated();
  }

  /**
   * Returns the period attached to an RDATE date/time.
   *
   * @param rdate the RDATE
   * @return the period, or empty if the RDATE has none
   */
  public Optional<Period> rDateTimePeriod(ZonedDateTime rdate) {
    return Optional.ofNullable(rDateTimePeriods.get(rdate.toInstant()));
  }

  public List<LocalDate> rDates() {
    return Collections.unmodifiableList(rDates);
  }

  public void setRDates(Collection<LocalDate> rdates) {
    if (readOnly) {
      return;
    }
    rDates = new ArrayList<>(rdates);
    SortedLists.sortAndRemoveDuplicates(rDates);
    updated();
  }

  public void addRDate(LocalDate rdate) {
    if (readOnly) {
      return;
    }
    SortedLists.setInsert(rDates, Objects.requireNonNull(rdate));
    updated();
  }

  public List<ZonedDateTime> exDateTimes() {
    return Collections.unmodifiableList(exDateTimes);
  }

  public void setExDateTimes(Collection<ZonedDateTime> exdates) {
    if (readOnly) {
      return;
    }
    exDateTimes = new ArrayList<>(exdates);
    SortedLists.sortAndRemoveDuplicates(exDateTimes, SortedLists.BY_INSTANT);
    updated();
  }

  public void addExDateTime(ZonedDateTime exdate) {
    if (readOnly) {
      return;
    }
    SortedLists.setInsert(exDateTimes, Objects.requireNonNull(exdate), SortedLists.BY_INSTANT);
    updated();
  }

  public List<LocalDate> exDates() {
    return Collections.unmodifiableList(exDates);
  }

  /**
   * Replaces the EXDATE dates. Observers are only notified if the set of dates changes.
   *
   * @param exdates the new dates
   */
  public void setExDates(Collection<LocalDate> exdates) {
    if (readOnly) {
      return;
    }
    List<LocalDate> sorted = new ArrayList<>(exdates);
    SortedLists.sortAndRemoveDuplicates(sorted);
    if (!sorted.equals(exDates)) {
      exDates = sorted;
      updated();
    }
  }

  public void addExDate(LocalDate exdate) {
    if (readOnly) {
      return;
    }
    SortedLists.setInsert(exDates, Objects.requireNonNull(exdate));
    updated();
  }

  // ---------------------------------------------------------------------------
  // Legacy single-rule API

  /**
   * Returns the legacy classification of the default rule. The value is cached until the next
   * change.
   *
   * @return the recurrence type
   */
  public RecurrenceType recurrenceType() {
    if (cachedType == null) {
      cachedType = recurrenceType(defaultRRule().orElse(null));
    }
    return cachedType;
  }

  /**
   * Classifies a rule by the BY lists it uses.
   *
   * @param rrule the rule, may be null
   * @return the recurrence type; {@link RecurrenceType#OTHER} for combinations the simple types
   *     cannot describe
   */
  public static RecurrenceType recurrenceType(RecurrenceRule rrule) {
    if (rrule == null) {
      return RecurrenceType.NONE;
    }
    PeriodType type = rrule.recurrenceType();

    // BYSETPOS, BYWEEKNO and the time-of-day lists have no simple type
    if (!rrule.bySetPos().isEmpty()
        || !rrule.bySeconds().isEmpty()
        || !rrule.byWeekNumbers().isEmpty()
        || !rrule.byMinutes().isEmpty()
        || !rrule.byHours().isEmpty()) {
      return RecurrenceType.OTHER;
    }
    if (type != PeriodType.YEARLY
        && (!rrule.byYearDays().isEmpty() || !rrule.byMonths().isEmpty())) {
      return RecurrenceType.OTHER;
    }
    if (!rrule.byDays().isEmpty()
        && type != PeriodType.YEARLY
        && type != PeriodType.MONTHLY
        && type != PeriodType.WEEKLY) {
      return RecurrenceType.OTHER;
    }

    return switch (type) {
      case NONE -> RecurrenceType.NONE;
      case MINUTELY -> RecurrenceType.MINUTELY;
      case HOURLY -> RecurrenceType.HOURLY;
      case DAILY -> RecurrenceType.DAILY;
      case WEEKLY -> RecurrenceType.WEEKLY;
      case MONTHLY -> {
        if (rrule.byDays().isEmpty()) {
          yield RecurrenceType.MONTHLY_DAY;
        }
        yield rrule.byMonthDays().isEmpty() ? RecurrenceType.MONTHLY_POS : RecurrenceType.OTHER;
      }
      case YEARLY -> yearlyType(rrule);
      case SECONDLY -> RecurrenceType.OTHER;
    };
  }

  private static RecurrenceType yearlyType(RecurrenceRule rrule) {
    if (!rrule.byDays().isEmpty()) {
      return rrule.byMonthDays().isEmpty() && rrule.byYearDays().isEmpty()
          ? RecurrenceType.YEARLY_POS
          : RecurrenceType.OTHER;
    }
    if (!rrule.byYearDays().isEmpty()) {
      return rrule.byMonths().isEmpty() && rrule.byMonthDays().isEmpty()
          ? RecurrenceType.YEARLY_DAY
          : RecurrenceType.OTHER;
    }
    return RecurrenceType.YEARLY_MONTH;
  }

  /**
   * Replaces all RRULEs by a fresh default rule of the given period, unless the default rule
   * already has that period and frequency.
   *
   * @return the new rule, or null if nothing changed
   */
  private RecurrenceRule setNewRecurrenceType(PeriodType type, int freq) {
    if (readOnly || freq <= 0) {
      return null;
    }
    Optional<RecurrenceRule> current = defaultRRule();
    if (current.isPresent()
        && current.get().recurrenceType() == type
        && current.get().frequency() == freq) {
      return null;
    }
    for (RecurrenceRule rule : rRules) {
      rule.removeObserver(ruleObserver);
    }
    rRules.clear();
    updated();
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return null;
    }
    rrule.setRecurrenceType(type);
    rrule.setFrequency(freq);
    rrule.setDuration(-1);
    return rrule;
  }

  public void setMinutely(int freq) {
    if (setNewRecurrenceType(PeriodType.MINUTELY, freq) != null) {
      updated();
    }
  }

  public void setHourly(int freq) {
    if (setNewRecurrenceType(PeriodType.HOURLY, freq) != null) {
      updated();
    }
  }

  public void setDaily(int freq) {
    if (setNewRecurrenceType(PeriodType.DAILY, freq) != null) {
      updated();
    }
  }

  /**
   * Makes the recurrence weekly on the weekday of the start.
   *
   * @param freq the interval in weeks
   * @param weekStart the first day of the week (1=Monday)
   */
  public void setWeekly(int freq, int weekStart) {
    RecurrenceRule rrule = setNewRecurrenceType(PeriodType.WEEKLY, freq);
    if (rrule == null) {
      return;
    }
    rrule.setWeekStart(weekStart);
    updated();
  }

  /**
   * Makes the recurrence weekly on the given weekdays.
   *
   * @param freq the interval in weeks
   * @param days the weekdays
   * @param weekStart the first day of the week (1=Monday)
   */
  public void setWeekly(int freq, Set<Weekday> days, int weekStart) {
    setWeekly(freq, weekStart);
    addMonthlyPos(0, days);
  }

  public void addWeeklyDays(Set<Weekday> days) {
    addMonthlyPos(0, days);
  }

  public void setMonthly(int freq) {
    if (setNewRecurrenceType(PeriodType.MONTHLY, freq) != null) {
      updated();
    }
  }

  /**
   * Adds weekday positions to the default rule, which must exist.
   *
   * @param pos the position (0 for every such weekday; up to +-53 for yearly rules)
   * @param days the weekdays
   */
  public void addMonthlyPos(int pos, Set<Weekday> days) {
    if (readOnly || pos > 53 || pos < -53) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    List<WDayPos> positions = new ArrayList<>(rrule.byDays());
    boolean changed = false;
    for (Weekday day : Weekday.values()) {
      if (days.contains(day)) {
        WDayPos p = WDayPos.of(pos, day);
        if (!positions.contains(p)) {
          positions.add(p);
          changed = true;
        }
      }
    }
    if (changed) {
      rrule.setByDays(positions);
      updated();
    }
  }

  public void addMonthlyPos(int pos, Weekday day) {
    if (readOnly || pos > 53 || pos < -53) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    List<WDayPos> positions = new ArrayList<>(rrule.byDays());
    WDayPos p = WDayPos.of(pos, day);
    if (!positions.contains(p)) {
      positions.add(p);
      setMonthlyPos(positions);
    }
  }

  /**
   * Replaces the weekday positions of the default rule, creating the rule if needed. The order of
   * the positions does not count as a change.
   *
   * @param positions the positions
   */
  public void setMonthlyPos(List<WDayPos> positions) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return;
    }
    if (!new HashSet<>(positions).equals(new HashSet<>(rrule.byDays()))) {
      rrule.setByDays(positions);
      updated();
    }
  }

  /**
   * Adds a day of the month to the default rule, creating the rule if needed.
   *
   * @param day the day, negative to count from the end of the month
   */
  public void addMonthlyDate(int day) {
    if (readOnly || day > 31 || day < -31) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return;
    }
    List<Integer> monthDays = new ArrayList<>(rrule.byMonthDays());
    if (!monthDays.contains(day)) {
      monthDays.add(day);
      setMonthlyDate(monthDays);
    }
  }

  public void setMonthlyDate(List<Integer> monthDays) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule == null) {
      return;
    }
    if (!sameValues(monthDays, rrule.byMonthDays())) {
      rrule.setByMonthDays(monthDays);
      updated();
    }
  }

  public void setYearly(int freq) {
    if (setNewRecurrenceType(PeriodType.YEARLY, freq) != null) {
      updated();
    }
  }

  /**
   * Adds a day of the year to the default rule, which must exist.
   *
   * @param day the day of the year, negative to count from the end
   */
  public void addYearlyDay(int day) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    List<Integer> days = new ArrayList<>(rrule.byYearDays());
    if (!days.contains(day)) {
      days.add(day);
      setYearlyDay(days);
    }
  }

  public void setYearlyDay(List<Integer> days) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    if (!sameValues(days, rrule.byYearDays())) {
      rrule.setByYearDays(days);
      updated();
    }
  }

  public void addYearlyDate(int day) {
    addMonthlyDate(day);
  }

  public void setYearlyDate(List<Integer> dates) {
    setMonthlyDate(dates);
  }

  public void addYearlyPos(int pos, Set<Weekday> days) {
    addMonthlyPos(pos, days);
  }

  public void setYearlyPos(List<WDayPos> positions) {
    setMonthlyPos(positions);
  }

  /**
   * Adds a month to the default rule, which must exist.
   *
   * @param month the month, 1..12
   */
  public void addYearlyMonth(int month) {
    if (readOnly || month < 1 || month > 12) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    List<Integer> months = new ArrayList<>(rrule.byMonths());
    if (!months.contains(month)) {
      months.add(month);
      setYearlyMonth(months);
    }
  }

  public void setYearlyMonth(List<Integer> months) {
    if (readOnly) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(false);
    if (rrule == null) {
      return;
    }
    if (!sameValues(months, rrule.byMonths())) {
      rrule.setByMonths(months);
      updated();
    }
  }

  private static boolean sameValues(List<Integer> a, List<Integer> b) {
    List<Integer> sortedA = new ArrayList<>(a);
    List<Integer> sortedB = new ArrayList<>(b);
    SortedLists.sortAndRemoveDuplicates(sortedA);
    SortedLists.sortAndRemoveDuplicates(sortedB);
    return sortedA.equals(sortedB);
  }

  /**
   * Sets the interval of the default rule, creating the rule if needed.
   *
   * @param freq the interval, at least 1
   */
  public void setFrequency(int freq) {
    if (readOnly || freq <= 0) {
      return;
    }
    RecurrenceRule rrule = defaultRRule(true);
    if (rrule != null) {
      rrule.setFrequency(freq);
    }
    updated();
  }

  public int frequency() {
    return defaultRRule().map(RecurrenceRule::frequency).orElse(0);
  }

  public int weekStart() {
    return defaultRRule().map(RecurrenceRule::weekStart).orElse(1);
  }

  /**
   * Returns the weekdays the default rule selects without a position.
   *
   * @return the weekdays, empty without rules
   */
  public Set<Weekday> days() {
    Set<Weekday> days = EnumSet.noneOf(Weekday.class);
    defaultRRule()
        .ifPresent(
            rule -> {
              for (WDayPos p : rule.byDays()) {
                if (p.pos() == 0) {
                  days.add(p.weekday());
                }
              }
            });
    return days;
  }

  public List<Integer> monthDays() {
    return defaultRRule().map(RecurrenceRule::byMonthDays).orElse(List.of());
  }

  public List<WDayPos> monthPositions() {
    return defaultRRule().map(RecurrenceRule::byDays).orElse(List.of());
  }

  public List<Integer> yearDays() {
    return defaultRRule().map(RecurrenceRule::byYearDays).orElse(List.of());
  }

  public List<Integer> yearDates() {
    return monthDays();
  }

  public List<Integer> yearMonths() {
    return defaultRRule().map(RecurrenceRule::byMonths).orElse(List.of());
  }

  public List<WDayPos> yearPositions() {
    return monthPositions();
  }

  // ---------------------------------------------------------------------------

  /** Logs the recurrence and its rules at FINE. */
  public void dump() {
    if (!LOGGER.isLoggable(Level.FINE)) {
      return;
    }
    LOGGER.fine(Display.render(this));
    for (RecurrenceRule rule : rRules) {
      rule.dump();
    }
    for (RecurrenceRule rule : exRules) {
      rule.dump();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Recurrence)) {
      return false;
    }
    Recurrence r = (Recurrence) o;
    return Objects.equals(startDateTime, r.startDateTime)
        && allDay == r.allDay
        && readOnly == r.readOnly
        && exDates.equals(r.exDates)
        && sameInstants(exDateTimes, r.exDateTimes)
        && rDates.equals(r.rDates)
        && sameInstants(rDateTimes, r.rDateTimes)
        && rDateTimePeriods.equals(r.rDateTimePeriods)
        && rRules.equals(r.rRules)
        && exRules.equals(r.exRules);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        startDateTime, allDay, rDates, instants(rDateTimes), exDates, instants(exDateTimes), rRules);
  }

  /** The date/time lists are kept by instant, so their zones do not affect equality. */
  private static boolean sameInstants(List<ZonedDateTime> a, List<ZonedDateTime> b) {
    return instants(a).equals(instants(b));
  }

  private static List<Instant> instants(List<ZonedDateTime> dateTimes) {
    return dateTimes.stream().map(ZonedDateTime::toInstant).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
