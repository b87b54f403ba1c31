package io.recur.rule;

import io.recur.display.Display;
import io.recur.util.SortedLists;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.zone.ZoneOffsetTransition;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One RFC 5545 recurrence rule: frequency, interval, BY lists, week start and either an occurrence
 * count or an end date/time.
 *
 * <p>The BY lists are expanded into a set of {@link Constraint}s whenever the rule changes. Queries
 * then walk the rule's frequency buckets (one month for a monthly rule, one week for a weekly rule,
 * ...), merge each bucket with the constraints and enumerate the result.
 *
 * <h2>Duration</h2>
 *
 * <p>{@link #duration()} is -1 for an unbounded rule, 0 for a rule ending at {@link #endDt()} and a
 * positive occurrence count otherwise. Count-bounded rules cache their full occurrence list the
 * first time it is needed.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <p>LOOP_LIMIT (10000): Maximum number of buckets visited by a single query or cache build.
 * Impossible constraint combinations such as the 31st of February produce no occurrences at all;
 * the limit makes such queries report "no occurrence" instead of running forever. A count-bounded
 * rule whose cache hits the limit reports an empty {@link #endDt()}.
 *
 * <h2>Sub-daily fast path</h2>
 *
 * <p>A secondly, minutely or hourly rule without BY lists recurs at a fixed number of seconds from
 * its start; such rules answer every query arithmetically without enumerating buckets. The loop
 * limit does not apply to them, so {@link #timesInInterval} returns every occurrence in range.
 *
 * <h2>Thread safety</h2>
 *
 * <p>Not thread safe. Queries fill the occurrence cache of count-bounded rules, so a rule shared
 * between threads needs external synchronization even for read-only use.
 */
public final class RecurrenceRule {
  private static final Logger LOGGER = Logger.getLogger(RecurrenceRule.class.getName());

  /** Maximum number of frequency buckets visited by a single query. */
  public static final int LOOP_LIMIT = 10000;

  /** Receives a callback whenever a rule changes. */
  @FunctionalInterface
  public interface RuleObserver {
    /**
     * Called after any change to the rule.
     *
     * @param rule the rule that changed
     */
    void ruleChanged(RecurrenceRule rule);
  }

  private String rrule = "";
  private PeriodType period = PeriodType.NONE;
  private ZonedDateTime dateStart;
  private int frequency = 1;
  private int duration = -1;
  private ZonedDateTime dateEnd;

  private List<Integer> bySeconds = List.of();
  private List<Integer> byMinutes = List.of();
  private List<Integer> byHours = List.of();
  private List<WDayPos> byDays = List.of();
  private List<Integer> byMonthDays = List.of();
  private List<Integer> byYearDays = List.of();
  private List<Integer> byWeekNumbers = List.of();
  private List<Integer> byMonths = List.of();
  private List<Integer> bySetPos = List.of();
  private int weekStart = 1;

  private boolean readOnly;
  private boolean allDay;

  private final List<RuleObserver> observers = new ArrayList<>();

  // Derived from the fields above by buildConstraints()
  private List<Constraint> constraints = List.of();
  private boolean noByRules;
  private long timedRepetition;

  // Occurrence cache, only used while duration > 0
  private boolean cached;
  private List<ZonedDateTime> cachedDates = new ArrayList<>();
  private ZonedDateTime cachedDateEnd;
  private ZonedDateTime cachedLastDate;

  /** Creates an empty rule with no period. */
  public RecurrenceRule() {
    setDirty();
  }

  /**
   * Creates a copy of another rule. Observers are not copied.
   *
   * @param other the rule to copy
   */
  public RecurrenceRule(RecurrenceRule other) {
    rrule = other.rrule;
    period = other.period;
    dateStart = other.dateStart;
    frequency = other.frequency;
    duration = other.duration;
    dateEnd = other.dateEnd;
    bySeconds = other.bySeconds;
    byMinutes = other.byMinutes;
    byHours = other.byHours;
    byDays = other.byDays;
    byMonthDays = other.byMonthDays;
    byYearDays = other.byYearDays;
    byWeekNumbers = other.byWeekNumbers;
    byMonths = other.byMonths;
    bySetPos = other.bySetPos;
    weekStart = other.weekStart;
    readOnly = other.readOnly;
    allDay = other.allDay;
    setDirty();
  }

  // ---------------------------------------------------------------------------
  // Observers

  /**
   * Registers an observer; registering the same observer twice has no effect.
   *
   * @param observer the observer
   */
  public void addObserver(RuleObserver observer) {
    if (!observers.contains(observer)) {
      observers.add(observer);
    }
  }

  /**
   * Unregisters an observer.
   *
   * @param observer the observer
   */
  public void removeObserver(RuleObserver observer) {
    observers.remove(observer);
  }

  // ---------------------------------------------------------------------------
  // Mutation

  /**
   * Rebuilds the constraint set, drops the occurrence cache and notifies observers. Every setter
   * calls this.
   */
  public void setDirty() {
    buildConstraints();
    cached = false;
    cachedDates = new ArrayList<>();
    cachedDateEnd = null;
    cachedLastDate = null;
    for (RuleObserver observer : List.copyOf(observers)) {
      observer.ruleChanged(this);
    }
  }

  /**
   * Resets the period and every BY list. The start, end and count are kept.
   */
  public void clear() {
    if (readOnly) {
      return;
    }
    period = PeriodType.NONE;
    bySeconds = List.of();
    byMinutes = List.of();
    byHours = List.of();
    byDays = List.of();
    byMonthDays = List.of();
    byYearDays = List.of();
    byWeekNumbers = List.of();
    byMonths = List.of();
    bySetPos = List.of();
    weekStart = 1;
    setDirty();
  }

  public void setRecurrenceType(PeriodType period) {
    if (readOnly) {
      return;
    }
    this.period = Objects.requireNonNull(period);
    setDirty();
  }

  /**
   * Sets the start of the rule. The start is only an occurrence if it matches the rule.
   *
   * @param start the start date/time; its zone is the zone the rule is evaluated in
   */
  public void setStartDt(ZonedDateTime start) {
    if (readOnly) {
      return;
    }
    this.dateStart = Objects.requireNonNull(start);
    setDirty();
  }

  public void setAllDay(boolean allDay) {
    if (readOnly) {
      return;
    }
    this.allDay = allDay;
    setDirty();
  }

  /**
   * Sets the interval between buckets. Values below 1 are ignored.
   *
   * @param freq the interval
   */
  public void setFrequency(int freq) {
    if (readOnly || freq <= 0) {
      return;
    }
    this.frequency = freq;
    setDirty();
  }

  /**
   * Sets how the rule ends: -1 for never, 0 for at {@link #endDt()}, or a number of occurrences.
   * Setting 0 is refused unless an end date/time is already set; any other value clears the end
   * date/time.
   *
   * @param duration the duration
   */
  public void setDuration(int duration) {
    if (readOnly) {
      return;
    }
    if (duration == 0 && dateEnd == null) {
      return;
    }
    this.duration = duration;
    if (duration != 0) {
      dateEnd = null;
    }
    setDirty();
  }

  /**
   * Sets the end date/time and switches the rule to end-bounded. Refused while the rule carries an
   * occurrence count; clearing the end of an end-bounded rule is refused as well.
   *
   * @param dateTime the last possible occurrence, or null to clear
   */
  public void setEndDt(ZonedDateTime dateTime) {
    if (readOnly || duration > 0) {
      return;
    }
    if (dateTime == null) {
      if (duration == 0) {
        return;
      }
      dateEnd = null;
    } else {
      dateEnd = dateTime;
      duration = 0;
    }
    setDirty();
  }

  public void setBySeconds(List<Integer> bySeconds) {
    if (readOnly) {
      return;
    }
    this.bySeconds = List.copyOf(bySeconds);
    setDirty();
  }

  public void setByMinutes(List<Integer> byMinutes) {
    if (readOnly) {
      return;
    }
    this.byMinutes = List.copyOf(byMinutes);
    setDirty();
  }

  public void setByHours(List<Integer> byHours) {
    if (readOnly) {
      return;
    }
    this.byHours = List.copyOf(byHours);
    setDirty();
  }

  public void setByDays(List<WDayPos> byDays) {
    if (readOnly) {
      return;
    }
    this.byDays = List.copyOf(byDays);
    setDirty();
  }

  public void setByMonthDays(List<Integer> byMonthDays) {
    if (readOnly) {
      return;
    }
    this.byMonthDays = List.copyOf(byMonthDays);
    setDirty();
  }

  public void setByYearDays(List<Integer> byYearDays) {
    if (readOnly) {
      return;
    }
    this.byYearDays = List.copyOf(byYearDays);
    setDirty();
  }

  public void setByWeekNumbers(List<Integer> byWeekNumbers) {
    if (readOnly) {
      return;
    }
    this.byWeekNumbers = List.copyOf(byWeekNumbers);
    setDirty();
  }

  public void setByMonths(List<Integer> byMonths) {
    if (readOnly) {
      return;
    }
    this.byMonths = List.copyOf(byMonths);
    setDirty();
  }

  public void setBySetPos(List<Integer> bySetPos) {
    if (readOnly) {
      return;
    }
    this.bySetPos = List.copyOf(bySetPos);
    setDirty();
  }

  /**
   * Sets the first day of the week. Values outside 1..7 are ignored.
   *
   * @param weekStart the weekday number (1=Monday, 7=Sunday)
   */
  public void setWeekStart(int weekStart) {
    if (readOnly || weekStart < 1 || weekStart > 7) {
      return;
    }
    this.weekStart = weekStart;
    setDirty();
  }

  /**
   * Stores the textual form of the rule. The text is kept verbatim and never interpreted.
   *
   * @param rrule the RRULE text
   */
  public void setRRule(String rrule) {
    this.rrule = Objects.requireNonNull(rrule);
  }

  public void setReadOnly(boolean readOnly) {
    this.readOnly = readOnly;
  }

  /**
   * Moves the rule to another zone, keeping the wall-clock start (and end) it had in {@code
   * oldZone}.
   *
   * @param oldZone the zone whose wall-clock time is kept
   * @param newZone the new zone
   */
  public void shiftTimes(ZoneId oldZone, ZoneId newZone) {
    if (readOnly || dateStart == null) {
      return;
    }
    dateStart = dateStart.withZoneSameInstant(oldZone).withZoneSameLocal(newZone);
    if (duration == 0 && dateEnd != null) {
      dateEnd = dateEnd.withZoneSameInstant(oldZone).withZoneSameLocal(newZone);
    }
    setDirty();
  }

  // ---------------------------------------------------------------------------
  // Accessors

  public PeriodType recurrenceType() {
    return period;
  }

  /**
   * Returns the start of the rule.
   *
   * @return the start, or null if none has been set
   */
  public ZonedDateTime startDt() {
    return dateStart;
  }

  public int frequency() {
    return frequency;
  }

  public int duration() {
    return duration;
  }

  public String rrule() {
    return rrule;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public boolean allDay() {
    return allDay;
  }

  /**
   * Returns true if the rule has a period.
   *
   * @return false for a rule of type {@link PeriodType#NONE}
   */
  public boolean recurs() {
    return period != PeriodType.NONE;
  }

  public List<Integer> bySeconds() {
    return bySeconds;
  }

  public List<Integer> byMinutes() {
    return byMinutes;
  }

  public List<Integer> byHours() {
    return byHours;
  }

  public List<WDayPos> byDays() {
    return byDays;
  }

  public List<Integer> byMonthDays() {
    return byMonthDays;
  }

  public List<Integer> byYearDays() {
    return byYearDays;
  }

  public List<Integer> byWeekNumbers() {
    return byWeekNumbers;
  }

  public List<Integer> byMonths() {
    return byMonths;
  }

  public List<Integer> bySetPos() {
    return bySetPos;
  }

  public int weekStart() {
    return weekStart;
  }

  /**
   * Returns the last occurrence of the rule.
   *
   * <p>For an end-bounded rule this is the end date/time. For a count-bounded rule it is the last
   * of its occurrences, or empty if fewer than {@link #duration()} occurrences were found within
   * {@link #LOOP_LIMIT} buckets. Unbounded rules return empty.
   *
   * @return the end, or empty if the rule is unbounded or its end is unknown
   */
  public Optional<ZonedDateTime> endDt() {
    if (period == PeriodType.NONE || duration < 0) {
      return Optional.empty();
    }
    if (duration == 0) {
      return Optional.ofNullable(dateEnd);
    }
    if (dateStart == null) {
      return Optional.empty();
    }
    ensureCache();
    return Optional.ofNullable(cachedDateEnd);
  }

  // ---------------------------------------------------------------------------
  // Queries

  /**
   * Checks a date/time against the rule's constraints only, ignoring frequency, start and end.
   *
   * @param dt the date/time
   * @return true if some constraint matches
   */
  public boolean dateMatchesRules(ZonedDateTime dt) {
    if (dateStart == null) {
      return false;
    }
    ZonedDateTime local = dt.withZoneSameInstant(dateStart.getZone());
    for (Constraint c : constraints) {
      if (c.matches(local, period)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if the rule has an occurrence on a date.
   *
   * @param date the date
   * @param zone the zone the date is taken in; ignored for all-day rules, whose dates are taken in
   *     the zone of the start
   * @return true if some occurrence falls on the date
   */
  public boolean recursOn(LocalDate date, ZoneId zone) {
    if (!isActive()) {
      return false;
    }
    if (allDay) {
      return recursOnDate(date);
    }

    ZoneId ruleZone = dateStart.getZone();
    ZonedDateTime dayStart = date.atStartOfDay(zone);
    ZonedDateTime dayEnd = dayStart.plusDays(1).withZoneSameInstant(ruleZone);
    ZonedDateTime start = dayStart.withZoneSameInstant(ruleZone);
    if (!dayEnd.isAfter(dateStart)) {
      return false;
    }
    if (start.isBefore(dateStart)) {
      start = dateStart;
    }
    ZonedDateTime endRecur = duration >= 0 ? endDt().orElse(null) : null;
    if (endRecur != null && start.isAfter(endRecur)) {
      return false;
    }

    if (timedRepetition > 0) {
      return isWithinDay(firstTimedAtOrAfter(start), dayEnd, endRecur);
    }

    // The day may span two dates in the rule's zone
    LocalDate startDay = start.toLocalDate();
    LocalDate endDay = dayEnd.minusSeconds(1).toLocalDate();
    boolean match = false;
    for (LocalDate d = startDay; !d.isAfter(endDay) && !match; d = d.plusDays(1)) {
      match = matchesAnyConstraint(d);
    }
    if (!match) {
      return false;
    }

    // The whole bucket has to be enumerated, since BYSETPOS may select only some of the dates
    // that match the constraints.
    Constraint interval = nextValidDateInterval(start, period);
    int loop = 0;
    do {
      List<ZonedDateTime> dts = datesForInterval(interval, period);
      int i = SortedLists.lowerBound(dts, start, SortedLists.BY_INSTANT);
      if (i < dts.size()) {
        return isWithinDay(dts.get(i), dayEnd, endRecur);
      }
      interval = interval.increase(period, frequency);
    } while (++loop < LOOP_LIMIT && bucketStart(interval).isBefore(dayEnd));
    return false;
  }

  private static boolean isWithinDay(
      ZonedDateTime occurrence, ZonedDateTime dayEnd, ZonedDateTime endRecur) {
    return occurrence.isBefore(dayEnd) && (endRecur == null || !occurrence.isAfter(endRecur));
  }

  private boolean recursOnDate(LocalDate date) {
    if (date.isBefore(dateStart.toLocalDate())) {
      return false;
    }
    if (duration >= 0) {
      Optional<ZonedDateTime> end = endDt();
      if (end.isPresent() && date.isAfter(end.get().toLocalDate())) {
        return false;
      }
    }
    if (!matchesAnyConstraint(date)) {
      return false;
    }

    ZonedDateTime dayStart = date.atStartOfDay(dateStart.getZone());
    ZonedDateTime dayEnd = dayStart.plusDays(1);
    Constraint interval = nextValidDateInterval(dayStart, period);
    int loop = 0;
    do {
      for (ZonedDateTime dt : datesForInterval(interval, period)) {
        LocalDate d = dt.toLocalDate();
        if (!d.isBefore(date)) {
          return d.equals(date);
        }
      }
      interval = interval.increase(period, frequency);
    } while (++loop < LOOP_LIMIT && bucketStart(interval).isBefore(dayEnd));
    return false;
  }

  /**
   * Returns true if the rule has an occurrence at exactly the given instant. For all-day rules
   * only the date counts.
   *
   * @param dt the date/time
   * @return true if {@code dt} is an occurrence
   */
  public boolean recursAt(ZonedDateTime dt) {
    if (!isActive()) {
      return false;
    }
    ZonedDateTime local = dt.withZoneSameInstant(dateStart.getZone());
    if (allDay) {
      return recursOnDate(local.toLocalDate());
    }
    if (local.isBefore(dateStart)) {
      return false;
    }
    if (duration >= 0) {
      Optional<ZonedDateTime> end = endDt();
      if (end.isPresent() && local.isAfter(end.get())) {
        return false;
      }
    }
    if (timedRepetition > 0) {
      long secs = ChronoUnit.SECONDS.between(dateStart, local);
      return secs % timedRepetition == 0 && dateStart.plusSeconds(secs).isEqual(local);
    }
    // Occurrences moved forward out of a DST gap no longer match their constraint's time
    if (!dateMatchesRules(local) && !followsGap(local)) {
      return false;
    }
    Constraint interval = nextValidDateInterval(local, period);
    return SortedLists.contains(
        datesForInterval(interval, period), local, SortedLists.BY_INSTANT);
  }

  /** True if {@code local} lies where a wall-clock time skipped by a DST gap is moved to. */
  private static boolean followsGap(ZonedDateTime local) {
    Instant instant = local.toInstant();
    ZoneOffsetTransition transition =
        local.getZone().getRules().previousTransition(instant.plusNanos(1));
    return transition != null
        && transition.isGap()
        && instant.isBefore(transition.getInstant().plus(transition.getDuration()));
  }

  /**
   * Returns the times of day at which the rule occurs on a date.
   *
   * <p>An all-day rule reports the start's time of day when it occurs on the date.
   *
   * @param date the date
   * @param zone the zone the date and the returned times are taken in
   * @return the times, ascending
   */
  public List<LocalTime> recurTimesOn(LocalDate date, ZoneId zone) {
    if (allDay) {
      return recursOn(date, zone) ? List.of(dateStart.toLocalTime()) : List.of();
    }
    ZonedDateTime start = date.atStartOfDay(zone);
    ZonedDateTime end = start.plusDays(1).minusSeconds(1);
    List<LocalTime> times = new ArrayList<>();
    for (ZonedDateTime dt : timesInInterval(start, end)) {
      times.add(dt.withZoneSameInstant(zone).toLocalTime());
    }
    return times;
  }

  /**
   * Returns the number of occurrences up to and including a date/time.
   *
   * @param dt the date/time
   * @return the occurrence count
   */
  public int durationTo(ZonedDateTime dt) {
    if (!isActive()) {
      return 0;
    }
    ZonedDateTime toDate = dt.withZoneSameInstant(dateStart.getZone());
    if (toDate.isBefore(dateStart)) {
      return 0;
    }
    if (duration > 0) {
      Optional<ZonedDateTime> end = endDt();
      if (end.isPresent() && !toDate.isBefore(end.get())) {
        return duration;
      }
    }
    if (timedRepetition > 0) {
      ZonedDateTime limit = toDate;
      if (duration == 0 && dateEnd != null && dateEnd.isBefore(limit)) {
        limit = dateEnd;
      }
      if (limit.isBefore(dateStart)) {
        return 0;
      }
      long count = ChronoUnit.SECONDS.between(dateStart, limit) / timedRepetition + 1;
      return (int) Math.min(count, Integer.MAX_VALUE);
    }
    return timesInInterval(dateStart, toDate).size();
  }

  /**
   * Returns the number of occurrences up to and including the end of a date.
   *
   * @param date the date, taken in the zone of the start
   * @return the occurrence count
   */
  public int durationTo(LocalDate date) {
    if (!isActive()) {
      return 0;
    }
    return durationTo(date.atTime(23, 59, 59).atZone(dateStart.getZone()));
  }

  /**
   * Returns the last occurrence strictly before a date/time.
   *
   * @param before the reference date/time (exclusive)
   * @return the previous occurrence, or empty if there is none
   */
  public Optional<ZonedDateTime> getPreviousDate(ZonedDateTime before) {
    if (!isActive()) {
      return Optional.empty();
    }
    ZonedDateTime toDate = before.withZoneSameInstant(dateStart.getZone());
    if (!toDate.isAfter(dateStart)) {
      return Optional.empty();
    }

    ZonedDateTime prev = toDate;
    if (duration >= 0) {
      Optional<ZonedDateTime> end = endDt();
      if (end.isPresent() && toDate.isAfter(end.get())) {
        prev = end.get().plusSeconds(1);
      }
    }

    if (timedRepetition > 0) {
      long secs = ChronoUnit.SECONDS.between(dateStart, prev);
      if (secs <= 0) {
        return Optional.empty();
      }
      return Optional.of(dateStart.plusSeconds(((secs - 1) / timedRepetition) * timedRepetition));
    }

    if (duration > 0) {
      ensureCache();
      int i = SortedLists.strictLowerBound(cachedDates, toDate, SortedLists.BY_INSTANT);
      return i >= 0 ? Optional.of(cachedDates.get(i)) : Optional.empty();
    }

    Constraint interval = previousValidDateInterval(prev, period);
    List<ZonedDateTime> dts = datesForInterval(interval, period);
    int i = SortedLists.strictLowerBound(dts, prev, SortedLists.BY_INSTANT);
    if (i >= 0) {
      return notBeforeStart(dts.get(i));
    }

    // Step back one bucket at a time; the first non-empty bucket holds the answer
    for (int loop = 0;
        loop < LOOP_LIMIT && bucketStart(interval).isAfter(dateStart);
        loop++) {
      interval = interval.increase(period, -frequency);
      dts = datesForInterval(interval, period);
      if (!dts.isEmpty()) {
        return notBeforeStart(dts.get(dts.size() - 1));
      }
    }
    return Optional.empty();
  }

  private Optional<ZonedDateTime> notBeforeStart(ZonedDateTime dt) {
    return dt.isBefore(dateStart) ? Optional.empty() : Optional.of(dt);
  }

  /**
   * Returns the first occurrence strictly after a date/time.
   *
   * @param after the reference date/time (exclusive)
   * @return the next occurrence, or empty if there is none or none was found within {@link
   *     #LOOP_LIMIT} buckets
   */
  public Optional<ZonedDateTime> getNextDate(ZonedDateTime after) {
    if (!isActive()) {
      return Optional.empty();
    }
    ZonedDateTime fromDate = after.withZoneSameInstant(dateStart.getZone());
    Optional<ZonedDateTime> end = duration >= 0 ? endDt() : Optional.empty();
    if (end.isPresent() && !fromDate.isBefore(end.get())) {
      return Optional.empty();
    }
    if (fromDate.isBefore(dateStart)) {
      fromDate = dateStart.minusSeconds(1);
    }

    if (timedRepetition > 0) {
      long secs = ChronoUnit.SECONDS.between(dateStart, fromDate);
      long k = secs < 0 ? 0 : secs / timedRepetition + 1;
      return withinEnd(dateStart.plusSeconds(k * timedRepetition), end);
    }

    if (duration > 0) {
      ensureCache();
      int i = SortedLists.upperBound(cachedDates, fromDate, SortedLists.BY_INSTANT);
      return i < cachedDates.size() ? Optional.of(cachedDates.get(i)) : Optional.empty();
    }

    Constraint interval = nextValidDateInterval(fromDate, period);
    for (int loop = 0; loop < LOOP_LIMIT; loop++) {
      List<ZonedDateTime> dts = datesForInterval(interval, period);
      int i = SortedLists.upperBound(dts, fromDate, SortedLists.BY_INSTANT);
      if (i < dts.size()) {
        return withinEnd(dts.get(i), end);
      }
      interval = interval.increase(period, frequency);
      if (end.isPresent() && bucketStart(interval).isAfter(end.get())) {
        return Optional.empty();
      }
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("No occurrence after " + after + " within " + LOOP_LIMIT + " intervals");
    }
    return Optional.empty();
  }

  private static Optional<ZonedDateTime> withinEnd(
      ZonedDateTime dt, Optional<ZonedDateTime> end) {
    return end.isPresent() && dt.isAfter(end.get()) ? Optional.empty() : Optional.of(dt);
  }

  /**
   * Returns every occurrence between two date/times, both inclusive.
   *
   * <p>At most {@link #LOOP_LIMIT} buckets are visited. For a count-bounded rule whose cache is
   * incomplete ({@link #endDt()} empty while {@link #duration()} is positive) the result may be
   * short; callers can resume from the last returned occurrence.
   *
   * @param start the start of the interval
   * @param end the end of the interval
   * @return the occurrences in ascending order
   */
  public List<ZonedDateTime> timesInInterval(ZonedDateTime start, ZonedDateTime end) {
    List<ZonedDateTime> result = new ArrayList<>();
    if (!isActive()) {
      return result;
    }
    ZoneId ruleZone = dateStart.getZone();
    ZonedDateTime from = start.withZoneSameInstant(ruleZone);
    ZonedDateTime to = end.withZoneSameInstant(ruleZone);
    if (to.isBefore(dateStart)) {
      return result;
    }
    ZonedDateTime limit = to;
    if (duration >= 0) {
      Optional<ZonedDateTime> endRecur = endDt();
      if (endRecur.isPresent()) {
        if (from.isAfter(endRecur.get())) {
          return result;
        }
        if (!to.isBefore(endRecur.get())) {
          limit = endRecur.get();
        }
      }
    }
    ZonedDateTime st = from.isBefore(dateStart) ? dateStart : from;

    if (timedRepetition > 0) {
      ZonedDateTime dt = firstTimedAtOrAfter(st);
      while (!dt.isAfter(limit)) {
        result.add(dt);
        dt = dt.plusSeconds(timedRepetition);
      }
      return result;
    }

    if (duration > 0) {
      ensureCache();
      if (cachedDateEnd != null && from.isAfter(cachedDateEnd)) {
        return result;
      }
      int first = SortedLists.lowerBound(cachedDates, from, SortedLists.BY_INSTANT);
      int last = SortedLists.upperBound(cachedDates, limit, SortedLists.BY_INSTANT);
      if (first < last) {
        result.addAll(cachedDates.subList(first, last));
      }
      if (cachedDateEnd != null || !result.isEmpty() || last < cachedDates.size()) {
        return result;
      }
      // Past the end of an incomplete cache: carry on searching from where it stopped
      ZonedDateTime resume = cachedLastDate.plusSeconds(1);
      if (resume.isAfter(st)) {
        st = resume;
      }
    }

    Constraint interval = nextValidDateInterval(st, period);
    for (int loop = 0; loop < LOOP_LIMIT; loop++) {
      List<ZonedDateTime> dts = datesForInterval(interval, period);
      int first = SortedLists.lowerBound(dts, st, SortedLists.BY_INSTANT);
      int last = SortedLists.upperBound(dts, limit, SortedLists.BY_INSTANT);
      if (first < last) {
        result.addAll(dts.subList(first, last));
      }
      if (last < dts.size()) {
        break;
      }
      interval = interval.increase(period, frequency);
      if (bucketStart(interval).isAfter(limit)) {
        break;
      }
    }
    return result;
  }

  /** Logs the rule and its constraints at FINE. */
  public void dump() {
    if (!LOGGER.isLoggable(Level.FINE)) {
      return;
    }
    StringBuilder sb = new StringBuilder(Display.render(this));
    sb.append("\n   Constraints:");
    for (Constraint c : constraints) {
      sb.append("\n     ~> ").append(c);
    }
    LOGGER.fine(sb.toString());
  }

  // ---------------------------------------------------------------------------
  // Internals

  private boolean isActive() {
    return period != PeriodType.NONE && dateStart != null;
  }

  private boolean matchesAnyConstraint(LocalDate date) {
    for (Constraint c : constraints) {
      if (c.matches(date, period)) {
        return true;
      }
    }
    return false;
  }

  /** First occurrence of a timed repetition at or after {@code dt}. */
  private ZonedDateTime firstTimedAtOrAfter(ZonedDateTime dt) {
    long secs = ChronoUnit.SECONDS.between(dateStart, dt);
    if (dateStart.plusSeconds(secs).isBefore(dt)) {
      secs++;
    }
    if (secs <= 0) {
      return dateStart;
    }
    long k = (secs + timedRepetition - 1) / timedRepetition;
    return dateStart.plusSeconds(k * timedRepetition);
  }

  private List<Constraint> expand(
      List<Constraint> current,
      List<Integer> values,
      BiFunction<Constraint, Integer, Constraint> setter) {
    if (values.isEmpty()) {
      return current;
    }
    noByRules = false;
    List<Constraint> expanded = new ArrayList<>(current.size() * values.size());
    for (Constraint c : current) {
      for (Integer value : values) {
        expanded.add(setter.apply(c, value));
      }
    }
    return expanded;
  }

  private static List<Constraint> fix(
      List<Constraint> current, UnaryOperator<Constraint> setter) {
    List<Constraint> fixed = new ArrayList<>(current.size());
    for (Constraint c : current) {
      fixed.add(setter.apply(c));
    }
    return fixed;
  }

  /**
   * Expands the BY lists into constraints: one per combination of their values, with the fields
   * the BY lists leave open taken from the start as RFC 5545 prescribes for the period.
   */
  private void buildConstraints() {
    timedRepetition = 0;
    noByRules = bySetPos.isEmpty();
    if (dateStart == null) {
      constraints = List.of();
      return;
    }

    List<Constraint> cons = List.of(Constraint.unbound(dateStart.getZone(), weekStart));
    cons = expand(cons, bySeconds, Constraint::withSecond);
    cons = expand(cons, byMinutes, Constraint::withMinute);
    cons = expand(cons, byHours, Constraint::withHour);
    cons = expand(cons, byMonthDays, Constraint::withDay);
    cons = expand(cons, byMonths, Constraint::withMonth);
    cons = expand(cons, byYearDays, Constraint::withYearDay);
    cons = expand(cons, byWeekNumbers, Constraint::withWeekNumber);
    if (!byDays.isEmpty()) {
      noByRules = false;
      List<Constraint> expanded = new ArrayList<>(cons.size() * byDays.size());
      for (Constraint c : cons) {
        for (WDayPos wd : byDays) {
          expanded.add(c.withWeekday(wd.day(), wd.pos()));
        }
      }
      cons = expanded;
    }

    // Fields left open by the BY lists are taken from the start
    if (period == PeriodType.WEEKLY && byDays.isEmpty()) {
      int startDay = Weekday.fromDayOfWeek(dateStart.getDayOfWeek()).number();
      cons = fix(cons, c -> c.withWeekday(startDay, 0));
    }
    if (period == PeriodType.YEARLY
        && byDays.isEmpty()
        && byWeekNumbers.isEmpty()
        && byYearDays.isEmpty()
        && byMonths.isEmpty()) {
      cons = fix(cons, c -> c.withMonth(dateStart.getMonthValue()));
    }
    if (period.compareTo(PeriodType.MONTHLY) >= 0
        && byDays.isEmpty()
        && byWeekNumbers.isEmpty()
        && byYearDays.isEmpty()
        && byMonthDays.isEmpty()) {
      cons = fix(cons, c -> c.withDay(dateStart.getDayOfMonth()));
    }
    if (period.compareTo(PeriodType.DAILY) >= 0 && byHours.isEmpty()) {
      cons = fix(cons, c -> c.withHour(dateStart.getHour()));
    }
    if (period.compareTo(PeriodType.HOURLY) >= 0 && byMinutes.isEmpty()) {
      cons = fix(cons, c -> c.withMinute(dateStart.getMinute()));
    }
    if (period.compareTo(PeriodType.MINUTELY) >= 0 && bySeconds.isEmpty()) {
      cons = fix(cons, c -> c.withSecond(dateStart.getSecond()));
    }

    if (noByRules && period.isSubDaily()) {
      long unit =
          period == PeriodType.HOURLY ? 3600L : period == PeriodType.MINUTELY ? 60L : 1L;
      timedRepetition = frequency * unit;
    }

    List<Constraint> consistent = new ArrayList<>(cons.size());
    for (Constraint c : cons) {
      if (c.isConsistent(period)) {
        consistent.add(c);
      }
    }
    constraints = consistent;
  }

  /**
   * Returns the bucket containing {@code dt}, or the next bucket whose distance from the start's
   * bucket is a multiple of the frequency. Dates before the start give the start's bucket.
   */
  private Constraint nextValidDateInterval(ZonedDateTime dt, PeriodType type) {
    return validDateInterval(dt, type, true);
  }

  /**
   * Returns the bucket containing {@code dt}, or the previous bucket whose distance from the
   * start's bucket is a multiple of the frequency.
   */
  private Constraint previousValidDateInterval(ZonedDateTime dt, PeriodType type) {
    return validDateInterval(dt, type, false);
  }

  private long roundToFrequency(long periods, boolean up) {
    if (up) {
      periods = Math.max(0, periods);
      if (periods > 0) {
        periods += frequency - 1 - ((periods - 1) % frequency);
      }
      return periods;
    }
    return (periods / frequency) * frequency;
  }

  private Constraint validDateInterval(ZonedDateTime dt, PeriodType type, boolean next) {
    ZonedDateTime start = dateStart;
    ZonedDateTime toDate = dt.withZoneSameInstant(start.getZone());
    ZonedDateTime valid = start;
    switch (type) {
      case SECONDLY, MINUTELY, HOURLY -> {
        long modifier = type == PeriodType.HOURLY ? 3600 : type == PeriodType.MINUTELY ? 60 : 1;
        long periods = ChronoUnit.SECONDS.between(start, toDate) / modifier;
        valid = start.plusSeconds(modifier * roundToFrequency(periods, next));
      }
      case DAILY, WEEKLY -> {
        int modifier = 1;
        LocalDate toDay = toDate.toLocalDate();
        if (type == PeriodType.WEEKLY) {
          // Align both dates to the start of their weeks
          toDay = toDay.minusDays(DateHelper.daysSinceWeekStart(toDay, weekStart));
          start =
              start.minusDays(DateHelper.daysSinceWeekStart(start.toLocalDate(), weekStart));
          modifier = 7;
        }
        long periods = ChronoUnit.DAYS.between(start.toLocalDate(), toDay) / modifier;
        valid = start.plusDays(modifier * roundToFrequency(periods, next));
      }
      case MONTHLY -> {
        long periods =
            12L * (toDate.getYear() - start.getYear())
                + (toDate.getMonthValue() - start.getMonthValue());
        // Day 1 avoids clamping on months without a 29th, 30th or 31st
        valid = start.withDayOfMonth(1).plusMonths(roundToFrequency(periods, next));
      }
      case YEARLY -> {
        int startYear = bucketYear(start);
        long periods = bucketYear(toDate) - startYear;
        valid =
            start.withDayOfYear(1).withYear(startYear).plusYears(roundToFrequency(periods, next));
      }
      case NONE -> {}
    }
    return Constraint.fromDateTime(valid, type, weekStart);
  }

  /**
   * Yearly rules with week numbers group their dates by week-year, so a yearly bucket can hold
   * dates from the last days of December before it or the first days of January after it.
   */
  private boolean weekYearBuckets() {
    return period == PeriodType.YEARLY && !byWeekNumbers.isEmpty();
  }

  private int bucketYear(ZonedDateTime dt) {
    return weekYearBuckets()
        ? DateHelper.weekNumber(dt.toLocalDate(), weekStart).year()
        : dt.getYear();
  }

  /** Earliest date/time a bucket can contain; week 1 starts no earlier than December 29th. */
  private ZonedDateTime bucketStart(Constraint interval) {
    ZonedDateTime start = interval.intervalDateTime(period);
    return weekYearBuckets() ? start.minusDays(3) : start;
  }

  /**
   * Returns the occurrences in one bucket: every constraint merged with the bucket and
   * enumerated, then narrowed by BYSETPOS.
   */
  private List<ZonedDateTime> datesForInterval(Constraint interval, PeriodType type) {
    List<ZonedDateTime> list = new ArrayList<>();
    for (Constraint c : constraints) {
      Optional<Constraint> merged = interval.merge(c);
      if (merged.isPresent() && merged.get().isComplete()) {
        list.addAll(merged.get().dateTimes(type));
      }
    }
    SortedLists.sortAndRemoveDuplicates(list, SortedLists.BY_INSTANT);

    if (!bySetPos.isEmpty()) {
      List<ZonedDateTime> selected = new ArrayList<>();
      for (int pos : bySetPos) {
        int index = pos > 0 ? pos - 1 : pos + list.size();
        if (pos != 0 && index >= 0 && index < list.size()) {
          selected.add(list.get(index));
        }
      }
      SortedLists.sortAndRemoveDuplicates(selected, SortedLists.BY_INSTANT);
      list = selected;
    }
    return list;
  }

  private void ensureCache() {
    if (!cached) {
      buildCache();
    }
  }

  /** Builds the list of all occurrences of a count-bounded rule. */
  private void buildCache() {
    Constraint interval = nextValidDateInterval(dateStart, period);
    List<ZonedDateTime> dts = new ArrayList<>(datesForInterval(interval, period));
    // The start is only an occurrence if it matches
    dts.subList(0, SortedLists.lowerBound(dts, dateStart, SortedLists.BY_INSTANT)).clear();

    for (int loop = 0; loop < LOOP_LIMIT && dts.size() < duration; loop++) {
      interval = interval.increase(period, frequency);
      dts.addAll(datesForInterval(interval, period));
    }
    if (dts.size() > duration) {
      dts.subList(duration, dts.size()).clear();
    }
    cached = true;
    cachedDates = dts;

    if (dts.size() == duration) {
      cachedDateEnd = dts.get(dts.size() - 1);
      cachedLastDate = null;
    } else {
      cachedDateEnd = null;
      cachedLastDate = interval.intervalDateTime(period);
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.fine(
            "Found "
                + dts.size()
                + " of "
                + duration
                + " occurrences within "
                + LOOP_LIMIT
                + " intervals");
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecurrenceRule)) {
      return false;
    }
    RecurrenceRule r = (RecurrenceRule) o;
    return period == r.period
        && Objects.equals(dateStart, r.dateStart)
        && duration == r.duration
        && Objects.equals(dateEnd, r.dateEnd)
        && frequency == r.frequency
        && readOnly == r.readOnly
        && allDay == r.allDay
        && bySeconds.equals(r.bySeconds)
        && byMinutes.equals(r.byMinutes)
        && byHours.equals(r.byHours)
        && byDays.equals(r.byDays)
        && byMonthDays.equals(r.byMonthDays)
        && byYearDays.equals(r.byYearDays)
        && byWeekNumbers.equals(r.byWeekNumbers)
        && byMonths.equals(r.byMonths)
        && bySetPos.equals(r.bySetPos)
        && weekStart == r.weekStart;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        period,
        dateStart,
        duration,
        dateEnd,
        frequency,
        allDay,
        byDays,
        byMonthDays,
        byMonths,
        weekStart);
  }

  @Override
  public String toString() {
    return "RecurrenceRule{" + period + ", freq=" + frequency + ", duration=" + duration + "}";
  }
}
