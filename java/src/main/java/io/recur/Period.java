package io.recur;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A time span attached to an RDATE date/time: a start plus either an explicit end or a duration.
 */
public final class Period {
  private final ZonedDateTime start;
  private final ZonedDateTime end;
  private final Duration duration;

  private Period(ZonedDateTime start, ZonedDateTime end, Duration duration) {
    this.start = start;
    this.end = end;
    this.duration = duration;
  }

  /**
   * Creates a period with an explicit end.
   *
   * @param start the start
   * @param end the end, not before the start
   * @return the period
   * @throws IllegalArgumentException if the end is before the start
   */
  public static Period between(ZonedDateTime start, ZonedDateTime end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("period ends before it starts: " + start + " / " + end);
    }
    return new Period(start, end, null);
  }

  /**
   * Creates a period from a start and a duration.
   *
   * @param start the start
   * @param duration the length, not negative
   * @return the period
   * @throws IllegalArgumentException if the duration is negative
   */
  public static Period of(ZonedDateTime start, Duration duration) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(duration, "duration");
    if (duration.isNegative()) {
      throw new IllegalArgumentException("negative period duration: " + duration);
    }
    return new Period(start, null, duration);
  }

  public ZonedDateTime start() {
    return start;
  }

  /**
   * Returns the end of the period, computed from the duration if it was given that way.
   *
   * @return the end
   */
  public ZonedDateTime end() {
    return end != null ? end : start.plus(duration);
  }

  /**
   * Returns the length of the period.
   *
   * @return the duration
   */
  public Duration duration() {
    return duration != null ? duration : Duration.between(start, end);
  }

  /**
   * Returns true if the period was created from a duration rather than an end.
   *
   * @return true for {@link #of(ZonedDateTime, Duration)} periods
   */
  public boolean hasDuration() {
    return duration != null;
  }

  /**
   * Returns this period moved to another zone, keeping the wall-clock times it had in {@code
   * oldZone}.
   *
   * @param oldZone the zone whose wall-clock times are kept
   * @param newZone the new zone
   * @return the shifted period
   */
  public Period shiftTimes(ZoneId oldZone, ZoneId newZone) {
    ZonedDateTime newStart = start.withZoneSameInstant(oldZone).withZoneSameLocal(newZone);
    if (duration != null) {
      return new Period(newStart, null, duration);
    }
    ZonedDateTime newEnd = end.withZoneSameInstant(oldZone).withZoneSameLocal(newZone);
    return new Period(newStart, newEnd.isBefore(newStart) ? newStart : newEnd, null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Period)) {
      return false;
    }
    Period p = (Period) o;
    return start.isEqual(p.start) && end().isEqual(p.end()) && hasDuration() == p.hasDuration();
  }

  @Override
  public int hashCode() {
    return Objects.hash(start.toInstant(), end().toInstant(), hasDuration());
  }

  @Override
  public String toString() {
    return start + "/" + (duration != null ? duration : end);
  }
}
