package io.recur.rule;

/**
 * A BYDAY entry: a weekday with an optional position inside the month or year.
 *
 * <p>Position 0 selects every such weekday of the period, a positive position selects the n-th
 * occurrence from the start of the period and a negative one the n-th occurrence from its end.
 *
 * @param day the weekday number (1=Monday, 7=Sunday)
 * @param pos the position, or 0 for every occurrence
 */
public record WDayPos(int day, int pos) {
  public WDayPos {
    if (day < 1 || day > 7) {
      throw new IllegalArgumentException("weekday out of range: " + day);
    }
    if (pos < -53 || pos > 53) {
      throw new IllegalArgumentException("weekday position out of range: " + pos);
    }
  }

  /**
   * Selects every occurrence of a weekday.
   *
   * @param day the weekday
   * @return the position entry
   */
  public static WDayPos every(Weekday day) {
    return new WDayPos(day.number(), 0);
  }

  /**
   * Selects the n-th occurrence of a weekday.
   *
   * @param pos the signed position
   * @param day the weekday
   * @return the position entry
   */
  public static WDayPos of(int pos, Weekday day) {
    return new WDayPos(day.number(), pos);
  }

  /**
   * Returns the weekday as an enum.
   *
   * @return the weekday
   */
  public Weekday weekday() {
    return Weekday.values()[day - 1];
  }

  @Override
  public String toString() {
    return (pos != 0 ? Integer.toString(pos) : "") + weekday().code();
  }
}
