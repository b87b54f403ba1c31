package io.recur.util;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Helpers for lists kept sorted and free of duplicates.
 *
 * <p>Every method takes the comparator defining both the order and equality of elements. Date/time
 * lists use {@link #BY_INSTANT}, so two values for the same instant in different zones count as
 * duplicates.
 */
public final class SortedLists {
  /** Orders date/times on the time line, ignoring their zone. */
  public static final Comparator<ZonedDateTime> BY_INSTANT =
      Comparator.comparing(ZonedDateTime::toInstant);

  private SortedLists() {}

  /**
   * Sorts a list in place and drops elements that compare equal to their predecessor.
   *
   * @param list the list to normalize
   * @param order the ordering
   */
  public static <T> void sortAndRemoveDuplicates(List<T> list, Comparator<? super T> order) {
    list.sort(order);
    int kept = 0;
    for (int i = 0; i < list.size(); i++) {
      if (kept == 0 || order.compare(list.get(kept - 1), list.get(i)) != 0) {
        list.set(kept++, list.get(i));
      }
    }
    list.subList(kept, list.size()).clear();
  }

  /** Sorts naturally ordered elements and drops duplicates. */
  public static <T extends Comparable<? super T>> void sortAndRemoveDuplicates(List<T> list) {
    sortAndRemoveDuplicates(list, Comparator.naturalOrder());
  }

  /**
   * Inserts a value at its sorted position unless an equal value is already present.
   *
   * @return true if the list changed
   */
  public static <T> boolean setInsert(List<T> list, T value, Comparator<? super T> order) {
    int index = Collections.binarySearch(list, value, order);
    if (index >= 0) {
      return false;
    }
    list.add(-index - 1, value);
    return true;
  }

  /** Inserts a naturally ordered value at its sorted position unless already present. */
  public static <T extends Comparable<? super T>> boolean setInsert(List<T> list, T value) {
    return setInsert(list, value, Comparator.naturalOrder());
  }

  /**
   * Removes from {@code list} every element equal to one in {@code remove}. Both lists must be
   * sorted by {@code order}.
   */
  public static <T> void setDifference(List<T> list, List<T> remove, Comparator<? super T> order) {
    if (remove.isEmpty()) {
      return;
    }
    int kept = 0;
    int r = 0;
    for (int i = 0; i < list.size(); i++) {
      T element = list.get(i);
      while (r < remove.size() && order.compare(remove.get(r), element) < 0) {
        r++;
      }
      if (r < remove.size() && order.compare(remove.get(r), element) == 0) {
        continue;
      }
      list.set(kept++, element);
    }
    list.subList(kept, list.size()).clear();
  }

  /** Removes from {@code list} every naturally ordered element present in {@code remove}. */
  public static <T extends Comparable<? super T>> void setDifference(List<T> list, List<T> remove) {
    setDifference(list, remove, Comparator.naturalOrder());
  }

  /** Returns true if a sorted list holds an element equal to {@code value}. */
  public static <T> boolean contains(List<T> list, T value, Comparator<? super T> order) {
    return Collections.binarySearch(list, value, order) >= 0;
  }

  /** Returns true if a sorted list holds a naturally ordered value. */
  public static <T extends Comparable<? super T>> boolean contains(List<T> list, T value) {
    return contains(list, value, Comparator.naturalOrder());
  }

  /** Index of the first element not before {@code value}, or {@code list.size()}. */
  public static <T> int lowerBound(List<T> list, T value, Comparator<? super T> order) {
    int lo = 0;
    int hi = list.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (order.compare(list.get(mid), value) < 0) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  /** Index of the first element after {@code value}, or {@code list.size()}. */
  public static <T> int upperBound(List<T> list, T value, Comparator<? super T> order) {
    int lo = 0;
    int hi = list.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (order.compare(list.get(mid), value) <= 0) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  /** Index of the last element before {@code value}, or -1 if there is none. */
  public static <T> int strictLowerBound(List<T> list, T value, Comparator<? super T> order) {
    return lowerBound(list, value, order) - 1;
  }
}
