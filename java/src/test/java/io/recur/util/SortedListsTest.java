package io.recur.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SortedListsTest {

  @Test
  void testSortAndRemoveDuplicates() {
    List<Integer> list = new ArrayList<>(List.of(5, 1, 3, 1, 5, 2));
    SortedLists.sortAndRemoveDuplicates(list);
    assertEquals(List.of(1, 2, 3, 5), list);
  }

  @Test
  void testSameInstantInDifferentZonesIsDuplicate() {
    ZonedDateTime utc = ZonedDateTime.of(2006, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);
    ZonedDateTime berlin = utc.withZoneSameInstant(ZoneId.of("Europe/Berlin"));
    List<ZonedDateTime> list = new ArrayList<>(List.of(berlin, utc.plusHours(1), utc));
    SortedLists.sortAndRemoveDuplicates(list, SortedLists.BY_INSTANT);
    assertEquals(2, list.size());
    assertTrue(SortedLists.contains(list, utc, SortedLists.BY_INSTANT));
  }

  @Test
  void testSetInsert() {
    List<Integer> list = new ArrayList<>(List.of(1, 4, 9));
    assertTrue(SortedLists.setInsert(list, 5));
    assertFalse(SortedLists.setInsert(list, 4));
    assertTrue(SortedLists.setInsert(list, 0));
    assertEquals(List.of(0, 1, 4, 5, 9), list);
  }

  @Test
  void testSetDifference() {
    List<Integer> list = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6));
    SortedLists.setDifference(list, List.of(0, 2, 5, 7));
    assertEquals(List.of(1, 3, 4, 6), list);

    SortedLists.setDifference(list, List.of());
    assertEquals(List.of(1, 3, 4, 6), list);
  }

  @Test
  void testBounds() {
    List<Integer> list = List.of(1, 3, 3, 5);
    assertEquals(1, SortedLists.lowerBound(list, 3, Integer::compare));
    assertEquals(3, SortedLists.upperBound(list, 3, Integer::compare));
    assertEquals(0, SortedLists.strictLowerBound(list, 3, Integer::compare));
    assertEquals(-1, SortedLists.strictLowerBound(list, 1, Integer::compare));
    assertEquals(4, SortedLists.lowerBound(list, 6, Integer::compare));
    assertEquals(0, SortedLists.upperBound(list, 0, Integer::compare));
  }

  @Test
  void testContains() {
    List<Integer> list = List.of(2, 4, 8);
    assertTrue(SortedLists.contains(list, 4));
    assertFalse(SortedLists.contains(list, 5));
  }
}
