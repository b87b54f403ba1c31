package io.recur;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@code occurrences()} and {@code between()} streams.
 *
 * These tests verify Stream behavior on top of the next-occurrence search:
 * - Laziness (streams don't evaluate eagerly)
 * - Early termination
 * - Integration with Stream methods (map, filter, collect)
 * - Exclusions and bounded recurrences
 */
class OccurrenceStreamTest {

    private static ZonedDateTime parseZoned(String s) {
        // Parse '2026-02-06T12:00:00+00:00[UTC]' format
        int bracketIdx = s.indexOf('[');
        String isoStr = s.substring(0, bracketIdx);
        String tzName = s.substring(bracketIdx + 1, s.length() - 1);
        ZoneId zone = ZoneId.of(tzName);
        return ZonedDateTime.parse(isoStr, DateTimeFormatter.ISO_OFFSET_DATE_TIME).withZoneSameInstant(zone);
    }

    /** Every day at 09:00 UTC from 2026-02-01. */
    private static Recurrence daily() {
        Recurrence r = new Recurrence();
        r.setStartDateTime(parseZoned("2026-02-01T09:00:00+00:00[UTC]"), false);
        r.setDaily(1);
        return r;
    }

    // =========================================================================
    // Laziness Tests
    // =========================================================================

    @Test
    void occurrencesIsLazy() {
        // An unbounded recurrence should not hang or OOM when creating the stream
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");

        Stream<ZonedDateTime> stream = r.occurrences(from);

        List<ZonedDateTime> results = stream.limit(1).collect(Collectors.toList());
        assertEquals(1, results.size());
        assertEquals(parseZoned("2026-02-01T09:00:00+00:00[UTC]"), results.get(0));
    }

    @Test
    void betweenIsLazy() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");
        ZonedDateTime to = parseZoned("2026-12-31T23:59:00+00:00[UTC]");

        // Taking just 3 should not evaluate all ~330 days
        List<ZonedDateTime> results = r.between(from, to).limit(3).collect(Collectors.toList());
        assertEquals(3, results.size());
    }

    // =========================================================================
    // Early Termination Tests
    // =========================================================================

    @Test
    void occurrencesEarlyTerminationWithTakeWhile() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");
        ZonedDateTime cutoff = parseZoned("2026-02-05T00:00:00+00:00[UTC]");

        List<ZonedDateTime> results = r.occurrences(from)
                .takeWhile(dt -> dt.isBefore(cutoff))
                .collect(Collectors.toList());

        // Feb 1, 2, 3, 4 at 09:00 (4 occurrences before Feb 5 00:00)
        assertEquals(4, results.size());
    }

    @Test
    void occurrencesFindFirstSaturday() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");

        Optional<ZonedDateTime> saturday = r.occurrences(from)
                .filter(dt -> dt.getDayOfWeek().getValue() == 6)
                .findFirst();

        // Feb 7, 2026 is a Saturday
        assertTrue(saturday.isPresent());
        assertEquals(7, saturday.get().getDayOfMonth());
    }

    // =========================================================================
    // Stream Methods Tests
    // =========================================================================

    @Test
    void worksWithMap() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");

        List<Integer> days = r.occurrences(from)
                .limit(5)
                .map(ZonedDateTime::getDayOfMonth)
                .collect(Collectors.toList());

        assertEquals(List.of(1, 2, 3, 4, 5), days);
    }

    @Test
    void betweenWorksWithCount() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");
        ZonedDateTime to = parseZoned("2026-02-10T23:59:00+00:00[UTC]");

        // Feb 1-10 inclusive = 10 days
        assertEquals(10, r.between(from, to).count());
    }

    @Test
    void betweenExcludesFromIncludesTo() {
        Recurrence r = daily();
        ZonedDateTime from = parseZoned("2026-02-02T09:00:00+00:00[UTC]");
        ZonedDateTime to = parseZoned("2026-02-04T09:00:00+00:00[UTC]");

        List<Integer> days = r.between(from, to)
                .map(ZonedDateTime::getDayOfMonth)
                .collect(Collectors.toList());
        assertEquals(List.of(3, 4), days);
    }

    // =========================================================================
    // Bounded and excluded recurrences
    // =========================================================================

    @Test
    void countBoundedStreamEnds() {
        Recurrence r = daily();
        r.setDuration(5);
        ZonedDateTime from = parseZoned("2026-01-01T00:00:00+00:00[UTC]");

        List<ZonedDateTime> results = r.occurrences(from).collect(Collectors.toList());
        assertEquals(5, results.size());
        assertEquals(r.endDateTime().orElseThrow(), results.get(4));
    }

    @Test
    void streamSkipsExclusions() {
        Recurrence r = daily();
        r.addExDate(LocalDate.of(2026, 2, 2));
        r.addExDateTime(parseZoned("2026-02-04T09:00:00+00:00[UTC]"));
        ZonedDateTime from = parseZoned("2026-02-01T00:00:00+00:00[UTC]");

        List<Integer> days = r.occurrences(from)
                .limit(4)
                .map(ZonedDateTime::getDayOfMonth)
                .collect(Collectors.toList());
        assertEquals(List.of(1, 3, 5, 6), days);
    }

    @Test
    void streamMatchesTimesInInterval() {
        Recurrence r = daily();
        r.addRDateTime(parseZoned("2026-02-03T18:30:00+01:00[Europe/Berlin]"));
        ZonedDateTime from = parseZoned("2026-01-31T00:00:00+00:00[UTC]");
        ZonedDateTime to = parseZoned("2026-02-08T00:00:00+00:00[UTC]");

        List<ZonedDateTime> streamed = r.between(from, to).collect(Collectors.toList());
        List<ZonedDateTime> listed = r.timesInInterval(from, to);
        assertEquals(listed.size(), streamed.size());
        for (int i = 0; i < listed.size(); i++) {
            assertTrue(listed.get(i).isEqual(streamed.get(i)));
        }
    }
}
