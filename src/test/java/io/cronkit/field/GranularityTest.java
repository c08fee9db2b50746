package io.cronkit.field;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for Granularity moves, including DST transitions. */
public class GranularityTest {
  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute, ZoneId zone) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, zone);
  }

  @Test
  void testMonthRollsYear() {
    ZonedDateTime date = at(2011, 12, 15, 10, 30, UTC);
    assertEquals(at(2012, 1, 1, 0, 0, UTC), Granularity.MONTH.increment(date, List.of()));
    assertEquals(at(2011, 11, 30, 23, 59, UTC), Granularity.MONTH.decrement(date, List.of()));
    assertEquals(
        at(2010, 12, 31, 23, 59, UTC),
        Granularity.MONTH.decrement(at(2011, 1, 1, 0, 0, UTC), List.of()));
  }

  @Test
  void testDayHandlesLeapYear() {
    ZonedDateTime date = at(2012, 2, 28, 22, 0, UTC);
    assertEquals(at(2012, 2, 29, 0, 0, UTC), Granularity.DAY.increment(date, List.of()));
    assertEquals(
        at(2012, 2, 29, 23, 59, UTC),
        Granularity.DAY.decrement(at(2012, 3, 1, 0, 0, UTC), List.of()));
  }

  @Test
  void testHourCandidates() {
    List<Integer> hours = List.of(6, 12, 18);
    ZonedDateTime date = at(2020, 5, 5, 7, 30, UTC);
    assertEquals(at(2020, 5, 5, 12, 0, UTC), Granularity.HOUR.increment(date, hours));
    assertEquals(at(2020, 5, 5, 6, 59, UTC), Granularity.HOUR.decrement(date, hours));
    assertEquals(
        at(2020, 5, 6, 0, 0, UTC), Granularity.HOUR.increment(at(2020, 5, 5, 19, 0, UTC), hours));
    assertEquals(
        at(2020, 5, 4, 23, 59, UTC), Granularity.HOUR.decrement(at(2020, 5, 5, 5, 0, UTC), hours));
  }

  @Test
  void testHourWildcardAcrossSpringForward() {
    // 2021-03-14 02:00 does not exist in New York
    ZonedDateTime date = at(2021, 3, 14, 1, 30, NEW_YORK);
    ZonedDateTime next = Granularity.HOUR.increment(date, List.of());
    assertEquals("2021-03-14T03:00-04:00[America/New_York]", next.toString());
  }

  @Test
  void testHourWildcardAcrossFallBack() {
    // 01:00-01:59 happens twice on 2021-11-07 in New York
    ZonedDateTime firstOne = at(2021, 11, 7, 1, 30, NEW_YORK).withEarlierOffsetAtOverlap();
    ZonedDateTime next = Granularity.HOUR.increment(firstOne, List.of());
    assertEquals("2021-11-07T01:00-05:00[America/New_York]", next.toString());
    assertTrue(next.isAfter(firstOne));
  }

  @Test
  void testHourCandidateInGapMovesForward() {
    ZonedDateTime date = at(2021, 3, 14, 0, 0, NEW_YORK);
    ZonedDateTime next = Granularity.HOUR.increment(date, List.of(2));
    assertTrue(next.isAfter(date));
    assertEquals(3, next.getHour());
  }

  @Test
  void testMinuteWraps() {
    List<Integer> minutes = List.of(0, 30);
    assertEquals(
        at(2020, 1, 1, 11, 0, UTC),
        Granularity.MINUTE.increment(at(2020, 1, 1, 10, 45, UTC), minutes));
    assertEquals(
        at(2020, 1, 1, 10, 59, UTC),
        Granularity.MINUTE.decrement(at(2020, 1, 1, 11, 0, UTC), minutes));
    assertEquals(
        at(2020, 1, 1, 10, 46, UTC),
        Granularity.MINUTE.increment(at(2020, 1, 1, 10, 45, UTC), List.of()));
  }
}
