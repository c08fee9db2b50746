package io.cronkit.field;

import static org.junit.jupiter.api.Assertions.*;

import io.cronkit.CronException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for FieldSpec matching and moves. */
public class FieldSpecTest {
  private static final ZoneId UTC = ZoneId.of("UTC");

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute, ZoneId zone) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, zone);
  }

  @Test
  void testToStringKeepsInput() throws CronException {
    assertEquals("30,5,10", FieldSpec.of(FieldKind.MINUTE, "30,5,10").toString());
    assertEquals("mon-Fri", FieldSpec.of(FieldKind.DAY_OF_WEEK, "mon-Fri").toString());
    assertEquals("*", FieldSpec.wildcard(FieldKind.HOUR).toString());
  }

  @Test
  void testCandidatesAreSortedAndDistinct() throws CronException {
    assertEquals(List.of(5, 10, 30), FieldSpec.of(FieldKind.MINUTE, "30,5,10,5").candidates());
    assertEquals(List.of(1, 2, 3, 11, 12, 13), FieldSpec.of(FieldKind.HOUR, "11-13,1-3").candidates());
    assertEquals(List.of(), FieldSpec.of(FieldKind.MINUTE, "*").candidates());
    assertEquals(List.of(), FieldSpec.of(FieldKind.DAY_OF_MONTH, "L").candidates());
  }

  @Test
  void testIsUnconstrained() throws CronException {
    assertTrue(FieldSpec.of(FieldKind.MINUTE, "*").isUnconstrained());
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "?").isUnconstrained());
    assertFalse(FieldSpec.of(FieldKind.MINUTE, "*/1").isUnconstrained());
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_WEEK, "*,1").isUnconstrained());
  }

  @Test
  void testDayOfWeekMatching() throws CronException {
    // a Sunday
    ZonedDateTime date = at(2011, 9, 4, 0, 0, UTC);
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "0-2").isSatisfiedBy(date));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "6-0").isSatisfiedBy(date));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "SUN").isSatisfiedBy(date));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "7").isSatisfiedBy(date));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_WEEK, "0#1").isSatisfiedBy(date));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_WEEK, "0#3").isSatisfiedBy(date));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_WEEK, "7#3").isSatisfiedBy(date));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_WEEK, "SUN#3").isSatisfiedBy(date));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_WEEK, "1-5").isSatisfiedBy(date));
  }

  @Test
  void testDayOfMonthMatching() throws CronException {
    ZonedDateTime leapDay = at(2012, 2, 29, 12, 0, UTC);
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_MONTH, "L").isSatisfiedBy(leapDay));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_MONTH, "LW").isSatisfiedBy(leapDay));
    assertTrue(FieldSpec.of(FieldKind.DAY_OF_MONTH, "29W").isSatisfiedBy(leapDay));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_MONTH, "28").isSatisfiedBy(leapDay));
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_MONTH, "L").isSatisfiedBy(at(2012, 2, 28, 0, 0, UTC)));
    // no 31st in june
    assertFalse(FieldSpec.of(FieldKind.DAY_OF_MONTH, "31W").isSatisfiedBy(at(2011, 6, 30, 0, 0, UTC)));
  }

  @Test
  void testListIsLogicalOr() throws CronException {
    FieldSpec spec = FieldSpec.of(FieldKind.MINUTE, "1,*/20,58-59");
    assertTrue(spec.isSatisfiedBy(at(2020, 1, 1, 0, 1, UTC)));
    assertTrue(spec.isSatisfiedBy(at(2020, 1, 1, 0, 40, UTC)));
    assertTrue(spec.isSatisfiedBy(at(2020, 1, 1, 0, 59, UTC)));
    assertFalse(spec.isSatisfiedBy(at(2020, 1, 1, 0, 2, UTC)));
  }

  @Test
  void testHourWildcardIncrementAndDecrement() {
    for (String zone : List.of("UTC", "America/St_Johns", "Asia/Kathmandu")) {
      ZoneId z = ZoneId.of(zone);
      FieldSpec hour = FieldSpec.wildcard(FieldKind.HOUR);
      ZonedDateTime date = at(2011, 3, 15, 11, 15, z);
      assertEquals(at(2011, 3, 15, 12, 0, z), hour.increment(date), zone);
      assertEquals(at(2011, 3, 15, 10, 59, z), hour.decrement(date), zone);
    }
  }

  @Test
  void testDayOfWeekIncrementAndDecrement() throws CronException {
    FieldSpec dayOfWeek = FieldSpec.of(FieldKind.DAY_OF_WEEK, "?");
    ZonedDateTime date = at(2011, 3, 15, 11, 15, UTC);
    assertEquals(at(2011, 3, 16, 0, 0, UTC), dayOfWeek.increment(date));
    assertEquals(at(2011, 3, 14, 23, 59, UTC), dayOfWeek.decrement(date));
  }

  @Test
  void testMinuteJumpsToCandidates() throws CronException {
    FieldSpec minute = FieldSpec.of(FieldKind.MINUTE, "45,15");
    ZonedDateTime date = at(2011, 3, 15, 11, 20, UTC);
    assertEquals(at(2011, 3, 15, 11, 45, UTC), minute.increment(date));
    assertEquals(at(2011, 3, 15, 11, 15, UTC), minute.decrement(date));
    assertEquals(at(2011, 3, 15, 12, 0, UTC), minute.increment(at(2011, 3, 15, 11, 50, UTC)));
    assertEquals(at(2011, 3, 15, 10, 59, UTC), minute.decrement(at(2011, 3, 15, 11, 10, UTC)));
  }

  @Test
  void testEquality() throws CronException {
    assertEquals(FieldSpec.of(FieldKind.HOUR, "1"), FieldSpec.of(FieldKind.HOUR, "1"));
    assertNotEquals(FieldSpec.of(FieldKind.HOUR, "1"), FieldSpec.of(FieldKind.MINUTE, "1"));
    assertNotEquals(FieldSpec.of(FieldKind.HOUR, "1"), FieldSpec.of(FieldKind.HOUR, "01"));
    assertEquals(FieldSpec.wildcard(FieldKind.MONTH), FieldSpec.of(FieldKind.MONTH, "*"));
  }
}
