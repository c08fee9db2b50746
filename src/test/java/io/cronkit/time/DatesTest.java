package io.cronkit.time;

import static org.junit.jupiter.api.Assertions.*;

import io.cronkit.CronException;
import io.cronkit.ErrorKind;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

/** Unit tests for Dates. */
public class DatesTest {
  private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

  @Test
  void testLocalDateTimeUsesGivenZone() throws CronException {
    ZonedDateTime expected = ZonedDateTime.of(2011, 7, 1, 9, 30, 0, 0, PARIS);
    assertEquals(expected, Dates.parse("2011-07-01 09:30", PARIS));
    assertEquals(expected, Dates.parse("2011-07-01T09:30", PARIS));
    assertEquals(expected.withSecond(15), Dates.parse("2011-07-01 09:30:15", PARIS));
  }

  @Test
  void testDateIsMidnight() throws CronException {
    assertEquals(ZonedDateTime.of(2011, 7, 1, 0, 0, 0, 0, PARIS), Dates.parse("2011-07-01", PARIS));
  }

  @Test
  void testOffsetAndZone() throws CronException {
    ZonedDateTime withOffset = Dates.parse("2014-01-01T15:00+09:00", PARIS);
    assertEquals(ZoneOffset.ofHours(9), withOffset.getZone());
    assertEquals(15, withOffset.getHour());

    ZonedDateTime utc = Dates.parse("2014-01-01T15:00:00Z", PARIS);
    assertEquals(ZoneOffset.UTC, utc.getOffset());

    ZonedDateTime zoned = Dates.parse("2014-01-01T15:00+09:00[Asia/Tokyo]", PARIS);
    assertEquals(ZoneId.of("Asia/Tokyo"), zoned.getZone());
  }

  @Test
  void testEpochSeconds() throws CronException {
    ZonedDateTime date = Dates.parse("@0", PARIS);
    assertEquals(PARIS, date.getZone());
    assertEquals(0, date.toEpochSecond());
    assertEquals(1300000000L, Dates.parse("@1300000000", PARIS).toEpochSecond());
  }

  @Test
  void testNow() throws CronException {
    ZonedDateTime before = ZonedDateTime.now(PARIS);
    ZonedDateTime now = Dates.parse("NOW", PARIS);
    assertEquals(PARIS, now.getZone());
    assertFalse(now.isBefore(before));
  }

  @Test
  void testInvalid() {
    for (String text :
        new String[] {"", "tomorrow", "2011-02-30", "2011-13-01", "2011-07-01 25:00", "@", "@abc"}) {
      CronException e = assertThrows(CronException.class, () -> Dates.parse(text, PARIS), text);
      assertEquals(ErrorKind.SYNTAX, e.kind());
    }
    assertThrows(CronException.class, () -> Dates.parse(null, PARIS));
  }
}
