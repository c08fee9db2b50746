package io.cronkit.field;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * The calendar unit a field moves by when a search finds it unsatisfied.
 *
 * <p>Moving forward lands on the first minute of the next candidate window, moving backward on
 * its last minute, so the search never scans minute by minute through a window that cannot match.
 *
 * <h2>DST Handling</h2>
 *
 * <p>Wall-clock times are resolved with the offset of the date being moved when that offset is
 * valid. A time inside a DST gap is pushed forward past the gap. When the resolved time does not
 * move in the search direction, the date jumps to the next (previous) day instead.
 */
public enum Granularity {
  MINUTE,
  HOUR,
  DAY,
  MONTH;

  /**
   * Moves a date forward to the start of the next candidate window.
   *
   * @param date the date, minute precision
   * @param candidates the sorted candidate values of the field, empty when unconstrained (only
   *     used by MINUTE and HOUR)
   * @return the moved date
   */
  public ZonedDateTime increment(ZonedDateTime date, List<Integer> candidates) {
    return switch (this) {
      case MINUTE -> nextMinute(date, candidates);
      case HOUR -> nextHour(date, candidates);
      case DAY -> startOfNextDay(date);
      case MONTH -> date.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay(date.getZone());
    };
  }

  /**
   * Moves a date backward to the end of the previous candidate window.
   *
   * @param date the date, minute precision
   * @param candidates the sorted candidate values of the field, empty when unconstrained (only
   *     used by MINUTE and HOUR)
   * @return the moved date
   */
  public ZonedDateTime decrement(ZonedDateTime date, List<Integer> candidates) {
    return switch (this) {
      case MINUTE -> previousMinute(date, candidates);
      case HOUR -> previousHour(date, candidates);
      case DAY -> endOfPreviousDay(date);
      case MONTH ->
          date.toLocalDate().withDayOfMonth(1).atStartOfDay(date.getZone()).minusMinutes(1);
    };
  }

  private static ZonedDateTime nextMinute(ZonedDateTime date, List<Integer> candidates) {
    if (candidates.isEmpty()) {
      return date.plusMinutes(1);
    }

    int current = date.getMinute();
    for (int minute : candidates) {
      if (minute > current) {
        return date.plusMinutes(minute - current);
      }
    }
    return date.plusMinutes(60 - current);
  }

  private static ZonedDateTime previousMinute(ZonedDateTime date, List<Integer> candidates) {
    if (candidates.isEmpty()) {
      return date.minusMinutes(1);
    }

    int current = date.getMinute();
    for (int i = candidates.size() - 1; i >= 0; i--) {
      int minute = candidates.get(i);
      if (minute < current) {
        return date.minusMinutes(current - minute);
      }
    }
    return date.minusMinutes(current + 1);
  }

  private static ZonedDateTime nextHour(ZonedDateTime date, List<Integer> candidates) {
    if (candidates.isEmpty()) {
      // UTC arithmetic so that an hour is an hour across DST transitions
      return date.truncatedTo(ChronoUnit.HOURS)
          .withZoneSameInstant(ZoneOffset.UTC)
          .plusHours(1)
          .withZoneSameInstant(date.getZone());
    }

    int current = date.getHour();
    for (int hour : candidates) {
      if (hour > current) {
        ZonedDateTime next = atLocalTime(date, LocalTime.of(hour, 0));
        return next.isAfter(date) ? next : startOfNextDay(date);
      }
    }
    return startOfNextDay(date);
  }

  private static ZonedDateTime previousHour(ZonedDateTime date, List<Integer> candidates) {
    if (candidates.isEmpty()) {
      return date.truncatedTo(ChronoUnit.HOURS)
          .withZoneSameInstant(ZoneOffset.UTC)
          .minusMinutes(1)
          .withZoneSameInstant(date.getZone());
    }

    int current = date.getHour();
    for (int i = candidates.size() - 1; i >= 0; i--) {
      int hour = candidates.get(i);
      if (hour < current) {
        ZonedDateTime previous = atLocalTime(date, LocalTime.of(hour, 59));
        return previous.isBefore(date) ? previous : endOfPreviousDay(date);
      }
    }
    return endOfPreviousDay(date);
  }

  private static ZonedDateTime startOfNextDay(ZonedDateTime date) {
    return date.toLocalDate().plusDays(1).atStartOfDay(date.getZone());
  }

  private static ZonedDateTime endOfPreviousDay(ZonedDateTime date) {
    return date.toLocalDate().atStartOfDay(date.getZone()).minusMinutes(1);
  }

  private static ZonedDateTime atLocalTime(ZonedDateTime date, LocalTime time) {
    LocalDateTime local = date.toLocalDate().atTime(time);
    return ZonedDateTime.ofLocal(local, date.getZone(), date.getOffset());
  }
}
