package io.cronkit.field;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;

/** Calendar lookups for the month-relative day of month and day of week items. */
public final class MonthDays {
  /** Offsets tried around a target day, closest first, earlier day winning a tie. */
  private static final int[] NEAREST_OFFSETS = {0, -1, 1, -2, 2};

  private MonthDays() {}

  /**
   * Returns the last day of a month.
   *
   * @param month the month
   * @return the last day
   */
  public static LocalDate lastDayOfMonth(YearMonth month) {
    return month.atEndOfMonth();
  }

  /**
   * Returns the last Monday to Friday of a month.
   *
   * @param month the month
   * @return the last weekday
   */
  public static LocalDate lastWeekdayOfMonth(YearMonth month) {
    LocalDate d = month.atEndOfMonth();
    while (isWeekend(d)) {
      d = d.minusDays(1);
    }
    return d;
  }

  /**
   * Returns the Monday to Friday nearest to a day of month, never leaving the month.
   *
   * <ul>
   *   <li>Saturday: the Friday before, or the Monday after when the target is the 1st
   *   <li>Sunday: the Monday after, or the Friday before when the target is the last day
   * </ul>
   *
   * @param month the month
   * @param targetDay the target day of month (1-31)
   * @return the nearest weekday, or empty if the target day doesn't exist in the month
   */
  public static Optional<LocalDate> nearestWeekday(YearMonth month, int targetDay) {
    int lastDayNum = month.lengthOfMonth();

    // If target day doesn't exist in this month, skip this month
    if (targetDay > lastDayNum) {
      return Optional.empty();
    }

    for (int offset : NEAREST_OFFSETS) {
      int day = targetDay + offset;
      if (day < 1 || day > lastDayNum) {
        continue;
      }
      LocalDate date = month.atDay(day);
      if (!isWeekend(date)) {
        return Optional.of(date);
      }
    }

    return Optional.empty();
  }

  /**
   * Returns the nth occurrence of a weekday in a month.
   *
   * @param month the month
   * @param weekday the weekday
   * @param nth the occurrence, 1-based
   * @return the date, or empty if the month has fewer occurrences
   */
  public static Optional<LocalDate> nthWeekdayOfMonth(YearMonth month, Weekday weekday, int nth) {
    DayOfWeek targetDow = weekday.toDayOfWeek();

    LocalDate d = month.atDay(1);
    while (d.getDayOfWeek() != targetDow) {
      d = d.plusDays(1);
    }

    d = d.plusWeeks(nth - 1L);

    if (!YearMonth.from(d).equals(month)) {
      return Optional.empty();
    }

    return Optional.of(d);
  }

  /**
   * Returns the last occurrence of a weekday in a month.
   *
   * @param month the month
   * @param weekday the weekday
   * @return the date
   */
  public static LocalDate lastWeekdayInMonth(YearMonth month, Weekday weekday) {
    DayOfWeek targetDow = weekday.toDayOfWeek();
    LocalDate d = month.atEndOfMonth();
    while (d.getDayOfWeek() != targetDow) {
      d = d.minusDays(1);
    }
    return d;
  }

  private static boolean isWeekend(LocalDate d) {
    return d.getDayOfWeek() == DayOfWeek.SATURDAY || d.getDayOfWeek() == DayOfWeek.SUNDAY;
  }
}
