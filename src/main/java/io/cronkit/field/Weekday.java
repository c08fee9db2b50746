package io.cronkit.field;

import java.util.Map;
import java.util.Optional;

/** Represents a day of the week and its CRON literal. */
public enum Weekday {
  MONDAY(1, "MON"),
  TUESDAY(2, "TUE"),
  WEDNESDAY(3, "WED"),
  THURSDAY(4, "THU"),
  FRIDAY(5, "FRI"),
  SATURDAY(6, "SAT"),
  SUNDAY(7, "SUN");

  private final int isoNumber;
  private final String literal;

  Weekday(int isoNumber, String literal) {
    this.isoNumber = isoNumber;
    this.literal = literal;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the cron day of week number (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the cron day of week number
   */
  public int cronDOW() {
    return isoNumber % 7;
  }

  @Override
  public String toString() {
    return literal;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.of(
          "MON", MONDAY,
          "TUE", TUESDAY,
          "WED", WEDNESDAY,
          "THU", THURSDAY,
          "FRI", FRIDAY,
          "SAT", SATURDAY,
          "SUN", SUNDAY);

  /**
   * Parses a weekday literal (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toUpperCase()));
  }

  /**
   * Returns a Weekday from a cron day number, where both 0 and 7 denote Sunday.
   *
   * @param n the cron day number (0-7)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromCron(int n) {
    if (n < 0 || n > 7) {
      return Optional.empty();
    }
    return Optional.of(n == 0 ? SUNDAY : values()[n - 1]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public java.time.DayOfWeek toDayOfWeek() {
    return java.time.DayOfWeek.of(isoNumber);
  }
}
