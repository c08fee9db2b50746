package io.cronkit.field;

import java.util.Map;
import java.util.Optional;

/** Represents a month of the year and its CRON literal. */
public enum MonthName {
  JANUARY(1, "JAN"),
  FEBRUARY(2, "FEB"),
  MARCH(3, "MAR"),
  APRIL(4, "APR"),
  MAY(5, "MAY"),
  JUNE(6, "JUN"),
  JULY(7, "JUL"),
  AUGUST(8, "AUG"),
  SEPTEMBER(9, "SEP"),
  OCTOBER(10, "OCT"),
  NOVEMBER(11, "NOV"),
  DECEMBER(12, "DEC");

  private final int monthNumber;
  private final String literal;

  MonthName(int monthNumber, String literal) {
    this.monthNumber = monthNumber;
    this.literal = literal;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  /**
   * Returns the three letter literal accepted in the month field.
   *
   * @return the literal, upper case
   */
  public String literal() {
    return literal;
  }

  @Override
  public String toString() {
    return literal;
  }

  private static final Map<String, MonthName> PARSE_MAP =
      Map.ofEntries(
          Map.entry("JAN", JANUARY),
          Map.entry("FEB", FEBRUARY),
          Map.entry("MAR", MARCH),
          Map.entry("APR", APRIL),
          Map.entry("MAY", MAY),
          Map.entry("JUN", JUNE),
          Map.entry("JUL", JULY),
          Map.entry("AUG", AUGUST),
          Map.entry("SEP", SEPTEMBER),
          Map.entry("OCT", OCTOBER),
          Map.entry("NOV", NOVEMBER),
          Map.entry("DEC", DECEMBER));

  /**
   * Parses a month literal (case insensitive).
   *
   * @param s the string to parse
   * @return the month if valid
   */
  public static Optional<MonthName> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toUpperCase()));
  }
}
