package io.cronkit.time;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** The units of a human-readable interval such as {@code 1 hour 30 minutes}. */
public enum IntervalUnit {
  MINUTES("minute"),
  HOURS("hour"),
  DAYS("day"),
  WEEKS("week"),
  MONTHS("month"),
  YEARS("year");

  private static final Map<String, IntervalUnit> PARSE_MAP =
      Map.ofEntries(
          Map.entry("min", MINUTES),
          Map.entry("mins", MINUTES),
          Map.entry("minute", MINUTES),
          Map.entry("minutes", MINUTES),
          Map.entry("h", HOURS),
          Map.entry("hr", HOURS),
          Map.entry("hrs", HOURS),
          Map.entry("hour", HOURS),
          Map.entry("hours", HOURS),
          Map.entry("day", DAYS),
          Map.entry("days", DAYS),
          Map.entry("week", WEEKS),
          Map.entry("weeks", WEEKS),
          Map.entry("month", MONTHS),
          Map.entry("months", MONTHS),
          Map.entry("year", YEARS),
          Map.entry("years", YEARS));

  private final String singular;

  IntervalUnit(String singular) {
    this.singular = singular;
  }

  /**
   * Parses a unit name, singular, plural or abbreviated.
   *
   * @param s the unit name, case insensitive
   * @return the unit, or empty if not recognized
   */
  public static Optional<IntervalUnit> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns the display string based on the amount.
   *
   * @param amount the amount
   * @return the display string, e.g. {@code 1 hour} or {@code 3 days}
   */
  public String display(long amount) {
    return amount + " " + (Math.abs(amount) == 1 ? singular : singular + "s");
  }

  @Override
  public String toString() {
    return singular + "s";
  }
}
