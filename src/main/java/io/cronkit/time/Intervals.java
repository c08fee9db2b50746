package io.cronkit.time;

import io.cronkit.CronException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Period;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval strings, either ISO-8601 ({@code P1D}, {@code PT2H}, {@code P1DT2H30M}) or
 * human-readable ({@code 3 days}, {@code 1 hour 30 minutes}, {@code 2 weeks and 1 day}).
 */
public final class Intervals {
  private static final Pattern PART =
      Pattern.compile("\\s*([+-]?\\d+)\\s*([A-Za-z]+)\\s*(?:,|\\band\\b)?", Pattern.CASE_INSENSITIVE);

  private Intervals() {}

  /**
   * Parses an interval string.
   *
   * @param text the interval
   * @return the parsed interval
   * @throws CronException if the text is not a valid interval
   */
  public static Interval parse(String text) throws CronException {
    String s = text == null ? "" : text.trim();
    if (s.isEmpty()) {
      throw invalid(text, null);
    }

    String upper = s.toUpperCase(Locale.ROOT);
    if (upper.startsWith("P") || upper.startsWith("-P") || upper.startsWith("+P")) {
      return parseIso(text, upper);
    }
    return parseHuman(text, s);
  }

  private static Interval parseIso(String text, String upper) throws CronException {
    try {
      int t = upper.indexOf('T');
      if (t < 0) {
        return new Interval(Period.parse(upper), Duration.ZERO);
      }

      String datePart = upper.substring(0, t);
      String sign = upper.startsWith("-") ? "-" : "";
      Duration duration = Duration.parse(sign + "P" + upper.substring(t));
      if (datePart.endsWith("P")) {
        return new Interval(Period.ZERO, duration);
      }
      return new Interval(Period.parse(datePart), duration);
    } catch (DateTimeException e) {
      throw invalid(text, e);
    }
  }

  private static Interval parseHuman(String text, String s) throws CronException {
    Period period = Period.ZERO;
    Duration duration = Duration.ZERO;

    Matcher m = PART.matcher(s);
    int pos = 0;
    while (pos < s.length()) {
      m.region(pos, s.length());
      if (!m.lookingAt()) {
        throw invalid(text, null);
      }

      long amount;
      try {
        amount = Long.parseLong(m.group(1));
      } catch (NumberFormatException e) {
        throw invalid(text, e);
      }
      IntervalUnit unit = IntervalUnit.parse(m.group(2)).orElseThrow(() -> invalid(text, null));

      try {
        switch (unit) {
          case MINUTES -> duration = duration.plusMinutes(amount);
          case HOURS -> duration = duration.plusHours(amount);
          case DAYS -> period = period.plusDays(Math.toIntExact(amount));
          case WEEKS -> period = period.plusDays(Math.multiplyExact(Math.toIntExact(amount), 7));
          case MONTHS -> period = period.plusMonths(Math.toIntExact(amount));
          case YEARS -> period = period.plusYears(Math.toIntExact(amount));
        }
      } catch (ArithmeticException e) {
        throw invalid(text, e);
      }
      pos = m.end();
    }

    return new Interval(period, duration);
  }

  private static CronException invalid(String text, Throwable cause) {
    return CronException.syntax("`" + text + "` is not a valid interval", cause);
  }
}
