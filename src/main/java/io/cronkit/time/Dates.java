package io.cronkit.time;

import io.cronkit.CronException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Parses the date strings accepted wherever a run reference date is expected.
 *
 * <ul>
 *   <li>{@code now}
 *   <li>{@code @<epoch seconds>}, e.g. {@code @1300000000}
 *   <li>{@code 2011-07-01T00:00+02:00}, {@code 2011-07-01T00:00Z[Europe/Paris]}
 *   <li>{@code 2011-07-01T00:00}, {@code 2011-07-01 00:00:00} (in the given zone)
 *   <li>{@code 2011-07-01} (midnight in the given zone)
 * </ul>
 */
public final class Dates {
  private static final Pattern EPOCH = Pattern.compile("@-?\\d+");

  private static final Pattern SPACE_SEPARATED = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d.*");

  private static final DateTimeFormatter FORMAT =
      new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .optionalStart()
          .appendLiteral('[')
          .parseCaseSensitive()
          .appendZoneRegionId()
          .appendLiteral(']')
          .optionalEnd()
          .optionalEnd()
          .toFormatter()
          .withResolverStyle(ResolverStyle.STRICT);

  private Dates() {}

  /**
   * Parses a date string.
   *
   * @param text the date string
   * @param zone the zone of dates given without offset
   * @return the date
   * @throws CronException if the text is not a valid date
   */
  public static ZonedDateTime parse(String text, ZoneId zone) throws CronException {
    String s = text == null ? "" : text.trim();

    try {
      if (s.equalsIgnoreCase("now")) {
        return ZonedDateTime.now(zone);
      }
      if (EPOCH.matcher(s).matches()) {
        return Instant.ofEpochSecond(Long.parseLong(s.substring(1))).atZone(zone);
      }
      if (SPACE_SEPARATED.matcher(s).matches()) {
        s = s.replaceFirst(" ", "T");
      }

      TemporalAccessor parsed =
          FORMAT.parseBest(s, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
      if (parsed instanceof ZonedDateTime) {
        return (ZonedDateTime) parsed;
      }
      if (parsed instanceof LocalDateTime) {
        return ((LocalDateTime) parsed).atZone(zone);
      }
      return ((LocalDate) parsed).atStartOfDay(zone);
    } catch (DateTimeException | NumberFormatException e) {
      throw CronException.syntax("`" + text + "` is not a valid date", e);
    }
  }
}
