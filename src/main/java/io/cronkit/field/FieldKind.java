package io.cronkit.field;

import io.cronkit.CronException;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The five positional fields of a CRON expression, with their numeric range and the literal names
 * each of them accepts.
 */
public enum FieldKind {
  MINUTE("minute", 0, 59, Granularity.MINUTE),
  HOUR("hour", 0, 23, Granularity.HOUR),
  DAY_OF_MONTH("dayOfMonth", 1, 31, Granularity.DAY),
  MONTH("month", 1, 12, Granularity.MONTH),
  DAY_OF_WEEK("dayOfWeek", 0, 7, Granularity.DAY);

  /** Coarsest to finest: a jump on a coarse field never breaks an already checked one. */
  private static final List<FieldKind> SEARCH_ORDER =
      List.of(MONTH, DAY_OF_MONTH, DAY_OF_WEEK, HOUR, MINUTE);

  private final String fieldName;
  private final int rangeStart;
  private final int rangeEnd;
  private final Granularity granularity;

  FieldKind(String fieldName, int rangeStart, int rangeEnd, Granularity granularity) {
    this.fieldName = fieldName;
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.granularity = granularity;
  }

  /**
   * Returns the field name used in error reports and maps.
   *
   * @return the field name, e.g. {@code dayOfMonth}
   */
  public String fieldName() {
    return fieldName;
  }

  /**
   * Returns the lowest accepted value.
   *
   * @return the range start
   */
  public int rangeStart() {
    return rangeStart;
  }

  /**
   * Returns the highest accepted value.
   *
   * @return the range end
   */
  public int rangeEnd() {
    return rangeEnd;
  }

  /**
   * Returns the number of values in the field range.
   *
   * @return the range length
   */
  public int rangeLength() {
    return rangeEnd - rangeStart + 1;
  }

  /**
   * Returns the calendar unit the field steps by when it is not satisfied.
   *
   * @return the granularity
   */
  public Granularity granularity() {
    return granularity;
  }

  /**
   * Returns the zero-based position of the field in an expression.
   *
   * @return the position
   */
  public int position() {
    return ordinal();
  }

  /**
   * Tells whether the field accepts the {@code ?} marker.
   *
   * @return true for day of month and day of week
   */
  public boolean allowsNoConstraint() {
    return this == DAY_OF_MONTH || this == DAY_OF_WEEK;
  }

  /**
   * Resolves a literal name to its numeric value. Day of week literals resolve to their ISO number,
   * so {@code SUN} is 7.
   *
   * @param token the literal, case insensitive
   * @return the value, or empty if the field has no such literal
   */
  public OptionalInt literal(String token) {
    switch (this) {
      case MONTH:
        return MonthName.parse(token).map(m -> OptionalInt.of(m.number())).orElse(OptionalInt.empty());
      case DAY_OF_WEEK:
        return Weekday.parse(token).map(d -> OptionalInt.of(d.number())).orElse(OptionalInt.empty());
      default:
        return OptionalInt.empty();
    }
  }

  /**
   * Extracts the value this field constrains from a date. Day of week is returned as a cron day
   * number, Sunday being 0.
   *
   * @param date the date
   * @return the field value
   */
  public int extract(ZonedDateTime date) {
    return switch (this) {
      case MINUTE -> date.getMinute();
      case HOUR -> date.getHour();
      case DAY_OF_MONTH -> date.getDayOfMonth();
      case MONTH -> date.getMonthValue();
      case DAY_OF_WEEK -> Weekday.fromDayOfWeek(date.getDayOfWeek()).cronDOW();
    };
  }

  /**
   * Returns the matcher evaluating expressions of this field.
   *
   * @return the field matcher
   */
  public FieldMatcher matcher() {
    return CalendarFieldMatcher.forKind(this);
  }

  /**
   * Returns the order in which a search checks the fields.
   *
   * @return month, day of month, day of week, hour, minute
   */
  public static List<FieldKind> searchOrder() {
    return SEARCH_ORDER;
  }

  /**
   * Returns the field at a zero-based position.
   *
   * @param position the position, 0 to 4
   * @return the field
   * @throws CronException if the position is out of range
   */
  public static FieldKind fromPosition(int position) throws CronException {
    if (position < 0 || position >= values().length) {
      throw CronException.syntax(
          "`" + (position + 1) + "` is not a valid CRON expression position");
    }
    return values()[position];
  }

  /**
   * Looks a field up by its name.
   *
   * @param name the field name, e.g. {@code dayOfWeek}
   * @return the field if the name is known
   */
  public static Optional<FieldKind> fromName(String name) {
    for (FieldKind kind : values()) {
      if (kind.fieldName.equals(name)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return fieldName;
  }
}
