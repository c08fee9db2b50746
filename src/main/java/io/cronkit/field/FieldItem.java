package io.cronkit.field;

import java.util.List;

/**
 * One comma separated item of a field expression, resolved to what it matches.
 *
 * @param kind the type of item
 * @param values the matched values (only used when kind is VALUES)
 * @param day the target day of month (only used when kind is NEAREST_WEEKDAY)
 * @param weekday the target weekday (only used when kind is LAST_OF_WEEKDAY or NTH_WEEKDAY)
 * @param nth the occurrence within the month (only used when kind is NTH_WEEKDAY)
 */
public record FieldItem(Kind kind, List<Integer> values, int day, Weekday weekday, int nth) {

  /** The type of field item. */
  public enum Kind {
    /** {@code *}: any value. */
    ANY,
    /** {@code ?}: no constraint, day of month and day of week only. */
    NO_CONSTRAINT,
    /** A value, a range or a stepped range, expanded to its values. */
    VALUES,
    /** {@code L} in day of month: the last day of the month. */
    LAST_DAY,
    /** {@code LW} in day of month: the last weekday (Mon-Fri) of the month. */
    LAST_WEEKDAY,
    /** {@code NW} in day of month: the weekday nearest to day N, within the month. */
    NEAREST_WEEKDAY,
    /** {@code NL} in day of week: the last occurrence of weekday N in the month. */
    LAST_OF_WEEKDAY,
    /** {@code N#k} in day of week: the kth occurrence of weekday N in the month. */
    NTH_WEEKDAY
  }

  /**
   * Creates an item matching any value.
   *
   * @return a new any item
   */
  public static FieldItem any() {
    return new FieldItem(Kind.ANY, List.of(), 0, null, 0);
  }

  /**
   * Creates an item imposing no constraint.
   *
   * @return a new no-constraint item
   */
  public static FieldItem noConstraint() {
    return new FieldItem(Kind.NO_CONSTRAINT, List.of(), 0, null, 0);
  }

  /**
   * Creates an item matching a set of values.
   *
   * @param values the values, in expansion order
   * @return a new values item
   */
  public static FieldItem values(List<Integer> values) {
    return new FieldItem(Kind.VALUES, List.copyOf(values), 0, null, 0);
  }

  /**
   * Creates an item matching the last day of the month.
   *
   * @return a new last-day item
   */
  public static FieldItem lastDay() {
    return new FieldItem(Kind.LAST_DAY, List.of(), 0, null, 0);
  }

  /**
   * Creates an item matching the last weekday of the month.
   *
   * @return a new last-weekday item
   */
  public static FieldItem lastWeekday() {
    return new FieldItem(Kind.LAST_WEEKDAY, List.of(), 0, null, 0);
  }

  /**
   * Creates an item matching the weekday nearest to a day of month.
   *
   * @param day the target day (1-31)
   * @return a new nearest-weekday item
   */
  public static FieldItem nearestWeekday(int day) {
    return new FieldItem(Kind.NEAREST_WEEKDAY, List.of(), day, null, 0);
  }

  /**
   * Creates an item matching the last occurrence of a weekday in the month.
   *
   * @param weekday the weekday
   * @return a new last-of-weekday item
   */
  public static FieldItem lastOf(Weekday weekday) {
    return new FieldItem(Kind.LAST_OF_WEEKDAY, List.of(), 0, weekday, 0);
  }

  /**
   * Creates an item matching the nth occurrence of a weekday in the month.
   *
   * @param weekday the weekday
   * @param nth the occurrence (1-5)
   * @return a new nth-weekday item
   */
  public static FieldItem nth(Weekday weekday, int nth) {
    return new FieldItem(Kind.NTH_WEEKDAY, List.of(), 0, weekday, nth);
  }
}
