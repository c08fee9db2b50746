package io.cronkit.field;

import java.time.ZonedDateTime;

/**
 * Evaluates field expressions against dates and moves dates to the next or previous window where
 * a field could be satisfied.
 */
public interface FieldMatcher {
  /**
   * Tells whether the date's component for this field satisfies the expression. List items are
   * combined with a logical OR.
   *
   * @param spec the validated field expression
   * @param date the date, minute precision
   * @return true if the date matches
   */
  boolean isSatisfiedBy(FieldSpec spec, ZonedDateTime date);

  /**
   * Moves a date forward to the first minute of the next window the field could match.
   *
   * @param spec the validated field expression
   * @param date the date, minute precision
   * @return a strictly later date
   */
  ZonedDateTime increment(FieldSpec spec, ZonedDateTime date);

  /**
   * Moves a date backward to the last minute of the previous window the field could match.
   *
   * @param spec the validated field expression
   * @param date the date, minute precision
   * @return a strictly earlier date
   */
  ZonedDateTime decrement(FieldSpec spec, ZonedDateTime date);
}
