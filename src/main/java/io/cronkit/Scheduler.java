package io.cronkit;

import io.cronkit.field.FieldKind;
import io.cronkit.field.FieldSpec;
import io.cronkit.time.Dates;
import io.cronkit.time.Intervals;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the run dates of an {@link Expression} in a timezone.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Scheduler scheduler = Scheduler.fromUtc(Expression.parse("0 9 * * MON-FRI"));
 * ZonedDateTime next = scheduler.run(ZonedDateTime.now());
 * scheduler.yieldRunsForward("2024-01-01", 5).forEach(System.out::println);
 * }</pre>
 *
 * <h2>Search</h2>
 *
 * <p>A search starts from the reference date converted to the scheduler's timezone and truncated
 * to the minute. The constrained fields are checked from coarsest to finest; the first field the
 * candidate does not satisfy moves it to its next (previous) window and the check starts over.
 * Unconstrained fields ({@code *}, {@code ?}) are never checked.
 *
 * <p>When both day of month and day of week are constrained a date matches if it satisfies
 * either of them: the search runs once with day of week unconstrained, once with day of month
 * unconstrained, and keeps the closest result.
 *
 * <h2>Iteration Safety Limit</h2>
 *
 * <p>Each single search moves the candidate at most {@link #maxIterations()} times (1000 by
 * default) before failing with {@link ErrorKind#UNABLE_TO_PROCESS_RUN}, so an expression that can
 * never match, such as {@code 0 0 30 2 *}, fails instead of looping.
 *
 * <h2>Streams</h2>
 *
 * <p>The {@code yieldRuns*} streams are lazy and single-use. Argument errors are raised when the
 * stream is requested; a search failing while the stream is consumed surfaces as {@link
 * UncheckedCronException}.
 */
public final class Scheduler {
  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  /** The default number of candidate moves allowed per search. */
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private final Expression expression;
  private final ZoneId timezone;
  private final StartDatePresence startDatePresence;
  private final int maxIterations;

  /** The constrained fields, in search order. */
  private final List<FieldSpec> constrainedFields;

  /** Set when both day fields are constrained: the searches whose results are merged. */
  private final Scheduler dayOfMonthOnly;

  private final Scheduler dayOfWeekOnly;

  private Scheduler(
      Expression expression,
      ZoneId timezone,
      StartDatePresence startDatePresence,
      int maxIterations) {
    this.expression = expression;
    this.timezone = timezone;
    this.startDatePresence = startDatePresence;
    this.maxIterations = maxIterations;

    List<FieldSpec> constrained = new ArrayList<>();
    for (FieldKind kind : FieldKind.searchOrder()) {
      FieldSpec spec = expression.field(kind);
      if (!spec.isUnconstrained()) {
        constrained.add(spec);
      }
    }
    this.constrainedFields = List.copyOf(constrained);

    if (!expression.dayOfMonth().isUnconstrained() && !expression.dayOfWeek().isUnconstrained()) {
      this.dayOfMonthOnly =
          new Scheduler(
              expression.with(FieldKind.DAY_OF_WEEK, FieldSpec.wildcard(FieldKind.DAY_OF_WEEK)),
              timezone,
              startDatePresence,
              maxIterations);
      this.dayOfWeekOnly =
          new Scheduler(
              expression.with(FieldKind.DAY_OF_MONTH, FieldSpec.wildcard(FieldKind.DAY_OF_MONTH)),
              timezone,
              startDatePresence,
              maxIterations);
    } else {
      this.dayOfMonthOnly = null;
      this.dayOfWeekOnly = null;
    }
  }

  /**
   * Creates a scheduler.
   *
   * @param expression the expression
   * @param timezone the timezone run dates are computed in
   * @param startDatePresence whether a matching reference date is itself a run date
   * @return a new scheduler
   */
  public static Scheduler of(
      Expression expression, ZoneId timezone, StartDatePresence startDatePresence) {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(timezone, "timezone");
    Objects.requireNonNull(startDatePresence, "startDatePresence");
    return new Scheduler(expression, timezone, startDatePresence, DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Creates a scheduler from strings.
   *
   * @param expression the expression or alias
   * @param timezone the timezone id, e.g. {@code Europe/Paris}
   * @param startDatePresence whether a matching reference date is itself a run date
   * @return a new scheduler
   * @throws CronException if the expression or the timezone is invalid
   */
  public static Scheduler of(
      String expression, String timezone, StartDatePresence startDatePresence)
      throws CronException {
    return of(Expression.parse(expression), zone(timezone), startDatePresence);
  }

  /**
   * Creates a scheduler computing UTC run dates, excluding the reference date.
   *
   * @param expression the expression
   * @return a new scheduler
   */
  public static Scheduler fromUtc(Expression expression) {
    return of(expression, ZoneId.of("UTC"), StartDatePresence.EXCLUDED);
  }

  /**
   * Creates a scheduler computing UTC run dates, excluding the reference date.
   *
   * @param expression the expression or alias
   * @return a new scheduler
   * @throws CronException if the expression is invalid
   */
  public static Scheduler fromUtc(String expression) throws CronException {
    return fromUtc(Expression.parse(expression));
  }

  /**
   * Creates a scheduler computing run dates in the system default timezone, excluding the
   * reference date.
   *
   * @param expression the expression
   * @return a new scheduler
   */
  public static Scheduler fromSystemTimezone(Expression expression) {
    return of(expression, ZoneId.systemDefault(), StartDatePresence.EXCLUDED);
  }

  /**
   * Creates a scheduler computing run dates in the system default timezone, excluding the
   * reference date.
   *
   * @param expression the expression or alias
   * @return a new scheduler
   * @throws CronException if the expression is invalid
   */
  public static Scheduler fromSystemTimezone(String expression) throws CronException {
    return fromSystemTimezone(Expression.parse(expression));
  }

  public Expression expression() {
    return expression;
  }

  public ZoneId timezone() {
    return timezone;
  }

  public StartDatePresence startDatePresence() {
    return startDatePresence;
  }

  public boolean isStartDateExcluded() {
    return startDatePresence == StartDatePresence.EXCLUDED;
  }

  public int maxIterations() {
    return maxIterations;
  }

  /**
   * Returns a scheduler for another expression.
   *
   * @param expression the expression
   * @return this scheduler if the expression is equal, a new scheduler otherwise
   */
  public Scheduler withExpression(Expression expression) {
    if (this.expression.equals(expression)) {
      return this;
    }
    return new Scheduler(
        Objects.requireNonNull(expression, "expression"),
        timezone,
        startDatePresence,
        maxIterations);
  }

  /**
   * Returns a scheduler for another expression.
   *
   * @param expression the expression or alias
   * @return this scheduler if the expression is equal, a new scheduler otherwise
   * @throws CronException if the expression is invalid
   */
  public Scheduler withExpression(String expression) throws CronException {
    return withExpression(Expression.parse(expression));
  }

  /**
   * Returns a scheduler computing run dates in another timezone.
   *
   * @param timezone the timezone
   * @return this scheduler if the timezone is equal, a new scheduler otherwise
   */
  public Scheduler withTimezone(ZoneId timezone) {
    if (this.timezone.equals(timezone)) {
      return this;
    }
    return new Scheduler(
        expression, Objects.requireNonNull(timezone, "timezone"), startDatePresence, maxIterations);
  }

  /**
   * Returns a scheduler computing run dates in another timezone.
   *
   * @param timezone the timezone id
   * @return this scheduler if the timezone is equal, a new scheduler otherwise
   * @throws CronException if the timezone id is invalid
   */
  public Scheduler withTimezone(String timezone) throws CronException {
    return withTimezone(zone(timezone));
  }

  /**
   * Returns a scheduler for which a matching reference date is itself a run date.
   *
   * @return this scheduler if it already includes the start date, a new scheduler otherwise
   */
  public Scheduler includeStartDate() {
    return withStartDatePresence(StartDatePresence.INCLUDED);
  }

  /**
   * Returns a scheduler for which runs are strictly after (or before) the reference date.
   *
   * @return this scheduler if it already excludes the start date, a new scheduler otherwise
   */
  public Scheduler excludeStartDate() {
    return withStartDatePresence(StartDatePresence.EXCLUDED);
  }

  private Scheduler withStartDatePresence(StartDatePresence presence) {
    if (startDatePresence == presence) {
      return this;
    }
    return new Scheduler(expression, timezone, presence, maxIterations);
  }

  /**
   * Returns a scheduler with another iteration budget per search.
   *
   * @param maxIterations the number of candidate moves allowed per search, at least 1
   * @return this scheduler if the budget is unchanged, a new scheduler otherwise
   * @throws CronException if the budget is less than 1
   */
  public Scheduler withMaxIterations(int maxIterations) throws CronException {
    if (maxIterations < 1) {
      throw CronException.syntax(
          "The maximum number of iterations must be at least 1, got " + maxIterations);
    }
    if (this.maxIterations == maxIterations) {
      return this;
    }
    return new Scheduler(expression, timezone, startDatePresence, maxIterations);
  }

  /**
   * Returns the first run date from a reference date.
   *
   * @param reference the reference date
   * @return the run date
   * @throws CronException if no run date is found within the iteration budget
   */
  public ZonedDateTime run(ZonedDateTime reference) throws CronException {
    return run(reference, 0);
  }

  /**
   * Returns the nth run date from a reference date. {@code 0} is the first run date, the
   * reference itself when it matches and the start date is included; {@code 1} the one after
   * it. A negative {@code nth} counts backward, {@code -1} being the first run date before.
   *
   * @param reference the reference date
   * @param nth the position of the run date
   * @return the run date
   * @throws CronException if no run date is found within the iteration budget
   */
  public ZonedDateTime run(ZonedDateTime reference, int nth) throws CronException {
    boolean backward = nth < 0;
    long count = backward ? -(long) nth : nth + 1L;

    ZonedDateTime result = nextRun(normalize(reference), startDatePresence, backward, null);
    for (long i = 1; i < count; i++) {
      result = nextRun(step(result, backward), StartDatePresence.INCLUDED, backward, null);
    }
    return result;
  }

  /**
   * Returns the nth run date from a reference date string.
   *
   * @param reference the reference date, see {@link Dates#parse(String, ZoneId)}
   * @param nth the position of the run date
   * @return the run date
   * @throws CronException if the date is invalid or no run date is found
   * @see #run(ZonedDateTime, int)
   */
  public ZonedDateTime run(String reference, int nth) throws CronException {
    return run(Dates.parse(reference, timezone), nth);
  }

  /**
   * Tells whether a date, truncated to the minute, matches the expression in this scheduler's
   * timezone. Never throws.
   *
   * @param date the date
   * @return true if the date is a run date
   */
  public boolean isDue(ZonedDateTime date) {
    if (date == null) {
      return false;
    }
    ZonedDateTime when = normalize(date);
    try {
      ZonedDateTime run = nextRun(when, StartDatePresence.INCLUDED, false, when);
      return run != null && run.isEqual(when);
    } catch (CronException e) {
      logger.debug("Unable to tell whether {} is due for `{}`", when, expression, e);
      return false;
    }
  }

  /**
   * Tells whether an instant matches the expression. Never throws.
   *
   * @param instant the instant
   * @return true if the instant is a run date
   */
  public boolean isDue(Instant instant) {
    return instant != null && isDue(instant.atZone(timezone));
  }

  /**
   * Tells whether a date string matches the expression. An invalid date is never due.
   *
   * @param date the date, see {@link Dates#parse(String, ZoneId)}
   * @return true if the date is a run date
   */
  public boolean isDue(String date) {
    try {
      return isDue(Dates.parse(date, timezone));
    } catch (CronException e) {
      logger.debug("`{}` is not a valid date", date, e);
      return false;
    }
  }

  /**
   * Tells whether the current minute matches the expression.
   *
   * @return true if now is a run date
   */
  public boolean isDue() {
    return isDue(ZonedDateTime.now(timezone));
  }

  /**
   * Returns the next {@code count} run dates from a start date, in chronological order.
   *
   * @param start the start date
   * @param count the number of run dates
   * @return a lazy stream of run dates
   * @throws CronException if the count is negative
   */
  public Stream<ZonedDateTime> yieldRunsForward(ZonedDateTime start, int count)
      throws CronException {
    checkCount(count);
    return runs(normalize(start), false, null).limit(count);
  }

  /**
   * Returns the next {@code count} run dates from a start date string.
   *
   * @param start the start date, see {@link Dates#parse(String, ZoneId)}
   * @param count the number of run dates
   * @return a lazy stream of run dates
   * @throws CronException if the date is invalid or the count is negative
   */
  public Stream<ZonedDateTime> yieldRunsForward(String start, int count) throws CronException {
    return yieldRunsForward(Dates.parse(start, timezone), count);
  }

  /**
   * Returns the previous {@code count} run dates from an end date, in reverse chronological
   * order.
   *
   * @param end the end date
   * @param count the number of run dates
   * @return a lazy stream of run dates
   * @throws CronException if the count is negative
   */
  public Stream<ZonedDateTime> yieldRunsBackward(ZonedDateTime end, int count)
      throws CronException {
    checkCount(count);
    return runs(normalize(end), true, null).limit(count);
  }

  /**
   * Returns the previous {@code count} run dates from an end date string.
   *
   * @param end the end date, see {@link Dates#parse(String, ZoneId)}
   * @param count the number of run dates
   * @return a lazy stream of run dates
   * @throws CronException if the date is invalid or the count is negative
   */
  public Stream<ZonedDateTime> yieldRunsBackward(String end, int count) throws CronException {
    return yieldRunsBackward(Dates.parse(end, timezone), count);
  }

  /**
   * Returns the run dates between a start date and the start date plus an interval, in
   * chronological order. Both bounds are inclusive.
   *
   * @param start the start date
   * @param interval the length of the window
   * @return a lazy stream of run dates
   * @throws CronException if the interval is negative
   */
  public Stream<ZonedDateTime> yieldRunsAfter(ZonedDateTime start, TemporalAmount interval)
      throws CronException {
    ZonedDateTime from = normalize(start);
    return runsAfter(from, normalize(plus(from, interval)));
  }

  /**
   * Returns the run dates within an interval after a start date.
   *
   * @param start the start date, see {@link Dates#parse(String, ZoneId)}
   * @param interval the length of the window, see {@link Intervals#parse(String)}
   * @return a lazy stream of run dates
   * @throws CronException if the date or the interval is invalid, or the interval is negative
   */
  public Stream<ZonedDateTime> yieldRunsAfter(String start, String interval)
      throws CronException {
    return yieldRunsAfter(Dates.parse(start, timezone), Intervals.parse(interval));
  }

  /**
   * Returns the run dates between an end date minus an interval and the end date, in reverse
   * chronological order. Both bounds are inclusive.
   *
   * @param end the end date
   * @param interval the length of the window
   * @return a lazy stream of run dates
   * @throws CronException if the interval is negative
   */
  public Stream<ZonedDateTime> yieldRunsBefore(ZonedDateTime end, TemporalAmount interval)
      throws CronException {
    ZonedDateTime to = normalize(end);
    return runsBefore(to, normalize(minus(to, interval)));
  }

  /**
   * Returns the run dates within an interval before an end date.
   *
   * @param end the end date, see {@link Dates#parse(String, ZoneId)}
   * @param interval the length of the window, see {@link Intervals#parse(String)}
   * @return a lazy stream of run dates
   * @throws CronException if the date or the interval is invalid, or the interval is negative
   */
  public Stream<ZonedDateTime> yieldRunsBefore(String end, String interval) throws CronException {
    return yieldRunsBefore(Dates.parse(end, timezone), Intervals.parse(interval));
  }

  /**
   * Returns the run dates between two dates, both inclusive. Dates are produced in chronological
   * order when {@code start} is not after {@code end}, in reverse chronological order otherwise.
   *
   * @param start the date the search starts from
   * @param end the date the search stops at
   * @return a lazy stream of run dates
   */
  public Stream<ZonedDateTime> yieldRunsBetween(ZonedDateTime start, ZonedDateTime end) {
    ZonedDateTime from = normalize(start);
    ZonedDateTime to = normalize(end);
    if (!from.isAfter(to)) {
      return runs(from, false, to);
    }
    return runs(from, true, to);
  }

  /**
   * Returns the run dates between two date strings.
   *
   * @param start the date the search starts from, see {@link Dates#parse(String, ZoneId)}
   * @param end the date the search stops at
   * @return a lazy stream of run dates
   * @throws CronException if a date is invalid
   * @see #yieldRunsBetween(ZonedDateTime, ZonedDateTime)
   */
  public Stream<ZonedDateTime> yieldRunsBetween(String start, String end) throws CronException {
    return yieldRunsBetween(Dates.parse(start, timezone), Dates.parse(end, timezone));
  }

  private Stream<ZonedDateTime> runsAfter(ZonedDateTime start, ZonedDateTime end)
      throws CronException {
    if (end.isBefore(start)) {
      throw CronException.syntax(
          "The end date " + end + " must be after the start date " + start);
    }
    return runs(start, false, end);
  }

  private Stream<ZonedDateTime> runsBefore(ZonedDateTime end, ZonedDateTime start)
      throws CronException {
    if (end.isBefore(start)) {
      throw CronException.syntax(
          "The start date " + start + " must be before the end date " + end);
    }
    return runs(end, true, start);
  }

  /**
   * Returns the lazy stream of run dates from a date. The first search honours the start date
   * presence; the following ones start one step past the previous run date.
   *
   * @param from the normalized date the search starts from
   * @param backward the search direction
   * @param limit the last date a run may fall on, or null for an unbounded stream
   */
  private Stream<ZonedDateTime> runs(ZonedDateTime from, boolean backward, ZonedDateTime limit) {
    Iterator<ZonedDateTime> iterator =
        new Iterator<>() {
          private ZonedDateTime current = from;
          private StartDatePresence presence = startDatePresence;
          private ZonedDateTime next = null;
          private boolean done = false;

          @Override
          public boolean hasNext() {
            if (next != null) {
              return true;
            }
            if (done) {
              return false;
            }
            try {
              next = nextRun(current, presence, backward, limit);
            } catch (CronException e) {
              done = true;
              throw new UncheckedCronException(e);
            }
            if (next == null) {
              done = true;
              return false;
            }
            current = step(next, backward);
            presence = StartDatePresence.INCLUDED;
            return true;
          }

          @Override
          public ZonedDateTime next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            ZonedDateTime result = next;
            next = null;
            return result;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Searches the closest run date from a normalized date.
   *
   * @param date the date the search starts from
   * @param presence whether the date itself may be returned
   * @param backward the search direction
   * @param limit the candidate is abandoned once past this date, or null for no limit
   * @return the run date, or null if the search went past the limit
   * @throws CronException if the iteration budget is exhausted
   */
  private ZonedDateTime nextRun(
      ZonedDateTime date, StartDatePresence presence, boolean backward, ZonedDateTime limit)
      throws CronException {
    if (dayOfMonthOnly != null) {
      return unionRun(date, presence, backward, limit);
    }

    ZonedDateTime candidate = date;
    for (int i = 0; i < maxIterations; i++) {
      if (limit != null && (backward ? candidate.isBefore(limit) : candidate.isAfter(limit))) {
        return null;
      }

      FieldSpec unsatisfied = firstUnsatisfied(candidate);
      if (unsatisfied == null) {
        if (presence == StartDatePresence.INCLUDED || !candidate.isEqual(date)) {
          return candidate;
        }
        unsatisfied = expression.minute();
      }
      candidate = backward ? unsatisfied.decrement(candidate) : unsatisfied.increment(candidate);
    }

    logger.debug(
        "No run date for `{}` from {} within {} iterations", expression, date, maxIterations);
    throw CronException.unableToProcessRun(maxIterations);
  }

  /** Merges the day-of-month-only and day-of-week-only searches, keeping the closest result. */
  private ZonedDateTime unionRun(
      ZonedDateTime date, StartDatePresence presence, boolean backward, ZonedDateTime limit)
      throws CronException {
    ZonedDateTime byDayOfMonth = null;
    CronException failure = null;
    try {
      byDayOfMonth = dayOfMonthOnly.nextRun(date, presence, backward, limit);
    } catch (CronException e) {
      logger.debug("Day of month search failed for `{}` from {}", expression, date);
      failure = e;
    }

    ZonedDateTime byDayOfWeek;
    try {
      byDayOfWeek = dayOfWeekOnly.nextRun(date, presence, backward, limit);
    } catch (CronException e) {
      if (failure != null) {
        e.addSuppressed(failure);
        throw e;
      }
      logger.debug("Day of week search failed for `{}` from {}", expression, date);
      return byDayOfMonth;
    }

    if (byDayOfMonth == null) {
      return byDayOfWeek;
    }
    if (byDayOfWeek == null) {
      return byDayOfMonth;
    }
    if (backward) {
      return byDayOfMonth.isAfter(byDayOfWeek) ? byDayOfMonth : byDayOfWeek;
    }
    return byDayOfMonth.isBefore(byDayOfWeek) ? byDayOfMonth : byDayOfWeek;
  }

  private FieldSpec firstUnsatisfied(ZonedDateTime candidate) {
    for (FieldSpec spec : constrainedFields) {
      if (!spec.isSatisfiedBy(candidate)) {
        return spec;
      }
    }
    return null;
  }

  private ZonedDateTime step(ZonedDateTime run, boolean backward) {
    return backward ? expression.minute().decrement(run) : expression.minute().increment(run);
  }

  private ZonedDateTime normalize(ZonedDateTime date) {
    return date.withZoneSameInstant(timezone).truncatedTo(ChronoUnit.MINUTES);
  }

  private static ZonedDateTime plus(ZonedDateTime date, TemporalAmount interval)
      throws CronException {
    try {
      return date.plus(interval);
    } catch (DateTimeException | ArithmeticException e) {
      throw CronException.syntax("`" + interval + "` is not a valid interval", e);
    }
  }

  private static ZonedDateTime minus(ZonedDateTime date, TemporalAmount interval)
      throws CronException {
    try {
      return date.minus(interval);
    } catch (DateTimeException | ArithmeticException e) {
      throw CronException.syntax("`" + interval + "` is not a valid interval", e);
    }
  }

  private static void checkCount(int count) throws CronException {
    if (count < 0) {
      throw CronException.syntax("The number of runs must be positive or zero, got " + count);
    }
  }

  private static ZoneId zone(String timezone) throws CronException {
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw CronException.syntax("`" + timezone + "` is not a valid timezone", e);
    }
  }

  @Override
  public String toString() {
    return "Scheduler{expression="
        + expression
        + ", timezone="
        + timezone
        + ", startDatePresence="
        + startDatePresence
        + "}";
  }
}
