package io.cronkit.time;

import java.time.Duration;
import java.time.Period;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;
import java.time.temporal.TemporalUnit;
import java.time.temporal.UnsupportedTemporalTypeException;
import java.util.List;

/**
 * An amount of time made of a calendar part (years, months, days) and a clock part (hours,
 * minutes). The calendar part is applied first.
 *
 * @param period the calendar part
 * @param duration the clock part
 */
public record Interval(Period period, Duration duration) implements TemporalAmount {
  private static final List<TemporalUnit> UNITS =
      List.of(ChronoUnit.YEARS, ChronoUnit.MONTHS, ChronoUnit.DAYS, ChronoUnit.SECONDS);

  /** The empty interval. */
  public static final Interval ZERO = new Interval(Period.ZERO, Duration.ZERO);

  /**
   * Tells whether applying the interval moves a date backward.
   *
   * @return true if any part is negative
   */
  public boolean isNegative() {
    return period.isNegative() || duration.isNegative();
  }

  @Override
  public long get(TemporalUnit unit) {
    if (unit == ChronoUnit.SECONDS) {
      return duration.getSeconds();
    }
    if (unit == ChronoUnit.YEARS || unit == ChronoUnit.MONTHS || unit == ChronoUnit.DAYS) {
      return period.get(unit);
    }
    throw new UnsupportedTemporalTypeException("Unsupported unit: " + unit);
  }

  @Override
  public List<TemporalUnit> getUnits() {
    return UNITS;
  }

  @Override
  public Temporal addTo(Temporal temporal) {
    return duration.addTo(period.addTo(temporal));
  }

  @Override
  public Temporal subtractFrom(Temporal temporal) {
    return duration.subtractFrom(period.subtractFrom(temporal));
  }

  @Override
  public String toString() {
    if (duration.isZero()) {
      return period.toString();
    }
    if (period.isZero()) {
      return duration.toString();
    }
    return period + duration.toString().substring(1);
  }
}
