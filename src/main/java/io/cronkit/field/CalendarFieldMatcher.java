package io.cronkit.field;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * The {@link FieldMatcher} of every field kind: generic value matching driven by the field's
 * range, plus the month-relative day items, with moves delegated to the field's {@link
 * Granularity}.
 */
final class CalendarFieldMatcher implements FieldMatcher {
  private static final Map<FieldKind, CalendarFieldMatcher> MATCHERS = new EnumMap<>(FieldKind.class);

  static {
    for (FieldKind kind : FieldKind.values()) {
      MATCHERS.put(kind, new CalendarFieldMatcher(kind));
    }
  }

  private final FieldKind kind;

  private CalendarFieldMatcher(FieldKind kind) {
    this.kind = kind;
  }

  static FieldMatcher forKind(FieldKind kind) {
    return MATCHERS.get(kind);
  }

  @Override
  public boolean isSatisfiedBy(FieldSpec spec, ZonedDateTime date) {
    for (FieldItem item : spec.items()) {
      if (matches(item, date)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public ZonedDateTime increment(FieldSpec spec, ZonedDateTime date) {
    return kind.granularity().increment(date, spec.candidates());
  }

  @Override
  public ZonedDateTime decrement(FieldSpec spec, ZonedDateTime date) {
    return kind.granularity().decrement(date, spec.candidates());
  }

  private boolean matches(FieldItem item, ZonedDateTime date) {
    LocalDate day = date.toLocalDate();
    YearMonth month = YearMonth.from(day);

    return switch (item.kind()) {
      case ANY, NO_CONSTRAINT -> true;
      case VALUES -> item.values().contains(kind.extract(date));
      case LAST_DAY -> day.equals(MonthDays.lastDayOfMonth(month));
      case LAST_WEEKDAY -> day.equals(MonthDays.lastWeekdayOfMonth(month));
      case NEAREST_WEEKDAY ->
          MonthDays.nearestWeekday(month, item.day()).map(day::equals).orElse(false);
      case LAST_OF_WEEKDAY -> day.equals(MonthDays.lastWeekdayInMonth(month, item.weekday()));
      case NTH_WEEKDAY ->
          MonthDays.nthWeekdayOfMonth(month, item.weekday(), item.nth())
              .map(day::equals)
              .orElse(false);
    };
  }
}
