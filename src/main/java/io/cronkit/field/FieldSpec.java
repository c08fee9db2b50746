package io.cronkit.field;

import com.fasterxml.jackson.annotation.JsonValue;
import io.cronkit.CronException;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A validated field expression. The text is kept as given, so {@link #toString()} returns the
 * exact input.
 */
public final class FieldSpec {
  private final FieldKind kind;
  private final String text;
  private final List<FieldItem> items;
  private final List<Integer> candidates;

  private FieldSpec(FieldKind kind, String text, List<FieldItem> items) {
    this.kind = kind;
    this.text = text;
    this.items = List.copyOf(items);
    this.candidates = computeCandidates(this.items);
  }

  /**
   * Validates a field expression.
   *
   * @param kind the field
   * @param text the field expression
   * @return the validated field
   * @throws CronException if the expression is invalid for the field
   */
  public static FieldSpec of(FieldKind kind, String text) throws CronException {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
    return new FieldSpec(kind, text, FieldParser.parse(kind, text));
  }

  /**
   * Returns the {@code *} expression of a field.
   *
   * @param kind the field
   * @return the wildcard field
   */
  public static FieldSpec wildcard(FieldKind kind) {
    return new FieldSpec(kind, "*", List.of(FieldItem.any()));
  }

  /**
   * Returns the field this expression belongs to.
   *
   * @return the field kind
   */
  public FieldKind kind() {
    return kind;
  }

  /**
   * Returns the parsed list items.
   *
   * @return the items, in input order
   */
  public List<FieldItem> items() {
    return items;
  }

  /**
   * Tells whether the expression imposes no constraint at all ({@code *} or {@code ?}).
   *
   * @return true if every date satisfies the expression
   */
  public boolean isUnconstrained() {
    return text.equals("*") || text.equals("?");
  }

  /**
   * Returns the sorted distinct values the field can take, used to jump between candidates.
   * Empty when any value is accepted or the items are month-relative.
   *
   * @return the candidate values
   */
  public List<Integer> candidates() {
    return candidates;
  }

  /**
   * Tells whether a date satisfies this field.
   *
   * @param date the date, minute precision
   * @return true if the date matches
   */
  public boolean isSatisfiedBy(ZonedDateTime date) {
    return kind.matcher().isSatisfiedBy(this, date);
  }

  /**
   * Moves a date to the start of the next window this field could match.
   *
   * @param date the date, minute precision
   * @return a later date
   */
  public ZonedDateTime increment(ZonedDateTime date) {
    return kind.matcher().increment(this, date);
  }

  /**
   * Moves a date to the end of the previous window this field could match.
   *
   * @param date the date, minute precision
   * @return an earlier date
   */
  public ZonedDateTime decrement(ZonedDateTime date) {
    return kind.matcher().decrement(this, date);
  }

  private static List<Integer> computeCandidates(List<FieldItem> items) {
    TreeSet<Integer> values = new TreeSet<>();
    for (FieldItem item : items) {
      if (item.kind() != FieldItem.Kind.VALUES) {
        return List.of();
      }
      values.addAll(item.values());
    }
    return List.copyOf(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldSpec)) {
      return false;
    }
    FieldSpec other = (FieldSpec) o;
    return kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @JsonValue
  @Override
  public String toString() {
    return text;
  }
}
