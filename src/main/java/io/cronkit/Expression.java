package io.cronkit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cronkit.field.FieldKind;
import io.cronkit.field.FieldSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable five-field CRON expression: minute, hour, day of month, month and day of week.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Expression expression = Expression.parse("30 9 * * MON-FRI");
 * Expression weekends = expression.withDayOfWeek("SAT,SUN");
 * System.out.println(weekends); // 30 9 * * SAT,SUN
 * }</pre>
 *
 * <p>Fields keep their text as given: {@code Expression.parse(s).toString()} returns {@code s}
 * for any space-separated five-field string.
 */
public final class Expression {
  private final Map<FieldKind, FieldSpec> fields;

  private Expression(Map<FieldKind, FieldSpec> fields) {
    this.fields = Collections.unmodifiableMap(new EnumMap<>(fields));
  }

  /**
   * Parses a CRON expression or an alias of the shared {@link AliasRegistry}.
   *
   * @param text the expression, e.g. {@code 0 0 * * MON} or {@code @daily}
   * @return the parsed expression
   * @throws CronException if the expression is invalid
   */
  @JsonCreator
  public static Expression parse(String text) throws CronException {
    return parse(text, AliasRegistry.shared());
  }

  /**
   * Parses a CRON expression, resolving aliases against the given registry.
   *
   * <p>Every field is validated; when several fields are invalid the error lists all of them.
   *
   * @param text the expression or alias
   * @param aliases the registry aliases are resolved against
   * @return the parsed expression
   * @throws CronException if the expression is invalid
   */
  public static Expression parse(String text, AliasRegistry aliases) throws CronException {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(aliases, "aliases");

    String resolved = aliases.resolve(text.trim()).orElse(text);
    String[] tokens = resolved.trim().split("\\s+");
    if (resolved.isBlank() || tokens.length != FieldKind.values().length) {
      throw CronException.invalidExpression(text);
    }

    Map<FieldKind, FieldSpec> fields = new EnumMap<>(FieldKind.class);
    Map<String, String> errors = new LinkedHashMap<>();
    List<Span> spans = new ArrayList<>();
    int offset = 0;
    for (int i = 0; i < tokens.length; i++) {
      FieldKind kind = FieldKind.values()[i];
      String token = tokens[i];
      int start = resolved.indexOf(token, offset);
      offset = start + token.length();
      try {
        fields.put(kind, FieldSpec.of(kind, token));
      } catch (CronException e) {
        errors.put(kind.fieldName(), token);
        spans.add(new Span(start, offset));
      }
    }

    if (!errors.isEmpty()) {
      throw CronException.invalidFields(errors, spans, resolved);
    }
    return new Expression(fields);
  }

  /**
   * Validates an expression without throwing.
   *
   * @param text the expression or alias
   * @return true if the expression is valid
   */
  public static boolean isValid(String text) {
    try {
      parse(text);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Builds an expression from field expressions keyed by field name ({@code minute}, {@code
   * hour}, {@code dayOfMonth}, {@code month}, {@code dayOfWeek}). Missing fields default to
   * {@code *}.
   *
   * @param fields the field expressions
   * @return the expression
   * @throws CronException if a name is unknown or a field is invalid
   */
  public static Expression fromFields(Map<String, String> fields) throws CronException {
    return parse(build(fields), AliasRegistry.create());
  }

  /**
   * Joins field expressions keyed by field name into an expression string, without validating
   * the field values. Missing fields default to {@code *}.
   *
   * @param fields the field expressions
   * @return the five-field expression string
   * @throws CronException if a field name is unknown
   */
  public static String build(Map<String, String> fields) throws CronException {
    Map<FieldKind, String> values = new EnumMap<>(FieldKind.class);
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      String name = entry.getKey();
      FieldKind kind =
          FieldKind.fromName(name)
              .orElseThrow(
                  () -> CronException.syntax("`" + name + "` is not a valid CRON expression field"));
      values.put(kind, entry.getValue());
    }

    List<String> parts = new ArrayList<>();
    for (FieldKind kind : FieldKind.values()) {
      parts.add(values.getOrDefault(kind, "*"));
    }
    return String.join(" ", parts);
  }

  /** Returns the {@code @yearly} expression. */
  public static Expression yearly() {
    return builtIn("@yearly");
  }

  /** Returns the {@code @monthly} expression. */
  public static Expression monthly() {
    return builtIn("@monthly");
  }

  /** Returns the {@code @weekly} expression. */
  public static Expression weekly() {
    return builtIn("@weekly");
  }

  /** Returns the {@code @daily} expression. */
  public static Expression daily() {
    return builtIn("@daily");
  }

  /** Returns the {@code @hourly} expression. */
  public static Expression hourly() {
    return builtIn("@hourly");
  }

  private static Expression builtIn(String alias) {
    try {
      return parse(alias, AliasRegistry.create());
    } catch (CronException e) {
      throw new IllegalStateException("Built-in alias " + alias + " does not parse", e);
    }
  }

  /**
   * Returns the field expressions in positional order.
   *
   * @return the fields
   */
  public Map<FieldKind, FieldSpec> fields() {
    return fields;
  }

  /**
   * Returns the expression of one field.
   *
   * @param kind the field
   * @return the field expression
   */
  public FieldSpec field(FieldKind kind) {
    return fields.get(kind);
  }

  public FieldSpec minute() {
    return field(FieldKind.MINUTE);
  }

  public FieldSpec hour() {
    return field(FieldKind.HOUR);
  }

  public FieldSpec dayOfMonth() {
    return field(FieldKind.DAY_OF_MONTH);
  }

  public FieldSpec month() {
    return field(FieldKind.MONTH);
  }

  public FieldSpec dayOfWeek() {
    return field(FieldKind.DAY_OF_WEEK);
  }

  /**
   * Returns the field texts keyed by field name, in positional order.
   *
   * @return the fields as strings
   */
  public Map<String, String> toMap() {
    Map<String, String> m = new LinkedHashMap<>();
    for (Map.Entry<FieldKind, FieldSpec> entry : fields.entrySet()) {
      m.put(entry.getKey().fieldName(), entry.getValue().toString());
    }
    return Collections.unmodifiableMap(m);
  }

  /**
   * Returns an expression with one field replaced.
   *
   * @param kind the field to replace
   * @param text the new field expression
   * @return this expression if the text is unchanged, a new expression otherwise
   * @throws CronException if the new field expression is invalid
   */
  public Expression with(FieldKind kind, String text) throws CronException {
    if (field(kind).toString().equals(text)) {
      return this;
    }
    return with(kind, FieldSpec.of(kind, text));
  }

  Expression with(FieldKind kind, FieldSpec spec) {
    if (field(kind).equals(spec)) {
      return this;
    }
    Map<FieldKind, FieldSpec> copy = new EnumMap<>(fields);
    copy.put(kind, spec);
    return new Expression(copy);
  }

  public Expression withMinute(String text) throws CronException {
    return with(FieldKind.MINUTE, text);
  }

  public Expression withHour(String text) throws CronException {
    return with(FieldKind.HOUR, text);
  }

  public Expression withDayOfMonth(String text) throws CronException {
    return with(FieldKind.DAY_OF_MONTH, text);
  }

  public Expression withMonth(String text) throws CronException {
    return with(FieldKind.MONTH, text);
  }

  public Expression withDayOfWeek(String text) throws CronException {
    return with(FieldKind.DAY_OF_WEEK, text);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Expression)) {
      return false;
    }
    return fields.equals(((Expression) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  /**
   * Returns the five field expressions joined by single spaces.
   *
   * @return the expression string
   */
  @JsonValue
  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    for (FieldSpec spec : fields.values()) {
      parts.add(spec.toString());
    }
    return String.join(" ", parts);
  }
}
