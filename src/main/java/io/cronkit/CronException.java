package io.cronkit;

import io.cronkit.field.FieldKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Exception thrown for errors in CRON expression parsing or run date computation. */
public final class CronException extends Exception {
  private static final long serialVersionUID = 1L;

  /** The error kind. */
  private final ErrorKind kind;

  /** Offending raw values keyed by field name, in field order. */
  private final Map<String, String> fieldErrors;

  /** The locations of the offending tokens in the input. */
  private final List<Span> spans;

  /** The original input string. */
  private final String input;

  private CronException(
      ErrorKind kind,
      String message,
      Map<String, String> fieldErrors,
      List<Span> spans,
      String input,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    this.spans = List.copyOf(spans);
    this.input = input;
  }

  /**
   * Creates a new syntax error.
   *
   * @param message the error message
   * @return a new CronException for a syntax error
   */
  public static CronException syntax(String message) {
    return new CronException(ErrorKind.SYNTAX, message, Map.of(), List.of(), null, null);
  }

  /**
   * Creates a new syntax error caused by another failure.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new CronException for a syntax error
   */
  public static CronException syntax(String message, Throwable cause) {
    return new CronException(ErrorKind.SYNTAX, message, Map.of(), List.of(), null, cause);
  }

  /**
   * Creates an error for a string that does not split into five fields.
   *
   * @param input the rejected expression
   * @return a new CronException for a syntax error
   */
  public static CronException invalidExpression(String input) {
    return new CronException(
        ErrorKind.SYNTAX,
        "`" + input + "` is not a valid CRON expression",
        Map.of(),
        List.of(),
        input,
        null);
  }

  /**
   * Creates an error for a single invalid field expression.
   *
   * @param kind the field being validated
   * @param value the offending field expression
   * @param item the list item of the field expression that failed
   * @return a new CronException for a syntax error
   */
  public static CronException invalidField(FieldKind kind, String value, String item) {
    String where = item.equals(value) ? "" : " in `" + value + "`";
    return new CronException(
        ErrorKind.SYNTAX,
        "Invalid or unsupported value `" + item + "`" + where + " for the " + kind.fieldName()
            + " field",
        Map.of(kind.fieldName(), value),
        List.of(),
        null,
        null);
  }

  /**
   * Creates an error aggregating every invalid field of an expression.
   *
   * @param fieldErrors the offending values keyed by field name
   * @param spans the locations of the offending tokens in the input
   * @param input the rejected expression
   * @return a new CronException for a syntax error
   */
  public static CronException invalidFields(
      Map<String, String> fieldErrors, List<Span> spans, String input) {
    return new CronException(
        ErrorKind.SYNTAX,
        "Invalid CRON expression value for " + String.join(", ", fieldErrors.keySet()),
        fieldErrors,
        spans,
        input,
        null);
  }

  /**
   * Creates a new range error.
   *
   * @param message the error message
   * @return a new CronException for a range error
   */
  public static CronException range(String message) {
    return new CronException(ErrorKind.RANGE, message, Map.of(), List.of(), null, null);
  }

  /**
   * Creates an error for a search that exhausted its iteration budget.
   *
   * @param maxIterations the exhausted budget
   * @return a new CronException for an unprocessable run
   */
  public static CronException unableToProcessRun(int maxIterations) {
    return new CronException(
        ErrorKind.UNABLE_TO_PROCESS_RUN,
        "Unable to compute a run date within " + maxIterations + " iterations",
        Map.of(),
        List.of(),
        null,
        null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending raw values keyed by field name ({@code minute}, {@code hour}, {@code
   * dayOfMonth}, {@code month}, {@code dayOfWeek}).
   *
   * @return the field errors, empty when the error is not about a field
   */
  public Map<String, String> fieldErrors() {
    return fieldErrors;
  }

  /**
   * Returns the locations of the offending tokens in the input.
   *
   * @return the spans, empty when not available
   */
  public List<Span> spans() {
    return spans;
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message underlining every offending token.
   *
   * <p>For field errors with spans and input, produces output like:
   *
   * <pre>
   * error: Invalid CRON expression value for minute, month
   *   90 * * 13 *
   *   ^^     ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (spans.isEmpty() || input == null) {
      return "error: " + getMessage();
    }

    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  ").append(input).append("\n");

    StringBuilder underline = new StringBuilder("  ");
    for (Span span : spans) {
      while (underline.length() < span.start() + 2) {
        underline.append(' ');
      }
      underline.append("^".repeat(span.length()));
    }
    sb.append(underline);

    return sb.toString();
  }
}
