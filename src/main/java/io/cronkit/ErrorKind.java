package io.cronkit;

/** The type of error raised while parsing an expression or computing run dates. */
public enum ErrorKind {
  /** Malformed input: expression, field, alias, timezone, date, duration or argument. */
  SYNTAX("syntax"),
  /** A value used as a search bound lies outside the supported domain. */
  RANGE("range"),
  /** The search exhausted its iteration budget without finding a matching date. */
  UNABLE_TO_PROCESS_RUN("unable_to_process_run");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
