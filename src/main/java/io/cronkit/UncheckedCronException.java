package io.cronkit;

/**
 * Wraps a {@link CronException} raised while a lazily computed stream of run dates is being
 * consumed.
 */
public final class UncheckedCronException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new unchecked wrapper.
   *
   * @param cause the underlying exception
   */
  public UncheckedCronException(CronException cause) {
    super(cause.getMessage(), cause);
  }

  @Override
  public synchronized CronException getCause() {
    return (CronException) super.getCause();
  }
}
