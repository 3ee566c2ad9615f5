package io.intellixity.relata.persistence.error;

/**
 * The backend failed to run a rendered statement.
 * <p>
 * The message is deliberately generic; driver detail stays in {@link #getCause()} and the logs.
 */
public final class BackendExecutionException extends RelataException {
  public static final String MESSAGE = "Query execution failed";

  public BackendExecutionException(Throwable cause) {
    super(MESSAGE, cause);
  }

  @Override
  public boolean clientError() { return false; }
}
