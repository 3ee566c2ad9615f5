package io.intellixity.relata.persistence.error;

/**
 * Base of all query planning and execution failures.
 * <p>
 * {@link #clientError()} tells a surrounding transport whether the request itself was at fault
 * (bad path, operator or value shape) or the backend failed.
 */
public abstract class RelataException extends RuntimeException {
  protected RelataException(String message) {
    super(message);
  }

  protected RelataException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract boolean clientError();
}
