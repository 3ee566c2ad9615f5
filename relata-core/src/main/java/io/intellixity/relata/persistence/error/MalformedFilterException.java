package io.intellixity.relata.persistence.error;

/** Filter or aggregation value has the wrong shape for its operator. */
public final class MalformedFilterException extends RelataException {
  private final String reason;

  public MalformedFilterException(String reason) {
    super("Malformed filter: " + reason);
    this.reason = reason;
  }

  public String reason() { return reason; }

  @Override
  public boolean clientError() { return true; }
}
