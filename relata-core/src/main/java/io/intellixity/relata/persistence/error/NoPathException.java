package io.intellixity.relata.persistence.error;

/** No chain of relations connects two entities. */
public final class NoPathException extends RelataException {
  private final String from;
  private final String to;

  public NoPathException(String from, String to) {
    super("No relation path from '" + from + "' to '" + to + "'");
    this.from = from;
    this.to = to;
  }

  public String from() { return from; }
  public String to() { return to; }

  @Override
  public boolean clientError() { return true; }
}
