package io.intellixity.relata.persistence.error;

public final class UnsupportedOperatorException extends RelataException {
  private final String operator;

  public UnsupportedOperatorException(String operator) {
    super("Unsupported operator: " + operator);
    this.operator = operator;
  }

  public UnsupportedOperatorException(String operator, String detail) {
    super("Unsupported operator: " + operator + " (" + detail + ")");
    this.operator = operator;
  }

  public String operator() { return operator; }

  @Override
  public boolean clientError() { return true; }
}
