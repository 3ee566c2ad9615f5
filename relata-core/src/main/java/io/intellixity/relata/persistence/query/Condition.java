package io.intellixity.relata.persistence.query;

import java.util.Objects;

public final class Condition implements QueryElement {
  private final FieldRef field;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(FieldRef field, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public FieldRef field() { return field; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(field, operator, value, lower, upper, !not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(FieldRef field, Operator operator, Object value) {
    return new Condition(field, operator, value, null, null, false);
  }

  public static Condition between(FieldRef field, Object lower, Object upper) {
    return new Condition(field, Operator.BETWEEN, null, lower, upper, false);
  }

  @Override
  public String toString() {
    String body = operator == Operator.BETWEEN
        ? field + " between " + lower + " and " + upper
        : field + " " + operator.tag() + " " + value;
    return not ? "not(" + body + ")" : body;
  }
}
