package io.intellixity.relata.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String entity, String field, Object value) { return cond(entity, field, Operator.EQ, value); }
  public static Condition ne(String entity, String field, Object value) { return cond(entity, field, Operator.NE, value); }
  public static Condition gt(String entity, String field, Object value) { return cond(entity, field, Operator.GT, value); }
  public static Condition gte(String entity, String field, Object value) { return cond(entity, field, Operator.GTE, value); }
  public static Condition lt(String entity, String field, Object value) { return cond(entity, field, Operator.LT, value); }
  public static Condition lte(String entity, String field, Object value) { return cond(entity, field, Operator.LTE, value); }

  public static Condition in(String entity, String field, Collection<?> values) { return cond(entity, field, Operator.IN, values); }
  public static Condition nin(String entity, String field, Collection<?> values) { return cond(entity, field, Operator.NIN, values); }

  public static Condition between(String entity, String field, Object lower, Object upper) {
    return Condition.between(FieldRef.of(entity, field), lower, upper);
  }

  public static Condition contains(String entity, String field, String text) { return cond(entity, field, Operator.CONTAINS, text); }
  public static Condition startsWith(String entity, String field, String text) { return cond(entity, field, Operator.STARTS_WITH, text); }
  public static Condition endsWith(String entity, String field, String text) { return cond(entity, field, Operator.ENDS_WITH, text); }

  /** Raw pattern; syntax is backend specific. */
  public static Condition regex(String entity, String field, String pattern) { return cond(entity, field, Operator.REGEX, pattern); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }

  private static Condition cond(String entity, String field, Operator op, Object value) {
    return Condition.of(FieldRef.of(entity, field), op, value);
  }
}
