package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.error.MalformedFilterException;

import java.util.Objects;

/**
 * One summary value requested alongside the detail rows.
 * <p>
 * {@code field} may be {@code *} only for {@link AggregateFunction#COUNT}. When no alias is given
 * the alias defaults to {@code count} for {@code count(*)}, else {@code <function>_<field>}.
 */
public record AggregationOp(FieldRef field, AggregateFunction function, String alias) {
  public AggregationOp {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(function, "function");
    if (field.isAll() && function != AggregateFunction.COUNT) {
      throw new MalformedFilterException(function.tag() + " requires a concrete field, not '*'");
    }
    if (alias == null || alias.isBlank()) alias = defaultAlias(field, function);
  }

  public static AggregationOp of(String entity, String field, AggregateFunction function) {
    return new AggregationOp(FieldRef.of(entity, field), function, null);
  }

  public static AggregationOp countAll() {
    return new AggregationOp(FieldRef.root(FieldRef.ALL), AggregateFunction.COUNT, null);
  }

  public boolean isCountAll() { return field.isAll(); }

  static String defaultAlias(FieldRef field, AggregateFunction function) {
    if (field.isAll()) return function.tag();
    return function.tag() + "_" + field.field().replaceAll("[^A-Za-z0-9_]", "_");
  }
}
