package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.spi.sql.FilterValues;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Backend-agnostic shape validation.
 * <p>
 * Checks value shapes per operator kind and that aggregation aliases are unique, plain identifiers.
 * Shape errors raise {@link MalformedFilterException}.
 */
public final class DefaultRequestValidationStrategy implements RequestValidationStrategy {
  private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  @Override
  public void validate(String root, QueryElement filter, List<AggregationOp> aggregations) {
    if (root == null || root.isBlank()) throw new MalformedFilterException("root entity must be non-blank");
    validateElement(filter);
    validateAggregations(aggregations);
  }

  private static void validateElement(QueryElement el) {
    if (el == null) return;
    if (el instanceof NotElement n) {
      validateElement(n.element());
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(c);
      return;
    }
    if (el instanceof Condition c) {
      validateCondition(c);
      return;
    }
    throw new MalformedFilterException("unsupported filter element: " + el.getClass().getName());
  }

  private static void validateCondition(Condition c) {
    switch (c.operator().kind()) {
      case COMPARISON -> {
        if (c.operator() == Operator.EQ || c.operator() == Operator.NE) FilterValues.scalarOrNull(c);
        else FilterValues.requireScalar(c);
      }
      case MEMBERSHIP -> FilterValues.members(c);
      case RANGE -> FilterValues.requireBounds(c);
      case PATTERN -> FilterValues.requireText(c);
    }
  }

  private static void validateAggregations(List<AggregationOp> aggregations) {
    if (aggregations == null) return;
    Set<String> aliases = new HashSet<>();
    for (AggregationOp op : aggregations) {
      if (!ALIAS.matcher(op.alias()).matches()) {
        throw new MalformedFilterException("aggregation alias '" + op.alias() + "' must be a plain identifier");
      }
      if (!aliases.add(op.alias())) {
        throw new MalformedFilterException("duplicate aggregation alias '" + op.alias() + "'");
      }
    }
  }
}
