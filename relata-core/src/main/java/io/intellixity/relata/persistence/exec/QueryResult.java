package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.plan.JoinEdge;
import io.intellixity.relata.persistence.query.AggregationOp;

import java.util.*;

/**
 * Outcome of one request.
 * <p>
 * {@code aggregateRows} is empty when no aggregation was requested and holds exactly one summary
 * row otherwise.
 */
public record QueryResult(String rootEntity,
                          List<JoinEdge> joins,
                          List<String> projection,
                          List<Map<String, Object>> rows,
                          List<Map<String, Object>> aggregateRows,
                          List<AggregationOp> aggregations) {
  public QueryResult {
    Objects.requireNonNull(rootEntity, "rootEntity");
    joins = List.copyOf(joins == null ? List.of() : joins);
    projection = List.copyOf(projection == null ? List.of() : projection);
    rows = Collections.unmodifiableList(new ArrayList<>(rows == null ? List.of() : rows));
    aggregateRows = Collections.unmodifiableList(new ArrayList<>(aggregateRows == null ? List.of() : aggregateRows));
    aggregations = List.copyOf(aggregations == null ? List.of() : aggregations);
  }

  /** Summary values in request order; empty when nothing was aggregated. */
  public List<AggregateValue> aggregates() {
    if (aggregateRows.isEmpty()) return List.of();
    Map<String, Object> row = aggregateRows.get(0);
    List<AggregateValue> out = new ArrayList<>(aggregations.size());
    for (AggregationOp op : aggregations) {
      out.add(new AggregateValue(op.alias(), op.function(), op.field(), row.get(op.alias())));
    }
    return out;
  }

  public Object aggregate(String alias) {
    return aggregateRows.isEmpty() ? null : aggregateRows.get(0).get(alias);
  }
}
