package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.*;

/**
 * A declarative data request: an optional root entity hint, an optional filter tree and zero or
 * more aggregation operations.
 */
@JsonDeserialize(using = QueryRequestJsonDeserializer.class)
public final class QueryRequest {
  private String root;
  private QueryElement filter;
  private List<AggregationOp> aggregations = new ArrayList<>();

  public QueryRequest() {}

  /** Explicit root entity, or null to let the engine infer it. */
  public String root() { return root; }
  public QueryElement filter() { return filter; }
  public List<AggregationOp> aggregations() { return aggregations; }
  public boolean hasAggregations() { return !aggregations.isEmpty(); }

  public QueryRequest withRoot(String root) { this.root = (root == null || root.isBlank()) ? null : root; return this; }
  public QueryRequest withFilter(QueryElement filter) { this.filter = filter; return this; }
  public QueryRequest withAggregations(List<AggregationOp> aggregations) {
    this.aggregations = new ArrayList<>(aggregations == null ? List.of() : aggregations);
    return this;
  }
  public QueryRequest withAggregation(AggregationOp op) { this.aggregations.add(Objects.requireNonNull(op, "op")); return this; }

  public static QueryRequest on(String root) {
    return new QueryRequest().withRoot(root);
  }

  public static QueryRequest of(QueryElement filter) {
    return new QueryRequest().withFilter(filter);
  }

  @Override
  public String toString() {
    return "QueryRequest{root=" + root + ", filter=" + filter + ", aggregations=" + aggregations + "}";
  }
}
