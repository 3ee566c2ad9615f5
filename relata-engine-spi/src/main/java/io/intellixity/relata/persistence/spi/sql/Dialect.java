package io.intellixity.relata.persistence.spi.sql;

import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.QueryElement;

import java.util.List;

/** Translates a planned request into backend-native statements. Implementations are stateless. */
public interface Dialect<S extends NativeStatement> {
  String id();

  /** Detail rows: every root row matching {@code filter}, joined along {@code plan.joins()}. */
  S renderSelect(QueryPlan plan, QueryElement filter);

  /** One summary row holding every aggregation over the same join chain and filter. */
  S renderAggregate(QueryPlan plan, QueryElement filter, List<AggregationOp> aggregations);
}
