package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;

import java.util.List;

/**
 * A planned and rendered request, ready to run.
 *
 * @param aggregate null when the request has no aggregations
 */
public record PreparedQuery<S extends NativeStatement>(QueryPlan plan,
                                                       QueryElement filter,
                                                       List<AggregationOp> aggregations,
                                                       S detail,
                                                       S aggregate) {
  public PreparedQuery {
    aggregations = List.copyOf(aggregations == null ? List.of() : aggregations);
  }

  public boolean hasAggregate() { return aggregate != null; }
}
