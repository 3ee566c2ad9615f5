package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.QueryElement;

import java.util.List;

/**
 * Hook run after root resolution and before planning.
 * <p>
 * Applications may plug in stricter rules (identifier whitelists, per-tenant restrictions).
 */
public interface RequestValidationStrategy {
  void validate(String root, QueryElement filter, List<AggregationOp> aggregations);
}
