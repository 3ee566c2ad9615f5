package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.enhance.ReferenceLookup;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;

import java.util.List;
import java.util.Map;

/**
 * Backend connection or session scoped to one request.
 * <p>
 * Opened from the caller's handle, used for the detail statement, the aggregate statement and
 * reference lookups, then closed. Never shared between requests.
 */
public interface QuerySession<S extends NativeStatement> extends ReferenceLookup, AutoCloseable {
  List<Map<String, Object>> select(S statement);

  /** Exactly one row keyed by aggregation alias, even when nothing matched. */
  Map<String, Object> aggregate(S statement, List<AggregationOp> aggregations);

  List<String> entities();

  List<FieldDescriptor> fields(String entity);

  @Override
  void close();
}
