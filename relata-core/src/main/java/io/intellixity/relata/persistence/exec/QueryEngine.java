package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.exec.handle.EngineHandle;
import io.intellixity.relata.persistence.query.QueryRequest;

import java.util.List;

/**
 * Plans, translates and runs declarative requests against one backend family.
 * <p>
 * Implementations hold only immutable configuration; the connection or client arrives with each
 * call and nothing is cached between calls.
 */
public interface QueryEngine<H extends EngineHandle<?>> {
  /** Backend family id, e.g. {@code jdbc} or {@code mongo}. */
  String family();

  QueryResult execute(H handle, QueryRequest request);

  /** Tables or collections visible through the handle, sorted by name. */
  List<String> entities(H handle);

  /** Attributes of one entity in storage order; empty when the entity is unknown. */
  List<FieldDescriptor> fields(H handle, String entity);
}
