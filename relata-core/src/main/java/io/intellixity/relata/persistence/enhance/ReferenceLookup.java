package io.intellixity.relata.persistence.enhance;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Batched fetch of referenced records, bound to one request's connection or session. */
@FunctionalInterface
public interface ReferenceLookup {
  /**
   * Records of {@code entity} whose {@code idField} is one of {@code ids}.
   * Missing ids are simply absent from the result.
   */
  List<Map<String, Object>> findByIds(String entity, String idField, Collection<Object> ids);
}
