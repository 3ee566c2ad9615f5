package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.query.FieldRef;
import io.intellixity.relata.persistence.query.QueryRequest;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Picks the root entity of a request that does not name one.
 * <p>
 * With a hub configured: the hub when it is referenced, when any field is unqualified, when
 * several entities are referenced or when nothing is referenced; the single referenced entity
 * otherwise. Without a hub the first referenced entity wins, and every field must then name its
 * entity.
 */
public final class RootResolver {
  private final String hub;

  public RootResolver(String hub) {
    this.hub = (hub == null || hub.isBlank()) ? null : hub;
  }

  public String hub() { return hub; }

  public String resolve(QueryRequest request) {
    if (request.root() != null) return request.root();
    List<FieldRef> refs = FieldRefs.of(request.filter(), request.aggregations());
    LinkedHashSet<String> entities = FieldRefs.entities(refs, null);
    boolean unqualified = refs.stream().anyMatch(r -> r.entity() == null);

    if (hub != null) {
      if (unqualified || entities.isEmpty() || entities.contains(hub) || entities.size() > 1) return hub;
      return entities.iterator().next();
    }
    if (entities.isEmpty()) {
      throw new MalformedFilterException("root entity is required when no field names an entity");
    }
    if (unqualified) {
      throw new MalformedFilterException("root entity is required when unqualified fields are mixed with " + entities);
    }
    return entities.iterator().next();
  }
}
