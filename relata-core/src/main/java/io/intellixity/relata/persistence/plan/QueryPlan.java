package io.intellixity.relata.persistence.plan;

import java.util.List;
import java.util.Objects;

/**
 * Root entity, join chain and projection for one request.
 *
 * @param projection {@code <root>.*} followed by {@code <entity>.<field>} for every field read from a
 *                   joined entity, in first-seen order
 */
public record QueryPlan(String rootEntity, List<JoinEdge> joins, List<String> projection) {
  public QueryPlan {
    Objects.requireNonNull(rootEntity, "rootEntity");
    joins = List.copyOf(joins == null ? List.of() : joins);
    projection = List.copyOf(projection == null ? List.of() : projection);
  }

  public boolean hasJoins() { return !joins.isEmpty(); }

  /** Entities reachable in this plan: the root and every join target. */
  public boolean covers(String entity) {
    if (rootEntity.equals(entity)) return true;
    for (JoinEdge e : joins) if (e.to().equals(entity)) return true;
    return false;
  }
}
