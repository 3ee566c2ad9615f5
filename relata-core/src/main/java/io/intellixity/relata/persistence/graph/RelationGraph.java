package io.intellixity.relata.persistence.graph;

import java.util.*;

/**
 * Immutable, ordered set of relations with an adjacency index.
 * <p>
 * Neighbours of an entity are listed in relation declaration order, which makes path search
 * deterministic. Instances are safe to share between threads.
 */
public final class RelationGraph {
  private final List<Relation> relations;
  private final Map<String, List<Relation>> adjacency;

  public RelationGraph(List<Relation> relations) {
    this.relations = List.copyOf(relations == null ? List.of() : relations);
    Map<String, List<Relation>> adj = new LinkedHashMap<>();
    for (Relation r : this.relations) {
      adj.computeIfAbsent(r.from(), k -> new ArrayList<>()).add(r);
      adj.computeIfAbsent(r.to(), k -> new ArrayList<>()).add(r);
    }
    Map<String, List<Relation>> frozen = new LinkedHashMap<>();
    adj.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
    this.adjacency = Collections.unmodifiableMap(frozen);
  }

  public static RelationGraph of(Relation... relations) {
    return new RelationGraph(List.of(relations));
  }

  public static RelationGraph empty() { return new RelationGraph(List.of()); }

  public List<Relation> relations() { return relations; }

  /** Entities in first-mention order. */
  public Set<String> entities() { return adjacency.keySet(); }

  public boolean contains(String entity) { return adjacency.containsKey(entity); }

  /** Relations touching {@code entity}, in declaration order. */
  public List<Relation> relationsOf(String entity) {
    return adjacency.getOrDefault(entity, List.of());
  }

  /** Distinct neighbours of {@code entity}, in declaration order. */
  public List<String> neighbors(String entity) {
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (Relation r : relationsOf(entity)) out.add(r.other(entity));
    return List.copyOf(out);
  }

  /** First declared relation between {@code a} and {@code b}, in either direction. */
  public Optional<Relation> relationBetween(String a, String b) {
    for (Relation r : relationsOf(a)) {
      if (r.connects(a, b)) return Optional.of(r);
    }
    return Optional.empty();
  }

  @Override
  public String toString() { return "RelationGraph" + relations; }
}
