package io.intellixity.relata.persistence.graph;

import io.intellixity.relata.persistence.error.NoPathException;

import java.util.*;

/** Shortest entity chains over a {@link RelationGraph} (breadth-first, undirected). */
public final class PathResolver {
  private final RelationGraph graph;

  public PathResolver(RelationGraph graph) {
    this.graph = Objects.requireNonNull(graph, "graph");
  }

  public RelationGraph graph() { return graph; }

  /**
   * Shortest path from {@code start} to {@code end}, both ends included.
   * Returns {@code [start]} when both are equal and empty when no path exists.
   */
  public Optional<List<String>> findPath(String start, String end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.equals(end)) return Optional.of(List.of(start));
    if (!graph.contains(start) || !graph.contains(end)) return Optional.empty();

    Map<String, String> parent = new HashMap<>();
    Set<String> visited = new HashSet<>();
    ArrayDeque<String> queue = new ArrayDeque<>();
    visited.add(start);
    queue.add(start);

    while (!queue.isEmpty()) {
      String cur = queue.poll();
      for (String next : graph.neighbors(cur)) {
        if (!visited.add(next)) continue;
        parent.put(next, cur);
        if (next.equals(end)) return Optional.of(unwind(parent, start, end));
        queue.add(next);
      }
    }
    return Optional.empty();
  }

  public List<String> requirePath(String start, String end) {
    return findPath(start, end).orElseThrow(() -> new NoPathException(start, end));
  }

  /** Number of hops between two entities, or -1 when unreachable. */
  public int distance(String start, String end) {
    return findPath(start, end).map(p -> p.size() - 1).orElse(-1);
  }

  private static List<String> unwind(Map<String, String> parent, String start, String end) {
    LinkedList<String> path = new LinkedList<>();
    for (String at = end; at != null; at = at.equals(start) ? null : parent.get(at)) {
      path.addFirst(at);
    }
    return List.copyOf(path);
  }
}
