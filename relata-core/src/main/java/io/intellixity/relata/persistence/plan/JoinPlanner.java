package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.error.NoPathException;
import io.intellixity.relata.persistence.graph.PathResolver;
import io.intellixity.relata.persistence.graph.Relation;
import io.intellixity.relata.persistence.graph.RelationGraph;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.FieldRef;
import io.intellixity.relata.persistence.query.QueryElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns the entities referenced by a request into a deduplicated, root-oriented join chain.
 */
public final class JoinPlanner {
  private static final Logger log = LoggerFactory.getLogger(JoinPlanner.class);

  private final RelationGraph graph;
  private final PathResolver paths;
  private final UnreachablePolicy unreachable;

  public JoinPlanner(RelationGraph graph) {
    this(graph, UnreachablePolicy.FAIL);
  }

  public JoinPlanner(RelationGraph graph, UnreachablePolicy unreachable) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.paths = new PathResolver(graph);
    this.unreachable = Objects.requireNonNull(unreachable, "unreachable");
  }

  public RelationGraph graph() { return graph; }
  public UnreachablePolicy unreachablePolicy() { return unreachable; }

  public QueryPlan plan(String root, QueryElement filter, List<AggregationOp> aggregations) {
    Objects.requireNonNull(root, "root");
    List<FieldRef> refs = FieldRefs.of(filter, aggregations);
    List<JoinEdge> joins = buildJoinPlan(root, refs);
    QueryPlan plan = new QueryPlan(root, joins, projection(root, refs, joins));
    if (log.isDebugEnabled()) {
      log.debug("relata.plan root={} joins={} projection={}", root, joins, plan.projection());
    }
    return plan;
  }

  /**
   * Join edges needed to reach every entity in {@code refs} from {@code root}.
   * Edges are oriented root-side first and listed once, in first-seen order.
   */
  public List<JoinEdge> buildJoinPlan(String root, Collection<FieldRef> refs) {
    LinkedHashSet<JoinEdge> edges = new LinkedHashSet<>();
    for (String entity : FieldRefs.entities(List.copyOf(refs), root)) {
      if (entity.equals(root)) continue;
      Optional<List<String>> path = paths.findPath(root, entity);
      if (path.isEmpty()) {
        if (unreachable == UnreachablePolicy.FAIL) throw new NoPathException(root, entity);
        log.debug("relata.plan skipping unreachable entity root={} entity={}", root, entity);
        continue;
      }
      List<String> p = path.get();
      for (int i = 0; i + 1 < p.size(); i++) {
        edges.add(orient(p.get(i), p.get(i + 1)));
      }
    }
    return List.copyOf(edges);
  }

  private JoinEdge orient(String a, String b) {
    Relation r = graph.relationBetween(a, b)
        .orElseThrow(() -> new IllegalStateException("Path step without relation: " + a + " -> " + b));
    return r.from().equals(a)
        ? new JoinEdge(a, b, r.localKey(), r.foreignKey())
        : new JoinEdge(a, b, r.foreignKey(), r.localKey());
  }

  private static List<String> projection(String root, List<FieldRef> refs, List<JoinEdge> joins) {
    LinkedHashSet<String> out = new LinkedHashSet<>();
    out.add(root + ".*");
    Set<String> joined = new HashSet<>();
    for (JoinEdge e : joins) joined.add(e.to());
    for (FieldRef r : refs) {
      String entity = r.entityOr(root);
      if (entity.equals(root) || !joined.contains(entity) || r.isAll()) continue;
      out.add(entity + "." + r.field());
    }
    return List.copyOf(out);
  }
}
