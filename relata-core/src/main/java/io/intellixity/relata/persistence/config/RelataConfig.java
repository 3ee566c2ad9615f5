package io.intellixity.relata.persistence.config;

import io.intellixity.relata.persistence.enhance.ReferenceDef;
import io.intellixity.relata.persistence.enhance.ResultEnhancer;
import io.intellixity.relata.persistence.graph.Relation;
import io.intellixity.relata.persistence.graph.RelationGraph;
import io.intellixity.relata.persistence.plan.JoinPlanner;
import io.intellixity.relata.persistence.plan.RootResolver;
import io.intellixity.relata.persistence.plan.UnreachablePolicy;

import java.util.List;

/**
 * Process-wide, read-only relation and enhancement configuration.
 *
 * @param hub         entity preferred as root when a request names none (may be null)
 * @param unreachable planner behaviour for unreachable entities, default {@link UnreachablePolicy#FAIL}
 */
public record RelataConfig(String hub, List<Relation> relations, List<ReferenceDef> references,
                           UnreachablePolicy unreachable) {
  public RelataConfig {
    relations = List.copyOf(relations == null ? List.of() : relations);
    references = List.copyOf(references == null ? List.of() : references);
    if (unreachable == null) unreachable = UnreachablePolicy.FAIL;
    if (hub != null && hub.isBlank()) hub = null;
  }

  public RelationGraph relationGraph() { return new RelationGraph(relations); }

  public JoinPlanner joinPlanner() { return new JoinPlanner(relationGraph(), unreachable); }

  public RootResolver rootResolver() { return new RootResolver(hub); }

  public ResultEnhancer resultEnhancer() { return new ResultEnhancer(references); }
}
