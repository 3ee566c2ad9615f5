package io.intellixity.relata.persistence.plan;

/** What the planner does with a reference to an entity it cannot reach from the root. */
public enum UnreachablePolicy {
  /** Throw {@link io.intellixity.relata.persistence.error.NoPathException}. */
  FAIL,
  /** Leave the entity out of the join chain; any predicate on it then fails at execution. */
  SKIP
}
