package io.intellixity.relata.persistence.query;

/** Node of a filter tree: a {@link Condition}, a {@link LogicalGroup} or a {@link NotElement}. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
