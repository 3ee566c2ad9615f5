package io.intellixity.relata.persistence.plan;

import io.intellixity.relata.persistence.query.*;

import java.util.*;

/** Collects the field references of a filter tree and aggregation list, in traversal order. */
public final class FieldRefs implements QueryVisitor<Void> {
  private final List<FieldRef> out = new ArrayList<>();

  private FieldRefs() {}

  public static List<FieldRef> of(QueryElement filter, List<AggregationOp> aggregations) {
    FieldRefs v = new FieldRefs();
    if (filter != null) filter.accept(v);
    if (aggregations != null) {
      for (AggregationOp op : aggregations) {
        if (!op.isCountAll()) v.out.add(op.field());
      }
    }
    return List.copyOf(v.out);
  }

  /** Distinct entities referenced, with unqualified references bound to {@code root}. */
  public static LinkedHashSet<String> entities(List<FieldRef> refs, String root) {
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (FieldRef r : refs) {
      String e = r.entityOr(root);
      if (e != null) out.add(e);
    }
    return out;
  }

  @Override
  public Void visit(Condition condition) {
    out.add(condition.field());
    return null;
  }

  @Override
  public Void visit(LogicalGroup group) {
    for (QueryElement e : group.elements()) e.accept(this);
    return null;
  }

  @Override
  public Void visit(NotElement not) {
    return not.element().accept(this);
  }
}
