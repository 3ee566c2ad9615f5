package io.intellixity.relata.persistence.mongo;

import io.intellixity.relata.persistence.plan.JoinEdge;
import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import org.bson.Document;

import java.util.*;

/**
 * Mongo dialect: renders a plan as an aggregation pipeline over the root collection.
 * <p>
 * Each join hop becomes {@code $lookup}, then {@code $addFields} collapsing the joined array to
 * its first match, then {@code $match} dropping documents without a match (inner-join semantics).
 */
public final class MongoDialect implements Dialect<MongoStatement> {
  @Override public String id() { return "mongo"; }

  @Override
  public MongoStatement renderSelect(QueryPlan plan, QueryElement filter) {
    List<Document> pipeline = joinStages(plan);
    addMatch(pipeline, plan, filter);
    return new MongoStatement(plan.rootEntity(), pipeline);
  }

  @Override
  public MongoStatement renderAggregate(QueryPlan plan, QueryElement filter, List<AggregationOp> aggregations) {
    if (aggregations == null || aggregations.isEmpty()) {
      throw new IllegalArgumentException("renderAggregate requires at least one aggregation");
    }
    List<Document> pipeline = joinStages(plan);
    addMatch(pipeline, plan, filter);

    Document group = new Document("_id", null);
    for (AggregationOp op : aggregations) group.append(op.alias(), accumulator(plan, op));
    pipeline.add(new Document("$group", group));
    pipeline.add(new Document("$project", new Document("_id", 0)));
    return new MongoStatement(plan.rootEntity(), pipeline);
  }

  /** Filter for a batched reference lookup on {@code idField}. */
  public Document lookupFilter(String idField, Collection<?> ids) {
    if (ids == null || ids.isEmpty()) throw new IllegalArgumentException("lookupFilter requires ids");
    return new Document(idField, new Document("$in", MongoValueCoercion.idCandidates(ids)));
  }

  // ---- helpers ----

  private static List<Document> joinStages(QueryPlan plan) {
    List<Document> out = new ArrayList<>();
    String root = plan.rootEntity();
    for (JoinEdge e : plan.joins()) {
      String local = e.from().equals(root) ? e.localField() : e.from() + "." + e.localField();
      out.add(new Document("$lookup", new Document("from", e.to())
          .append("localField", local)
          .append("foreignField", e.foreignField())
          .append("as", e.to())));
      out.add(new Document("$addFields", new Document(e.to(),
          new Document("$arrayElemAt", List.of("$" + e.to(), 0)))));
      out.add(new Document("$match", new Document(e.to(), new Document("$exists", true))));
    }
    return out;
  }

  private static void addMatch(List<Document> pipeline, QueryPlan plan, QueryElement filter) {
    Document match = MongoQueryRenderer.toBson(plan.rootEntity(), filter);
    if (!match.isEmpty()) pipeline.add(new Document("$match", match));
  }

  private static Document accumulator(QueryPlan plan, AggregationOp op) {
    if (op.isCountAll()) return new Document("$sum", 1);
    String ref = "$" + MongoQueryRenderer.path(plan.rootEntity(), op.field());
    return switch (op.function()) {
      case SUM -> new Document("$sum", ref);
      case AVG -> new Document("$avg", ref);
      case MIN -> new Document("$min", ref);
      case MAX -> new Document("$max", ref);
      // non-null values only; a missing field counts as null
      case COUNT -> new Document("$sum", new Document("$cond", Arrays.asList(
          new Document("$eq", Arrays.asList(new Document("$ifNull", Arrays.asList(ref, null)), null)), 0, 1)));
    };
  }
}
