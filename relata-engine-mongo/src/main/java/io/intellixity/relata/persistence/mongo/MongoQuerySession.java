package io.intellixity.relata.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoDatabase;
import io.intellixity.relata.persistence.error.BackendExecutionException;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.query.AggregateFunction;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.spi.exec.QuerySession;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/** One {@link ClientSession} serving every pipeline and lookup of a single request. */
final class MongoQuerySession implements QuerySession<MongoStatement> {
  private static final Logger log = LoggerFactory.getLogger(MongoQuerySession.class);
  static final int FIELD_SAMPLE_SIZE = 5;

  private final MongoHandle handle;
  private final MongoDialect dialect;
  private final ClientSession session;
  private final MongoDatabase db;

  private MongoQuerySession(MongoHandle handle, MongoDialect dialect, ClientSession session) {
    this.handle = handle;
    this.dialect = dialect;
    this.session = session;
    this.db = handle.client().getDatabase(handle.database());
  }

  static MongoQuerySession open(MongoHandle handle, MongoDialect dialect) {
    try {
      return new MongoQuerySession(handle, dialect, handle.client().startSession());
    } catch (MongoException e) {
      throw failure("OPEN", handle, null, e);
    }
  }

  @Override
  public List<Map<String, Object>> select(MongoStatement stmt) {
    return run("SELECT", stmt, () -> toRows(db.getCollection(stmt.collection())
        .aggregate(session, stmt.pipeline())
        .allowDiskUse(true)));
  }

  @Override
  public Map<String, Object> aggregate(MongoStatement stmt, List<AggregationOp> aggregations) {
    return run("AGGREGATE", stmt, () -> summaryRow(db.getCollection(stmt.collection())
        .aggregate(session, stmt.pipeline())
        .allowDiskUse(true)
        .first(), aggregations));
  }

  @Override
  public List<Map<String, Object>> findByIds(String entity, String idField, Collection<Object> ids) {
    if (ids == null || ids.isEmpty()) return List.of();
    Document filter = dialect.lookupFilter(idField, ids);
    MongoStatement describe = new MongoStatement(entity, List.of(new Document("$match", filter)));
    return run("LOOKUP", describe, () -> toRows(db.getCollection(entity).find(session, filter)));
  }

  /** Collection names of the handle database, {@code system.*} excluded, sorted. */
  @Override
  public List<String> entities() {
    return run("ENTITIES", null, () -> {
      List<String> out = new ArrayList<>();
      for (String name : db.listCollectionNames(session)) {
        if (!name.startsWith("system.")) out.add(name);
      }
      Collections.sort(out);
      return out;
    });
  }

  /**
   * Collections are schemaless, so fields come from a sample of documents: keys in first-seen
   * order, typed by the first non-null value seen for each.
   */
  @Override
  public List<FieldDescriptor> fields(String entity) {
    return run("FIELDS", null, () -> {
      Map<String, String> types = new LinkedHashMap<>();
      for (Document d : db.getCollection(entity).find(session).limit(FIELD_SAMPLE_SIZE)) {
        for (Map.Entry<String, Object> e : d.entrySet()) {
          Object v = e.getValue();
          if (v != null && types.get(e.getKey()) == null) {
            types.put(e.getKey(), v.getClass().getSimpleName());
          } else {
            types.putIfAbsent(e.getKey(), null);
          }
        }
      }
      List<FieldDescriptor> out = new ArrayList<>(types.size());
      types.forEach((name, type) -> out.add(new FieldDescriptor(name, type)));
      return out;
    });
  }

  @Override
  public void close() {
    try {
      session.close();
    } catch (MongoException e) {
      throw failure("CLOSE", handle, null, e);
    }
  }

  /**
   * The single summary row: the {@code $group} output keyed by alias, or, when nothing matched
   * and the pipeline produced no document, counts of zero and nulls for everything else.
   */
  static Map<String, Object> summaryRow(Document doc, List<AggregationOp> aggregations) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (AggregationOp op : aggregations) {
      Object v = (doc == null) ? null : doc.get(op.alias());
      if (op.function() == AggregateFunction.COUNT) {
        v = (v instanceof Number n) ? Long.valueOf(n.longValue()) : Long.valueOf(0L);
      }
      row.put(op.alias(), v);
    }
    return row;
  }

  private static List<Map<String, Object>> toRows(Iterable<Document> docs) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : docs) out.add(new LinkedHashMap<>(d));
    return out;
  }

  private <T> T run(String op, MongoStatement st, Supplier<T> call) {
    long start = System.nanoTime();
    debugPipeline(op, st);
    try {
      T out = call.get();
      if (log.isDebugEnabled()) {
        log.debug("relata.mongo_done op={} durationMs={} result={}", op, (System.nanoTime() - start) / 1_000_000.0, safeResult(out));
      }
      return out;
    } catch (MongoException e) {
      throw failure(op, handle, st, e);
    }
  }

  private static BackendExecutionException failure(String op, MongoHandle h, MongoStatement st, MongoException e) {
    log.error("relata.mongo failed op={} handleId={} database={} code={} collection={}",
        op, h.id(), h.database(), e.getCode(), st == null ? "-" : st.collection(), e);
    return new BackendExecutionException(e);
  }

  private void debugPipeline(String op, MongoStatement st) {
    if (!log.isDebugEnabled()) return;
    if (st == null) {
      log.debug("relata.mongo op={} handleId={} database={}", op, handle.id(), handle.database());
      return;
    }
    log.debug("relata.mongo op={} handleId={} database={} collection={} stages={}",
        op, handle.id(), handle.database(), st.collection(), st.stageNames());

    // TRACE: stage shape only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 0;
      for (Document stage : st.pipeline()) {
        String name = stage.keySet().iterator().next();
        Object body = stage.get(name);
        Object keys = (body instanceof Document d) ? d.keySet() : "-";
        log.trace("relata.mongo stage index={} op={} keys={}", idx++, name, keys);
      }
    }
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Collection<?> c) return "rows=" + c.size();
    if (r instanceof Map<?, ?> m) return "columns=" + m.size();
    return r.getClass().getSimpleName();
  }
}
