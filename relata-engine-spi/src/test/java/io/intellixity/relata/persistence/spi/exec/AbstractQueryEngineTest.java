package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.enhance.ReferenceDef;
import io.intellixity.relata.persistence.enhance.ResultEnhancer;
import io.intellixity.relata.persistence.error.BackendExecutionException;
import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.error.NoPathException;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.exec.QueryResult;
import io.intellixity.relata.persistence.exec.handle.EngineHandle;
import io.intellixity.relata.persistence.graph.Relation;
import io.intellixity.relata.persistence.graph.RelationGraph;
import io.intellixity.relata.persistence.plan.JoinPlanner;
import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.plan.RootResolver;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractQueryEngineTest {
  private static final RelationGraph GRAPH = RelationGraph.of(
      new Relation("customers", "invoices", "id", "customer_id"),
      new Relation("suppliers", "parts", "id", "supplier_id"));

  record Stmt(String text) implements NativeStatement {
    @Override public String describe() { return text; }
  }

  record Handle(String id) implements EngineHandle<String> {
    @Override public String client() { return id; }
    @Override public String namespace() { return null; }
  }

  static final class TextDialect implements Dialect<Stmt> {
    @Override public String id() { return "text"; }
    @Override public Stmt renderSelect(QueryPlan plan, QueryElement filter) {
      return new Stmt("select " + plan.rootEntity() + " joins=" + plan.joins().size() + " where " + filter);
    }
    @Override public Stmt renderAggregate(QueryPlan plan, QueryElement filter, List<AggregationOp> aggregations) {
      return new Stmt("aggregate " + aggregations.size());
    }
  }

  static final class FakeSession implements QuerySession<Stmt> {
    final List<String> log = new ArrayList<>();
    RuntimeException failOnSelect;
    boolean closed;

    @Override public List<Map<String, Object>> select(Stmt statement) {
      log.add(statement.text());
      if (failOnSelect != null) throw failOnSelect;
      return List.of(Map.of("id", 1, "customer_id", 7), Map.of("id", 2, "customer_id", 8));
    }
    @Override public Map<String, Object> aggregate(Stmt statement, List<AggregationOp> aggregations) {
      log.add(statement.text());
      return Map.of("count", 2L);
    }
    @Override public List<Map<String, Object>> findByIds(String entity, String idField, Collection<Object> ids) {
      log.add("lookup " + entity + " " + ids.size());
      return List.of(Map.of("id", 7L, "name", "Acme"));
    }
    @Override public List<String> entities() {
      log.add("entities");
      if (failOnSelect != null) throw failOnSelect;
      return List.of("customers", "invoices");
    }
    @Override public List<FieldDescriptor> fields(String entity) {
      log.add("fields " + entity);
      return List.of(new FieldDescriptor("id", "INTEGER"));
    }
    @Override public void close() { closed = true; }
  }

  static final class FakeEngine extends AbstractQueryEngine<Stmt, Handle> {
    final List<FakeSession> opened = new ArrayList<>();
    RuntimeException failOnSelect;

    FakeEngine(ResultEnhancer enhancer) {
      super(new TextDialect(), new JoinPlanner(GRAPH), new RootResolver("invoices"), enhancer, null);
    }

    @Override public String family() { return "fake"; }

    @Override protected QuerySession<Stmt> openSession(Handle handle) {
      FakeSession s = new FakeSession();
      s.failOnSelect = failOnSelect;
      opened.add(s);
      return s;
    }
  }

  @Test
  void runsDetailAggregateAndLookupInOneSession() {
    FakeEngine engine = new FakeEngine(new ResultEnhancer(List.of(ReferenceDef.of("customer_id", "customers", "id"))));
    QueryRequest req = QueryRequest.on("invoices").withFilter(eq("customers", "region", "North")).withAggregation(AggregationOp.countAll());

    QueryResult r = engine.execute(new Handle("h1"), req);

    assertEquals(1, engine.opened.size());
    FakeSession s = engine.opened.get(0);
    assertTrue(s.closed);
    assertEquals(3, s.log.size());
    assertTrue(s.log.get(0).startsWith("select invoices joins=1"));
    assertEquals("aggregate 1", s.log.get(1));
    assertEquals("lookup customers 2", s.log.get(2));

    assertEquals("invoices", r.rootEntity());
    assertEquals(2, r.rows().size());
    assertEquals("Acme", r.rows().get(0).get("customers_name"));
    assertFalse(r.rows().get(1).containsKey("customers_name"));
    assertEquals(2L, r.aggregate("count"));
    assertEquals("count", r.aggregates().get(0).alias());
  }

  @Test
  void withoutAggregationsNoSummaryIsProduced() {
    FakeEngine engine = new FakeEngine(null);
    QueryResult r = engine.execute(new Handle("h1"), QueryRequest.on("invoices"));
    assertEquals(1, engine.opened.get(0).log.size());
    assertTrue(r.aggregateRows().isEmpty());
    assertTrue(r.aggregates().isEmpty());
    assertEquals(List.of("invoices.*"), r.projection());
  }

  @Test
  void backendFailureIsWrappedWithOpaqueMessage() {
    FakeEngine engine = new FakeEngine(null);
    engine.failOnSelect = new IllegalStateException("relation \"secret_table\" does not exist");

    BackendExecutionException ex = assertThrows(BackendExecutionException.class,
        () -> engine.execute(new Handle("h1"), QueryRequest.on("invoices")));
    assertEquals(BackendExecutionException.MESSAGE, ex.getMessage());
    assertFalse(ex.getMessage().contains("secret_table"));
    assertSame(engine.failOnSelect, ex.getCause());
    assertFalse(ex.clientError());
    assertTrue(engine.opened.get(0).closed);
  }

  @Test
  void planningErrorsSurfaceBeforeAnySessionIsOpened() {
    FakeEngine engine = new FakeEngine(null);
    assertThrows(NoPathException.class,
        () -> engine.execute(new Handle("h1"), QueryRequest.on("invoices").withFilter(eq("parts", "sku", "X"))));
    assertThrows(MalformedFilterException.class,
        () -> engine.execute(new Handle("h1"), QueryRequest.on("invoices").withFilter(gt(null, "amount", null))));
    assertTrue(engine.opened.isEmpty());
  }

  @Test
  void prepareRendersWithoutExecuting() {
    FakeEngine engine = new FakeEngine(null);
    PreparedQuery<Stmt> pq = engine.prepare(QueryRequest.of(eq("customers", "region", "North")));
    assertEquals("customers", pq.plan().rootEntity());
    assertFalse(pq.hasAggregate());
    assertTrue(pq.detail().describe().startsWith("select customers joins=0"));
    assertTrue(engine.opened.isEmpty());
  }

  @Test
  void eachCallGetsItsOwnSession() {
    FakeEngine engine = new FakeEngine(null);
    engine.execute(new Handle("h1"), QueryRequest.on("invoices"));
    engine.execute(new Handle("h2"), QueryRequest.on("customers"));
    assertEquals(2, engine.opened.size());
    assertNotSame(engine.opened.get(0), engine.opened.get(1));
    assertTrue(engine.opened.stream().allMatch(s -> s.closed));
  }

  @Test
  void discoveryRunsInItsOwnSession() {
    FakeEngine engine = new FakeEngine(null);
    assertEquals(List.of("customers", "invoices"), engine.entities(new Handle("h1")));
    assertEquals(List.of(new FieldDescriptor("id", "INTEGER")), engine.fields(new Handle("h1"), "customers"));
    assertEquals(2, engine.opened.size());
    assertEquals(List.of("fields customers"), engine.opened.get(1).log);
    assertTrue(engine.opened.stream().allMatch(s -> s.closed));
    assertThrows(IllegalArgumentException.class, () -> engine.fields(new Handle("h1"), " "));
  }

  @Test
  void discoveryFailureIsWrapped() {
    FakeEngine engine = new FakeEngine(null);
    engine.failOnSelect = new IllegalStateException("permission denied for schema secret");
    BackendExecutionException ex = assertThrows(BackendExecutionException.class, () -> engine.entities(new Handle("h1")));
    assertSame(engine.failOnSelect, ex.getCause());
    assertTrue(engine.opened.get(0).closed);
  }
}
