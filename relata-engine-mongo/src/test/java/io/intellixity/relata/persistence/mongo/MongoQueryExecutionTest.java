package io.intellixity.relata.persistence.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import io.intellixity.relata.persistence.config.RelataConfigLoader;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.exec.QueryResult;
import io.intellixity.relata.persistence.query.AggregateFunction;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.query.QueryRequest;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

/** Runs rendered pipelines against a real mongod; skipped where Docker is unavailable. */
@Testcontainers(disabledWithoutDocker = true)
final class MongoQueryExecutionTest {
  @Container
  static final MongoDBContainer MONGO = new MongoDBContainer(DockerImageName.parse("mongo:6.0"));

  private static final ObjectId ACME = new ObjectId();
  private static final ObjectId GLOBEX = new ObjectId();
  private static final ObjectId GONE = new ObjectId();

  private static MongoClient client;
  private static MongoHandle handle;
  private static MongoQueryEngine engine;

  @BeforeAll
  static void setUp() {
    client = MongoClients.create(MONGO.getConnectionString());
    MongoDatabase db = client.getDatabase("relata_it");
    db.getCollection("customers").insertMany(List.of(
        new Document("_id", ACME).append("name", "Acme").append("region", "North"),
        new Document("_id", GLOBEX).append("name", "Globex").append("region", "South")));
    db.getCollection("invoices").insertMany(List.of(
        invoice(1, ACME, 80.0, "2024-01-15"),
        invoice(2, ACME, 120.0, "2024-03-10"),
        invoice(3, GLOBEX, 300.0, "2024-04-01"),
        invoice(4, GONE, 50.0, "2024-05-01")));

    handle = new MongoHandle("mongo-it", client, "relata_it");
    engine = new MongoQueryEngine(RelataConfigLoader.fromYaml("""
        hub: invoices
        relations:
          - { from: customers, to: invoices, localKey: _id, foreignKey: customer_id }
        references:
          - { keyField: customer_id, entity: customers, idField: _id, extraFields: { region: customer_region } }
        """));
  }

  @AfterAll
  static void tearDown() {
    if (client != null) client.close();
  }

  @Test
  void isoDateStringMatchesStoredDates() {
    QueryResult r = engine.execute(handle, QueryRequest.of(gte(null, "issued_at", "2024-03-01")));
    assertEquals(Set.of(2, 3, 4), ids(r.rows()));
  }

  @Test
  void hexStringMatchesStoredObjectId() {
    QueryResult r = engine.execute(handle, QueryRequest.of(eq(null, "customer_id", ACME.toHexString())));
    assertEquals(Set.of(1, 2), ids(r.rows()));
  }

  @Test
  void joinedFilterDropsRowsWithoutAPartner() {
    QueryResult r = engine.execute(handle, QueryRequest.on("invoices")
        .withFilter(in("customers", "region", List.of("North", "South"))));
    assertEquals(1, r.joins().size());
    assertEquals(Set.of(1, 2, 3), ids(r.rows()));
  }

  @Test
  void aggregatesOverJoinedFilter() {
    QueryResult r = engine.execute(handle, QueryRequest.on("invoices")
        .withFilter(eq("customers", "region", "North"))
        .withAggregation(AggregationOp.countAll())
        .withAggregation(AggregationOp.of("invoices", "amount", AggregateFunction.SUM)));
    assertEquals(Set.of(1, 2), ids(r.rows()));
    assertEquals(2L, r.aggregate("count"));
    assertEquals(200.0, ((Number) r.aggregate("sum_amount")).doubleValue(), 1e-9);
  }

  @Test
  void emptyMatchStillYieldsOneSummaryRow() {
    QueryResult r = engine.execute(handle, QueryRequest.on("invoices")
        .withFilter(gt("invoices", "amount", 10_000))
        .withAggregation(AggregationOp.countAll())
        .withAggregation(AggregationOp.of(null, "amount", AggregateFunction.SUM)));
    assertTrue(r.rows().isEmpty());
    assertEquals(1, r.aggregateRows().size());
    assertEquals(0L, r.aggregate("count"));
    assertNull(r.aggregate("sum_amount"));
  }

  @Test
  void rowsAreEnhancedFromReferencedCollection() {
    QueryResult r = engine.execute(handle, QueryRequest.of(gte(null, "issued_at", "2024-03-01")));

    Map<String, Object> globex = byId(r.rows(), 3);
    assertEquals("Globex", globex.get("customers_name"));
    assertEquals("South", globex.get("customer_region"));

    Map<String, Object> orphan = byId(r.rows(), 4);
    assertFalse(orphan.containsKey("customers_name"));
    assertFalse(orphan.containsKey("customer_region"));
  }

  @Test
  void discoversCollectionsAndSampledFields() {
    assertEquals(List.of("customers", "invoices"), engine.entities(handle));

    List<FieldDescriptor> fields = engine.fields(handle, "customers");
    assertEquals(List.of("_id", "name", "region"), fields.stream().map(FieldDescriptor::name).collect(Collectors.toList()));
    assertEquals("ObjectId", fields.get(0).type());
    assertEquals("String", fields.get(1).type());
    assertTrue(engine.fields(handle, "ghosts").isEmpty());
  }

  private static Document invoice(int id, ObjectId customer, double amount, String issued) {
    return new Document("_id", id)
        .append("customer_id", customer)
        .append("amount", amount)
        .append("issued_at", Date.from(LocalDate.parse(issued).atStartOfDay(ZoneOffset.UTC).toInstant()));
  }

  private static Set<Integer> ids(List<Map<String, Object>> rows) {
    return rows.stream().map(m -> ((Number) m.get("_id")).intValue()).collect(Collectors.toSet());
  }

  private static Map<String, Object> byId(List<Map<String, Object>> rows, int id) {
    return rows.stream().filter(m -> ((Number) m.get("_id")).intValue() == id).findFirst().orElseThrow();
  }
}
