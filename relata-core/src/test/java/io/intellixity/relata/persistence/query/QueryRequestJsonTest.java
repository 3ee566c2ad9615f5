package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.error.UnsupportedOperatorException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryRequestJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void flatFilterListIsImplicitAndWithAggregationsSplitOff() throws Exception {
    String s = """
        {
          "root": "invoices",
          "filters": [
            { "entity": "invoices", "field": "amount", "operator": "gt", "value": 100 },
            { "collection": "customers", "field": "region", "value": "North" },
            { "entity": "invoices", "field": "amount", "operator": "sum" },
            { "entity": "invoices", "field": "*", "operator": "count", "alias": "n" }
          ]
        }
        """;
    QueryRequest q = JSON.readValue(s, QueryRequest.class);
    assertEquals("invoices", q.root());

    LogicalGroup g = assertInstanceOf(LogicalGroup.class, q.filter());
    assertEquals(Clause.AND, g.clause());
    assertEquals(2, g.elements().size());
    Condition amount = (Condition) g.elements().get(0);
    assertEquals(Operator.GT, amount.operator());
    assertEquals(100L, amount.value());
    Condition region = (Condition) g.elements().get(1);
    assertEquals(Operator.EQ, region.operator());
    assertEquals(FieldRef.of("customers", "region"), region.field());

    assertEquals(2, q.aggregations().size());
    assertEquals("sum_amount", q.aggregations().get(0).alias());
    assertEquals(AggregateFunction.COUNT, q.aggregations().get(1).function());
    assertEquals("n", q.aggregations().get(1).alias());
  }

  @Test
  void parsesNestedTreeWithNotAndOperatorKeyedLeaves() throws Exception {
    String s = """
        {
          "filter": {
            "and": [
              { "field": "a", "value": 1 },
              { "or": [
                  { "eq": { "field": "b", "value": 2 } },
                  { "eq": { "field": "b", "value": 3 } }
              ] },
              { "not": { "startsWith": { "entity": "customers", "field": "name", "value": "Ac" } } }
            ]
          }
        }
        """;
    QueryRequest q = JSON.readValue(s, QueryRequest.class);
    assertNull(q.root());
    LogicalGroup and = assertInstanceOf(LogicalGroup.class, q.filter());
    assertEquals(3, and.elements().size());
    LogicalGroup or = assertInstanceOf(LogicalGroup.class, and.elements().get(1));
    assertEquals(Clause.OR, or.clause());
    NotElement not = assertInstanceOf(NotElement.class, and.elements().get(2));
    Condition sw = assertInstanceOf(Condition.class, not.element());
    assertEquals(Operator.STARTS_WITH, sw.operator());
  }

  @Test
  void betweenAcceptsFromToLowerUpperAndPairs() throws Exception {
    for (String value : List.of("{\"from\": 10, \"to\": 20}", "{\"lower\": 10, \"upper\": 20}", "[10, 20]")) {
      String s = "{\"filters\": [{\"field\": \"amount\", \"operator\": \"between\", \"value\": " + value + "}]}";
      Condition c = assertInstanceOf(Condition.class, JSON.readValue(s, QueryRequest.class).filter());
      assertEquals(Operator.BETWEEN, c.operator());
      assertEquals(10L, c.lower());
      assertEquals(20L, c.upper());
    }
  }

  @Test
  void inValuesDecodeAsList() throws Exception {
    String s = "{\"filters\": [{\"field\": \"status\", \"operator\": \"in\", \"value\": [\"paid\", \"open\"]}]}";
    Condition c = (Condition) JSON.readValue(s, QueryRequest.class).filter();
    assertEquals(List.of("paid", "open"), c.value());
  }

  @Test
  void unknownOperatorIsRejected() {
    UnsupportedOperatorException ex = assertThrows(UnsupportedOperatorException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"filters\": [{\"field\": \"amount\", \"operator\": \"near\", \"value\": 1}]}")));
    assertEquals("near", ex.operator());
  }

  @Test
  void aggregationTagInsideGroupIsRejected() {
    UnsupportedOperatorException ex = assertThrows(UnsupportedOperatorException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"filter\": {\"or\": [{\"field\": \"amount\", \"operator\": \"sum\"}]}}")));
    assertTrue(ex.getMessage().contains("aggregation"));
  }

  @Test
  void missingFieldAndBadShapesAreMalformed() {
    assertThrows(MalformedFilterException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"filters\": [{\"entity\": \"invoices\", \"value\": 1}]}")));
    assertThrows(MalformedFilterException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"filters\": [\"amount > 1\"]}")));
    assertThrows(MalformedFilterException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"aggregations\": {\"field\": \"amount\"}}")));
    assertThrows(MalformedFilterException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"aggregations\": [{\"field\": \"amount\", \"operator\": \"sum\", \"extra\": 1}, {\"field\": \"*\", \"operator\": \"avg\"}]}")));
  }

  @Test
  void unknownKeyedObjectIsKeptAsEqualityValue() {
    QueryRequest q = QueryRequestJsonDeserializer.read(JSON.valueToTree(Map.of(
        "filters", List.of(Map.of("field", "meta", "value", Map.of("k", "v"))))));
    Condition c = (Condition) q.filter();
    assertEquals(Map.of("k", "v"), c.value());
  }

  @Test
  void operatorKeyedValueSetsTheOperator() throws Exception {
    String s = """
        {
          "root": "invoices",
          "filters": [
            { "entity": "invoices", "field": "amount", "value": { "gt": 100 } },
            { "field": "amount", "value": { "greaterThan": 50 } },
            { "field": "issued_at", "value": { "between": { "from": "2024-01-01", "to": "2024-12-31" } } },
            { "field": "status", "value": { "not-in": ["void"] } }
          ]
        }
        """;
    LogicalGroup g = (LogicalGroup) JSON.readValue(s, QueryRequest.class).filter();
    Condition gt = (Condition) g.elements().get(0);
    assertEquals(Operator.GT, gt.operator());
    assertEquals(100L, gt.value());
    assertEquals(Operator.GT, ((Condition) g.elements().get(1)).operator());
    Condition range = (Condition) g.elements().get(2);
    assertEquals(Operator.BETWEEN, range.operator());
    assertEquals("2024-01-01", range.lower());
    assertEquals("2024-12-31", range.upper());
    Condition nin = (Condition) g.elements().get(3);
    assertEquals(Operator.NIN, nin.operator());
    assertEquals(List.of("void"), nin.value());
  }

  @Test
  void aggregationKeyedValueIsRejected() {
    assertThrows(UnsupportedOperatorException.class, () -> QueryRequestJsonDeserializer.read(
        JSON.readTree("{\"filters\": [{\"field\": \"amount\", \"value\": {\"sum\": 1}}]}")));
  }

  @Test
  void groupsPrintTheirClause() {
    assertEquals("OR[a eq 1, b eq 2]", QueryFilters.or(QueryFilters.eq(null, "a", 1), QueryFilters.eq(null, "b", 2)).toString());
  }
}
