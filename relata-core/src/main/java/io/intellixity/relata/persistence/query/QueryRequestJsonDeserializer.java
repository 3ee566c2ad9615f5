package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.error.UnsupportedOperatorException;

import java.io.IOException;
import java.util.*;

/**
 * JSON reader for {@link QueryRequest}.
 * <p>
 * Accepted shapes:
 * <pre>
 * { "root": "invoices",
 *   "filters": [ { "entity": "invoices", "field": "amount", "operator": "gt", "value": 100 },
 *                { "entity": "invoices", "field": "amount", "operator": "sum" } ],
 *   "aggregations": [ { "field": "*", "operator": "count", "alias": "n" } ] }
 * </pre>
 * {@code filters} (list, implicit AND) or {@code filter} (single tree). Tree nodes are
 * {@code {"and": [...]}}, {@code {"or": [...]}}, {@code {"not": node}}, flat leaves as above, or
 * operator-keyed leaves {@code {"gt": {"entity": .., "field": .., "value": ..}}}. A leaf without an
 * operator may carry an operator-keyed value instead: {@code {"field": "amount", "value": {"gt": 100}}}.
 * Top-level list entries tagged with an aggregation function are moved to the aggregation list.
 */
public final class QueryRequestJsonDeserializer extends JsonDeserializer<QueryRequest> {
  @Override
  public QueryRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    return read(root);
  }

  public static QueryRequest read(JsonNode root) {
    if (!root.isObject()) throw new MalformedFilterException("request must be a JSON object");

    QueryRequest q = new QueryRequest().withRoot(textOrNull(root.get("root")));
    List<AggregationOp> aggs = new ArrayList<>();

    JsonNode filters = root.get("filters");
    if (filters == null || filters.isNull()) filters = root.get("filter");
    if (filters != null && !filters.isNull()) {
      if (filters.isArray()) {
        List<QueryElement> els = new ArrayList<>();
        for (JsonNode n : filters) {
          String tag = operatorTag(n);
          if (AggregateFunction.tryTag(tag) != null) {
            aggs.add(parseAggregation(n));
            continue;
          }
          QueryElement e = parseElement(n);
          if (e != null) els.add(e);
        }
        if (els.size() == 1) q.withFilter(els.get(0));
        else if (!els.isEmpty()) q.withFilter(new LogicalGroup(Clause.AND, els));
      } else {
        q.withFilter(parseElement(filters));
      }
    }

    JsonNode a = root.get("aggregations");
    if (a != null && !a.isNull()) {
      if (!a.isArray()) throw new MalformedFilterException("aggregations must be an array");
      for (JsonNode n : a) aggs.add(parseAggregation(n));
    }
    return q.withAggregations(aggs);
  }

  static QueryElement parseElement(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new MalformedFilterException("filter element must be an object: " + n);

    if (n.has("and")) return new LogicalGroup(Clause.AND, parseChildren(n.get("and")));
    if (n.has("or")) return new LogicalGroup(Clause.OR, parseChildren(n.get("or")));
    if (n.has("not") && n.get("not").isObject()) {
      QueryElement child = parseElement(n.get("not"));
      return child == null ? null : new NotElement(child);
    }

    if (n.has("field")) return parseCondition(operatorTag(n), n);

    // Operator-keyed form: { "gt": { "field": ..., "value": ... } }
    if (n.size() == 1) {
      String key = n.fieldNames().next();
      JsonNode body = n.get(key);
      if (body != null && body.isObject()) return parseCondition(key, body);
    }
    throw new MalformedFilterException("unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new MalformedFilterException("group members must be an array");
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static Condition parseCondition(String tag, JsonNode body) {
    rejectAggregationTag(tag);
    FieldRef field = fieldRef(body);
    boolean not = boolOrDefault(body.get("not"), false);
    JsonNode v = body.get("value");

    Operator op;
    if (tag != null) {
      op = Operator.fromTag(tag);
    } else if (isOperatorKeyed(v)) {
      String key = v.fieldNames().next();
      op = Operator.fromTag(key);
      v = v.get(key);
    } else {
      op = Operator.EQ;
    }

    if (op == Operator.BETWEEN) {
      Object lower = decode(body.get("lower"));
      Object upper = decode(body.get("upper"));
      if (v != null && v.isObject()) {
        lower = decode(firstPresent(v, "from", "lower"));
        upper = decode(firstPresent(v, "to", "upper"));
      } else if (v != null && v.isArray()) {
        if (v.size() != 2) throw new MalformedFilterException("between array must have exactly two elements");
        lower = decode(v.get(0));
        upper = decode(v.get(1));
      }
      return new Condition(field, op, null, lower, upper, not);
    }

    if (v == null && (op == Operator.IN || op == Operator.NIN)) v = body.get("values");
    return new Condition(field, op, decode(v), null, null, not);
  }

  /** A single-entry object keyed by an operator (or aggregation) tag, e.g. {@code {"gt": 100}}. */
  private static boolean isOperatorKeyed(JsonNode v) {
    if (v == null || !v.isObject() || v.size() != 1) return false;
    String key = v.fieldNames().next();
    rejectAggregationTag(key);
    return Operator.tryTag(key) != null;
  }

  private static void rejectAggregationTag(String tag) {
    if (tag != null && AggregateFunction.tryTag(tag) != null) {
      throw new UnsupportedOperatorException(tag, "aggregation function used inside a filter group");
    }
  }

  private static AggregationOp parseAggregation(JsonNode n) {
    if (n == null || !n.isObject()) throw new MalformedFilterException("aggregation must be an object: " + n);
    String tag = operatorTag(n);
    if (tag == null) tag = textOrNull(n.get("function"));
    if (tag == null) throw new MalformedFilterException("aggregation requires an operator");
    return new AggregationOp(fieldRef(n), AggregateFunction.fromTag(tag), textOrNull(n.get("alias")));
  }

  private static FieldRef fieldRef(JsonNode body) {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new MalformedFilterException("condition requires field");
    String entity = textOrNull(body.get("entity"));
    if (entity == null) entity = textOrNull(body.get("collection"));
    return FieldRef.of(entity, field);
  }

  private static String operatorTag(JsonNode n) {
    if (n == null || !n.isObject()) return null;
    String op = textOrNull(n.get("operator"));
    return op != null ? op : textOrNull(n.get("op"));
  }

  private static JsonNode firstPresent(JsonNode obj, String a, String b) {
    JsonNode x = obj.get(a);
    return x != null ? x : obj.get(b);
  }

  static Object decode(JsonNode v) {
    if (v == null || v.isNull() || v.isMissingNode()) return null;
    if (v.isTextual()) return v.asText();
    if (v.isBoolean()) return v.booleanValue();
    if (v.isIntegralNumber()) return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
    if (v.isNumber()) return v.doubleValue();
    if (v.isArray()) {
      List<Object> out = new ArrayList<>(v.size());
      for (JsonNode x : v) out.add(decode(x));
      return out;
    }
    if (v.isObject()) {
      Map<String, Object> out = new LinkedHashMap<>();
      v.fields().forEachRemaining(e -> out.put(e.getKey(), decode(e.getValue())));
      return out;
    }
    return v.asText();
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
