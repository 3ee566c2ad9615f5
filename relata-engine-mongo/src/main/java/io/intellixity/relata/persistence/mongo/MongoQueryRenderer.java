package io.intellixity.relata.persistence.mongo;

import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.spi.sql.FilterValues;
import org.bson.Document;

import java.util.*;

/**
 * Renders filters ({@link QueryElement}) to a MongoDB {@code $match} document,
 * applying De Morgan for NOT groups and {@code $nor} for negated leaves.
 * <p>
 * Fields of the root collection are addressed by name; fields of a joined entity by
 * {@code <entity>.<field>}, matching the {@code as} name of its {@code $lookup}.
 * <p>
 * {@code ne} with a value renders {@code $ne}, which also matches documents where the field is
 * missing or null. The SQL translation ({@code <>}) excludes NULL rows.
 */
final class MongoQueryRenderer {
  private static final String REGEX_META = "\\.^$|?*+()[]{}/-";

  private MongoQueryRenderer() {}

  static Document toBson(String root, QueryElement filter) {
    if (filter == null) return new Document();
    return render(root, filter, false);
  }

  static String path(String root, FieldRef ref) {
    String entity = ref.entityOr(root);
    return entity.equals(root) ? ref.field() : entity + "." + ref.field();
  }

  private static Document render(String root, QueryElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(root, n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = negate ? g.clause().flip() : g.clause();
      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(root, child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = path(root, c.field());
    boolean not = c.not() ^ negate;

    Document positive = switch (c.operator()) {
      case EQ -> new Document(path, MongoValueCoercion.coerce(FilterValues.scalarOrNull(c)));
      case NE -> new Document(path, new Document("$ne", MongoValueCoercion.coerce(FilterValues.scalarOrNull(c))));
      case GT -> compare(path, "$gt", c);
      case GTE -> compare(path, "$gte", c);
      case LT -> compare(path, "$lt", c);
      case LTE -> compare(path, "$lte", c);
      case IN -> new Document(path, new Document("$in", MongoValueCoercion.coerceAll(FilterValues.members(c))));
      case NIN -> new Document(path, new Document("$nin", MongoValueCoercion.coerceAll(FilterValues.members(c))));
      case BETWEEN -> {
        FilterValues.requireBounds(c);
        yield new Document(path, new Document("$gte", MongoValueCoercion.coerce(c.lower()))
            .append("$lte", MongoValueCoercion.coerce(c.upper())));
      }
      case CONTAINS -> regex(path, escapeRegex(FilterValues.requireText(c)));
      case STARTS_WITH -> regex(path, "^" + escapeRegex(FilterValues.requireText(c)));
      case ENDS_WITH -> regex(path, escapeRegex(FilterValues.requireText(c)) + "$");
      case REGEX -> regex(path, FilterValues.requireText(c));
    };

    return not ? new Document("$nor", List.of(positive)) : positive;
  }

  private static Document compare(String path, String op, Condition c) {
    return new Document(path, new Document(op, MongoValueCoercion.coerce(FilterValues.requireScalar(c))));
  }

  private static Document regex(String path, String pattern) {
    return new Document(path, new Document("$regex", pattern).append("$options", "i"));
  }

  static String escapeRegex(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 8);
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (REGEX_META.indexOf(ch) >= 0) sb.append('\\');
      sb.append(ch);
    }
    return sb.toString();
  }
}
