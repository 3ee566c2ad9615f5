package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.error.UnsupportedOperatorException;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.plan.JoinEdge;
import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.spi.sql.FilterValues;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 * <p>
 * Renders the join chain as {@code INNER JOIN}s, the filter tree as a parameterised WHERE clause
 * (placeholders appear in the same order as the collected parameters) and aggregations as a
 * single summary SELECT. Values are always bound, never inlined.
 * <p>
 * DB-specific dialects override hooks for identifier quoting, LIKE escaping and regex matching.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private final List<Object> params = new ArrayList<>();
    public String add(Object value) {
      params.add(value);
      return "?";
    }
    public List<Object> params() { return params; }
  }

  @Override
  public final SqlStatement renderSelect(QueryPlan plan, QueryElement filter) {
    List<String> items = new ArrayList<>();
    for (String p : plan.projection()) items.add(projectionItem(p));
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + String.join(", ", items) + fromClause(plan) + whereClause(plan, filter, ctx);
    return new SqlStatement(sql, ctx.params());
  }

  @Override
  public final SqlStatement renderAggregate(QueryPlan plan, QueryElement filter, List<AggregationOp> aggregations) {
    if (aggregations == null || aggregations.isEmpty()) {
      throw new IllegalArgumentException("renderAggregate requires at least one aggregation");
    }
    List<String> items = new ArrayList<>();
    for (AggregationOp op : aggregations) {
      items.add(aggregateExpr(plan, op) + " AS " + quoteIdent(op.alias()));
    }
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + String.join(", ", items) + fromClause(plan) + whereClause(plan, filter, ctx);
    return new SqlStatement(sql, ctx.params());
  }

  @Override
  public SqlStatement renderLookup(String entity, String idField, Collection<?> ids) {
    if (ids == null || ids.isEmpty()) throw new IllegalArgumentException("renderLookup requires ids");
    RenderCtx ctx = new RenderCtx();
    List<String> ph = new ArrayList<>(ids.size());
    for (Object id : ids) ph.add(ctx.add(id));
    String sql = "SELECT * FROM " + quoteIdent(entity) +
        " WHERE " + quoteIdent(idField) + " IN (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.params());
  }

  protected String fromClause(QueryPlan plan) {
    StringBuilder sb = new StringBuilder(" FROM ").append(quoteIdent(plan.rootEntity()));
    for (JoinEdge e : plan.joins()) {
      sb.append(" INNER JOIN ").append(quoteIdent(e.to()))
          .append(" ON ").append(column(e.from(), e.localField()))
          .append(" = ").append(column(e.to(), e.foreignField()));
    }
    return sb.toString();
  }

  protected String whereClause(QueryPlan plan, QueryElement filter, RenderCtx ctx) {
    if (filter == null) return "";
    String p = renderPredicateSql(plan, filter, ctx, false);
    return (p == null || p.isBlank()) ? "" : " WHERE " + p;
  }

  private String projectionItem(String item) {
    int dot = item.indexOf('.');
    String entity = item.substring(0, dot);
    String field = item.substring(dot + 1);
    if ("*".equals(field)) return quoteIdent(entity) + ".*";
    return column(entity, field) + " AS " + quoteIdent(item);
  }

  protected String aggregateExpr(QueryPlan plan, AggregationOp op) {
    if (op.isCountAll()) return "COUNT(*)";
    String col = column(op.field().entityOr(plan.rootEntity()), op.field().field());
    return switch (op.function()) {
      case SUM -> "SUM(" + col + ")";
      case AVG -> "AVG(" + col + ")";
      case MIN -> "MIN(" + col + ")";
      case MAX -> "MAX(" + col + ")";
      case COUNT -> "COUNT(" + col + ")";
    };
  }

  protected final String column(String entity, String field) {
    return quoteIdent(entity) + "." + quoteIdent(field);
  }

  private String renderPredicateSql(QueryPlan plan, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(plan, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = negate ? g.clause().flip() : g.clause();
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(plan, c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String expr = column(c.field().entityOr(plan.rootEntity()), c.field().field());
    boolean not = c.not() ^ negate;
    Object value = (c.operator() == Operator.EQ || c.operator() == Operator.NE) ? FilterValues.scalarOrNull(c) : c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", value, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", value, not, ctx);
      case GT -> unarySql(expr, ">", FilterValues.requireScalar(c), not, ctx);
      case GTE -> unarySql(expr, ">=", FilterValues.requireScalar(c), not, ctx);
      case LT -> unarySql(expr, "<", FilterValues.requireScalar(c), not, ctx);
      case LTE -> unarySql(expr, "<=", FilterValues.requireScalar(c), not, ctx);
      case IN -> listSql(expr, "IN", FilterValues.members(c), not, ctx);
      case NIN -> listSql(expr, "NOT IN", FilterValues.members(c), not, ctx);
      case BETWEEN -> {
        FilterValues.requireBounds(c);
        yield rangeSql(expr, c.lower(), c.upper(), not, ctx);
      }
      case CONTAINS -> likeSql(expr, "%" + escapeLike(FilterValues.requireText(c)) + "%", not, ctx);
      case STARTS_WITH -> likeSql(expr, escapeLike(FilterValues.requireText(c)) + "%", not, ctx);
      case ENDS_WITH -> likeSql(expr, "%" + escapeLike(FilterValues.requireText(c)), not, ctx);
      case REGEX -> renderRegex(expr, FilterValues.requireText(c), not, ctx);
    };
  }

  /** Raw regular-expression match. Default throws; dialects with regex support override. */
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    throw new UnsupportedOperatorException(Operator.REGEX.tag(), "not supported by dialect " + id());
  }

  /** Escape clause appended to every LIKE; must declare {@link #likeEscapeChar()}. */
  protected String likeEscapeClause() {
    return " ESCAPE '\\'";
  }

  protected char likeEscapeChar() {
    return '\\';
  }

  protected final String escapeLike(String s) {
    char esc = likeEscapeChar();
    StringBuilder sb = new StringBuilder(s.length() + 8);
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '%' || ch == '_' || ch == esc) sb.append(esc);
      sb.append(ch);
    }
    return sb.toString();
  }

  private String likeSql(String expr, String pattern, boolean not, RenderCtx ctx) {
    String sql = expr + " LIKE " + ctx.add(pattern) + likeEscapeClause();
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(value);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String rangeSql(String expr, Object lower, Object upper, boolean not, RenderCtx ctx) {
    String p1 = ctx.add(lower);
    String p2 = ctx.add(upper);
    String sql = "(" + expr + " >= " + p1 + " AND " + expr + " <= " + p2 + ")";
    return not ? "NOT " + sql : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) {
      // empty IN matches nothing, empty NOT IN matches everything
      boolean matchesAll = op.equals("NOT IN") ^ not;
      return matchesAll ? "1 = 1" : "1 = 0";
    }
    List<String> ph = new ArrayList<>(vals.size());
    for (Object x : vals) ph.add(ctx.add(x));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  protected abstract String quoteIdent(String ident);
}
