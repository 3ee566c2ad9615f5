package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.error.BackendExecutionException;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.query.AggregateFunction;
import io.intellixity.relata.persistence.query.AggregationOp;
import io.intellixity.relata.persistence.spi.exec.QuerySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/** One borrowed {@link Connection} serving every statement of a single request. */
final class JdbcQuerySession implements QuerySession<SqlStatement> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQuerySession.class);
  private static final Set<String> ENTITY_TYPES = Set.of("TABLE", "BASE TABLE", "PARTITIONED TABLE", "VIEW");

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final Connection conn;

  private JdbcQuerySession(JdbcHandle handle, JdbcDialect dialect, Connection conn) {
    this.handle = handle;
    this.dialect = dialect;
    this.conn = conn;
  }

  static JdbcQuerySession open(JdbcHandle handle, JdbcDialect dialect) {
    Connection c = null;
    try {
      c = handle.client().getConnection();
      if (handle.schema() != null) c.setSchema(handle.schema());
      return new JdbcQuerySession(handle, dialect, c);
    } catch (SQLException e) {
      closeQuietly(c, e);
      throw failure("OPEN", handle, null, e);
    }
  }

  @Override
  public List<Map<String, Object>> select(SqlStatement stmt) {
    return run("SELECT", stmt, JdbcRows::readAll);
  }

  @Override
  public Map<String, Object> aggregate(SqlStatement stmt, List<AggregationOp> aggregations) {
    List<String> aliases = new ArrayList<>(aggregations.size());
    for (AggregationOp op : aggregations) aliases.add(op.alias());
    Map<String, Object> row = run("AGGREGATE", stmt, rs -> JdbcRows.readOne(rs, aliases));
    for (AggregationOp op : aggregations) {
      // COUNT is never null in SQL; keep it that way when the driver returns no row
      if (op.function() == AggregateFunction.COUNT && row.get(op.alias()) == null) row.put(op.alias(), 0L);
    }
    return row;
  }

  @Override
  public List<Map<String, Object>> findByIds(String entity, String idField, Collection<Object> ids) {
    if (ids == null || ids.isEmpty()) return List.of();
    return run("LOOKUP", dialect.renderLookup(entity, idField, ids), JdbcRows::readAll);
  }

  @Override
  public List<String> entities() {
    debugMeta("ENTITIES", null);
    try {
      DatabaseMetaData md = conn.getMetaData();
      List<String> out = new ArrayList<>();
      try (ResultSet rs = md.getTables(conn.getCatalog(), schemaPattern(), "%", null)) {
        while (rs.next()) {
          String type = rs.getString("TABLE_TYPE");
          if (type != null && ENTITY_TYPES.contains(type.toUpperCase(Locale.ROOT))) out.add(rs.getString("TABLE_NAME"));
        }
      }
      Collections.sort(out);
      return out;
    } catch (SQLException e) {
      throw failure("ENTITIES", handle, null, e);
    }
  }

  @Override
  public List<FieldDescriptor> fields(String entity) {
    debugMeta("FIELDS", entity);
    try {
      DatabaseMetaData md = conn.getMetaData();
      List<FieldDescriptor> out = new ArrayList<>();
      String table = escapePattern(entity, md.getSearchStringEscape());
      try (ResultSet rs = md.getColumns(conn.getCatalog(), schemaPattern(), table, "%")) {
        while (rs.next()) out.add(new FieldDescriptor(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
      }
      return out;
    } catch (SQLException e) {
      throw failure("FIELDS", handle, null, e);
    }
  }

  @Override
  public void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      throw failure("CLOSE", handle, null, e);
    }
  }

  private interface Reader<T> {
    T read(ResultSet rs) throws SQLException;
  }

  private <T> T run(String op, SqlStatement ss, Reader<T> reader) {
    long start = System.nanoTime();
    debugSql(op, ss);
    try (PreparedStatement ps = conn.prepareStatement(ss.sql())) {
      for (int i = 0; i < ss.params().size(); i++) ps.setObject(i + 1, ss.params().get(i));
      try (ResultSet rs = ps.executeQuery()) {
        T out = reader.read(rs);
        if (log.isDebugEnabled()) {
          log.debug("relata.jdbc_done op={} durationMs={} result={}", op, (System.nanoTime() - start) / 1_000_000.0, safeResult(out));
        }
        return out;
      }
    } catch (SQLException e) {
      throw failure(op, handle, ss, e);
    }
  }

  private static BackendExecutionException failure(String op, JdbcHandle h, SqlStatement ss, SQLException e) {
    log.error("relata.jdbc failed op={} handleId={} sqlState={} sql={}",
        op, h.id(), e.getSQLState(), ss == null ? "-" : ss.sql(), e);
    return new BackendExecutionException(e);
  }

  private static void closeQuietly(Connection c, SQLException primary) {
    if (c == null) return;
    try {
      c.close();
    } catch (SQLException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }

  private String schemaPattern() throws SQLException {
    return handle.schema() != null ? handle.schema() : conn.getSchema();
  }

  /** Metadata name arguments are LIKE patterns; {@code _} in a table name must match literally. */
  private static String escapePattern(String name, String esc) {
    if (esc == null || esc.isEmpty()) return name;
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      if (ch == '_' || ch == '%') sb.append(esc);
      sb.append(ch);
    }
    return sb.toString();
  }

  private void debugMeta(String op, String entity) {
    log.debug("relata.jdbc op={} handleId={} schema={} entity={}", op, handle.id(), handle.schema(), entity);
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc op={} dialect={} paramCount={} handleId={} schema={} sql={}",
        op, dialect.id(), ss.params().size(), handle.id(), handle.schema(), ss.sql());

    // TRACE: parameter summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("relata.jdbc param index={} valueType={} valueLen={}", idx++, vType, vLen);
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
