package io.intellixity.relata.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;

/** Reads result sets into ordered, label-keyed row maps. */
final class JdbcRows {
  private JdbcRows() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 0; i < n; i++) row.put(labels[i], rs.getObject(i + 1));
      out.add(row);
    }
    return out;
  }

  /** First row keyed by the given names, by column position; all null when there is no row. */
  static Map<String, Object> readOne(ResultSet rs, List<String> names) throws SQLException {
    Map<String, Object> row = new LinkedHashMap<>();
    boolean present = rs.next();
    for (int i = 0; i < names.size(); i++) {
      row.put(names.get(i), present ? rs.getObject(i + 1) : null);
    }
    return row;
  }
}
