package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.spi.sql.Dialect;

import java.util.Collection;

/** JDBC-family dialect. */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** {@code SELECT * FROM entity WHERE idField IN (...)} for reference enhancement. */
  SqlStatement renderLookup(String entity, String idField, Collection<?> ids);
}
