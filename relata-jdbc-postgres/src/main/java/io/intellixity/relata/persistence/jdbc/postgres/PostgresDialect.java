package io.intellixity.relata.persistence.jdbc.postgres;

import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;

/**
 * Postgres dialect implementation for JDBC.
 * <p>
 * Keeps only Postgres-specific overrides; generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** POSIX match, case-sensitive. */
  @Override
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    return expr + (not ? " !~ " : " ~ ") + ctx.add(pattern);
  }
}
