package io.intellixity.relata.persistence.jdbc.mysql;

import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;

/**
 * MySQL dialect implementation for JDBC.
 * <p>
 * Identifiers are backtick-quoted. Backslash is an escape inside MySQL string literals, so the
 * LIKE escape clause doubles it.
 */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "mysql"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String likeEscapeClause() {
    return " ESCAPE '\\\\'";
  }

  /** Case sensitivity follows the column collation. */
  @Override
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    return expr + (not ? " NOT REGEXP " : " REGEXP ") + ctx.add(pattern);
  }
}
