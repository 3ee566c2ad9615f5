package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.config.RelataConfig;
import io.intellixity.relata.persistence.enhance.ResultEnhancer;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.plan.JoinPlanner;
import io.intellixity.relata.persistence.plan.RootResolver;
import io.intellixity.relata.persistence.spi.exec.AbstractQueryEngine;
import io.intellixity.relata.persistence.spi.exec.QuerySession;
import io.intellixity.relata.persistence.spi.exec.RequestValidationStrategy;

/**
 * Tabular backend: renders SQL through a {@link JdbcDialect} and runs each request on one
 * connection borrowed from the caller's {@link JdbcHandle}.
 */
public final class JdbcQueryEngine extends AbstractQueryEngine<SqlStatement, JdbcHandle> {
  private final JdbcDialect dialect;

  public JdbcQueryEngine(JdbcDialect dialect, RelataConfig config) {
    super(dialect, config);
    this.dialect = dialect;
  }

  public JdbcQueryEngine(JdbcDialect dialect,
                         JoinPlanner planner,
                         RootResolver roots,
                         ResultEnhancer enhancer,
                         RequestValidationStrategy validation) {
    super(dialect, planner, roots, enhancer, validation);
    this.dialect = dialect;
  }

  @Override
  public String family() { return "jdbc"; }

  @Override
  protected QuerySession<SqlStatement> openSession(JdbcHandle handle) {
    return JdbcQuerySession.open(handle, dialect);
  }
}
