package io.intellixity.relata.persistence.mongo;

import io.intellixity.relata.persistence.config.RelataConfig;
import io.intellixity.relata.persistence.enhance.ResultEnhancer;
import io.intellixity.relata.persistence.plan.JoinPlanner;
import io.intellixity.relata.persistence.plan.RootResolver;
import io.intellixity.relata.persistence.spi.exec.AbstractQueryEngine;
import io.intellixity.relata.persistence.spi.exec.QuerySession;
import io.intellixity.relata.persistence.spi.exec.RequestValidationStrategy;

/**
 * Mongo backend engine using the official MongoDB Java sync driver.
 * <p>
 * Every request runs as aggregation pipelines over the root collection inside one client session.
 */
public final class MongoQueryEngine extends AbstractQueryEngine<MongoStatement, MongoHandle> {
  private final MongoDialect dialect;

  public MongoQueryEngine(RelataConfig config) {
    this(new MongoDialect(), config);
  }

  public MongoQueryEngine(MongoDialect dialect, RelataConfig config) {
    super(dialect, config);
    this.dialect = dialect;
  }

  public MongoQueryEngine(MongoDialect dialect,
                          JoinPlanner planner,
                          RootResolver roots,
                          ResultEnhancer enhancer,
                          RequestValidationStrategy validation) {
    super(dialect, planner, roots, enhancer, validation);
    this.dialect = dialect;
  }

  @Override
  public String family() { return "mongo"; }

  @Override
  protected QuerySession<MongoStatement> openSession(MongoHandle handle) {
    return MongoQuerySession.open(handle, dialect);
  }
}
