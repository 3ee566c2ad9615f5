package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.config.RelataConfig;
import io.intellixity.relata.persistence.enhance.ResultEnhancer;
import io.intellixity.relata.persistence.error.BackendExecutionException;
import io.intellixity.relata.persistence.error.RelataException;
import io.intellixity.relata.persistence.exec.FieldDescriptor;
import io.intellixity.relata.persistence.exec.QueryEngine;
import io.intellixity.relata.persistence.exec.QueryResult;
import io.intellixity.relata.persistence.exec.handle.EngineHandle;
import io.intellixity.relata.persistence.plan.JoinPlanner;
import io.intellixity.relata.persistence.plan.QueryPlan;
import io.intellixity.relata.persistence.plan.RootResolver;
import io.intellixity.relata.persistence.query.QueryRequest;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import io.intellixity.relata.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Template-method orchestrator for declarative queries.
 * <p>
 * Per call: resolve the root, validate, plan the joins, render the detail statement (and the
 * aggregate statement when aggregations are requested), then open one {@link QuerySession} from
 * the caller's handle to run both statements and the enhancement lookups. Backend failures surface
 * as {@link BackendExecutionException}; request errors propagate unchanged.
 */
public abstract class AbstractQueryEngine<S extends NativeStatement, H extends EngineHandle<?>> implements QueryEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractQueryEngine.class);

  private final Dialect<S> dialect;
  private final JoinPlanner planner;
  private final RootResolver roots;
  private final ResultEnhancer enhancer;
  private final RequestValidationStrategy validation;

  protected AbstractQueryEngine(Dialect<S> dialect,
                                JoinPlanner planner,
                                RootResolver roots,
                                ResultEnhancer enhancer,
                                RequestValidationStrategy validation) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.roots = (roots == null) ? new RootResolver(null) : roots;
    this.enhancer = (enhancer == null) ? ResultEnhancer.none() : enhancer;
    this.validation = (validation == null) ? new DefaultRequestValidationStrategy() : validation;
  }

  protected AbstractQueryEngine(Dialect<S> dialect, RelataConfig config) {
    this(dialect,
        Objects.requireNonNull(config, "config").joinPlanner(),
        config.rootResolver(),
        config.resultEnhancer(),
        new DefaultRequestValidationStrategy());
  }

  /** Opens the per-request session; the engine closes it. */
  protected abstract QuerySession<S> openSession(H handle);

  protected final Dialect<S> dialect() { return dialect; }
  protected final JoinPlanner planner() { return planner; }

  /** Plans and renders without touching the backend. */
  public final PreparedQuery<S> prepare(QueryRequest request) {
    Objects.requireNonNull(request, "request");
    String root = roots.resolve(request);
    validation.validate(root, request.filter(), request.aggregations());
    QueryPlan plan = planner.plan(root, request.filter(), request.aggregations());
    S detail = dialect.renderSelect(plan, request.filter());
    S aggregate = request.hasAggregations()
        ? dialect.renderAggregate(plan, request.filter(), request.aggregations())
        : null;
    return new PreparedQuery<>(plan, request.filter(), request.aggregations(), detail, aggregate);
  }

  @Override
  public final QueryResult execute(H handle, QueryRequest request) {
    Objects.requireNonNull(handle, "handle");
    PreparedQuery<S> pq = prepare(request);
    QueryPlan plan = pq.plan();

    List<Map<String, Object>> rows;
    List<Map<String, Object>> aggregateRows = List.of();
    try (QuerySession<S> session = openSession(handle)) {
      rows = session.select(pq.detail());
      if (pq.hasAggregate()) {
        aggregateRows = List.of(session.aggregate(pq.aggregate(), pq.aggregations()));
      }
      rows = enhancer.enhance(rows, session);
    } catch (RelataException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("relata.exec failed family={} dialect={} handle={} root={}", family(), dialect.id(), handle.id(), plan.rootEntity(), e);
      throw new BackendExecutionException(e);
    }

    log.debug("relata.exec family={} handle={} root={} joins={} rows={} aggregates={}",
        family(), handle.id(), plan.rootEntity(), plan.joins().size(), rows.size(), aggregateRows.size());
    return new QueryResult(plan.rootEntity(), plan.joins(), plan.projection(), rows, aggregateRows, pq.aggregations());
  }

  @Override
  public final List<String> entities(H handle) {
    Objects.requireNonNull(handle, "handle");
    return inSession(handle, "entities", QuerySession::entities);
  }

  @Override
  public final List<FieldDescriptor> fields(H handle, String entity) {
    Objects.requireNonNull(handle, "handle");
    if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity must be non-blank");
    return inSession(handle, "fields", s -> s.fields(entity));
  }

  private <T> T inSession(H handle, String op, Function<QuerySession<S>, T> call) {
    try (QuerySession<S> session = openSession(handle)) {
      return call.apply(session);
    } catch (RelataException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("relata.exec failed op={} family={} handle={}", op, family(), handle.id(), e);
      throw new BackendExecutionException(e);
    }
  }
}
