package io.intellixity.relata.persistence.exec.handle;

/**
 * Externally owned backend handle passed to every query call.
 * <p>
 * JDBC: {@code client()} is a {@code javax.sql.DataSource}, {@code namespace()} the schema (may be null).
 * Mongo: {@code client()} is a {@code MongoClient}, {@code namespace()} the database.
 */
public interface EngineHandle<TClient> {
  /** Identifier used in log lines. */
  String id();

  TClient client();

  String namespace();
}
