package io.intellixity.relata.persistence.spi.sql;

/** Backend-native statement produced by a {@link Dialect}: SQL with parameters, a Mongo pipeline, ... */
public interface NativeStatement {
  /** Human-readable rendering for logs and explain output; never includes bound values. */
  String describe();
}
