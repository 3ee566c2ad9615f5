package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.spi.sql.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** SQL text with {@code ?} placeholders and the parameters to bind, in placeholder order. */
public record SqlStatement(String sql, List<Object> params) implements NativeStatement {
  public SqlStatement {
    // IN lists may carry nulls, which List.copyOf rejects
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  @Override
  public String describe() {
    return sql + " [params=" + params.size() + "]";
  }
}
