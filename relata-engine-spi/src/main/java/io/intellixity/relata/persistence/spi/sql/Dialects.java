package io.intellixity.relata.persistence.spi.sql;

import io.intellixity.relata.persistence.util.RelataFactoriesLoader;

import java.util.ArrayList;
import java.util.List;

/** Dialect discovery through {@code META-INF/relata.factories}. */
public final class Dialects {
  private Dialects() {}

  public static List<Dialect<?>> discovered() {
    List<Dialect<?>> out = new ArrayList<>();
    for (Dialect<?> d : RelataFactoriesLoader.load(Dialect.class)) out.add(d);
    return out;
  }

  /** The discovered dialect with the given id, checked against the expected dialect type. */
  public static <D extends Dialect<?>> D byId(String id, Class<D> type) {
    List<String> seen = new ArrayList<>();
    for (Dialect<?> d : discovered()) {
      if (d.id().equalsIgnoreCase(id)) {
        if (!type.isInstance(d)) {
          throw new IllegalStateException("Dialect '" + id + "' is a " + d.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(d);
      }
      seen.add(d.id());
    }
    throw new IllegalArgumentException("No dialect with id '" + id + "' (available: " + seen + ")");
  }
}
