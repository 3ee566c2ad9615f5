package io.intellixity.relata.persistence.exec;

import java.util.Objects;

/**
 * One column or document attribute reported by schema discovery.
 *
 * @param name attribute name as stored
 * @param type backend type name (SQL type, or the Java type of a sampled value); null when unknown
 */
public record FieldDescriptor(String name, String type) {
  public FieldDescriptor {
    Objects.requireNonNull(name, "name");
  }
}
