package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.error.MalformedFilterException;

/**
 * Reference to one field of one entity.
 * <p>
 * A null {@code entity} means "the root entity of the request"; {@link #on(String)} binds it.
 */
public record FieldRef(String entity, String field) {
  public static final String ALL = "*";

  public FieldRef {
    if (field == null || field.isBlank()) throw new MalformedFilterException("field must be non-blank");
    if (entity != null && entity.isBlank()) entity = null;
  }

  public static FieldRef of(String entity, String field) { return new FieldRef(entity, field); }

  /** Field on the root entity. */
  public static FieldRef root(String field) { return new FieldRef(null, field); }

  public boolean isAll() { return ALL.equals(field); }

  /** Entity this reference points at, falling back to {@code rootEntity}. */
  public String entityOr(String rootEntity) { return entity == null ? rootEntity : entity; }

  public FieldRef on(String rootEntity) {
    return entity != null ? this : new FieldRef(rootEntity, field);
  }

  @Override
  public String toString() { return entity == null ? field : entity + "." + field; }
}
