package io.intellixity.relata.persistence.graph;

/**
 * Undirected link between two entities.
 * <p>
 * {@code localKey} is a field of {@code from}; {@code foreignKey} is a field of {@code to}.
 */
public record Relation(String from, String to, String localKey, String foreignKey) {
  public Relation {
    requireName(from, "from");
    requireName(to, "to");
    requireName(localKey, "localKey");
    requireName(foreignKey, "foreignKey");
    if (from.equals(to)) throw new IllegalArgumentException("Relation must connect two distinct entities: " + from);
  }

  public boolean touches(String entity) {
    return from.equals(entity) || to.equals(entity);
  }

  public boolean connects(String a, String b) {
    return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
  }

  /** The entity on the other end; {@code entity} must be one of the two ends. */
  public String other(String entity) {
    if (from.equals(entity)) return to;
    if (to.equals(entity)) return from;
    throw new IllegalArgumentException("Entity '" + entity + "' is not part of " + this);
  }

  private static void requireName(String s, String what) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("Relation." + what + " must be non-blank");
  }
}
