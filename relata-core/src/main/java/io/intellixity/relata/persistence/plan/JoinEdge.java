package io.intellixity.relata.persistence.plan;

/**
 * One hop of a join chain, oriented away from the root.
 * <p>
 * {@code localField} belongs to {@code from}; {@code foreignField} belongs to {@code to}.
 */
public record JoinEdge(String from, String to, String localField, String foreignField) {
  @Override
  public String toString() {
    return from + "." + localField + " -> " + to + "." + foreignField;
  }
}
