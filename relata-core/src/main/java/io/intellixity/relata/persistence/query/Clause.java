package io.intellixity.relata.persistence.query;

public enum Clause {
  AND,
  OR;

  public Clause flip() { return this == AND ? OR : AND; }
}
