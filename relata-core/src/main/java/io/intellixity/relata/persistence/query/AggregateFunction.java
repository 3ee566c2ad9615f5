package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.error.UnsupportedOperatorException;

public enum AggregateFunction {
  SUM("sum"),
  AVG("avg"),
  MIN("min"),
  MAX("max"),
  COUNT("count");

  private final String tag;

  AggregateFunction(String tag) { this.tag = tag; }

  public String tag() { return tag; }

  public static AggregateFunction tryTag(String tag) {
    if (tag == null) return null;
    String t = tag.trim();
    for (AggregateFunction f : values()) {
      if (f.tag.equalsIgnoreCase(t)) return f;
    }
    return null;
  }

  public static AggregateFunction fromTag(String tag) {
    AggregateFunction f = tryTag(tag);
    if (f == null) throw new UnsupportedOperatorException(tag);
    return f;
  }
}
