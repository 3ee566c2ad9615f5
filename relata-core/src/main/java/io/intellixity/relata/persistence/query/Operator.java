package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.error.UnsupportedOperatorException;

import java.util.Locale;

/**
 * Closed set of filter operators.
 * <p>
 * Aggregation functions are a separate type ({@link AggregateFunction}); an aggregation tag can
 * never reach a filter translator.
 */
public enum Operator {
  EQ("eq", Kind.COMPARISON),
  NE("ne", Kind.COMPARISON),
  GT("gt", Kind.COMPARISON),
  GTE("gte", Kind.COMPARISON),
  LT("lt", Kind.COMPARISON),
  LTE("lte", Kind.COMPARISON),

  IN("in", Kind.MEMBERSHIP),
  NIN("nin", Kind.MEMBERSHIP),

  BETWEEN("between", Kind.RANGE),

  CONTAINS("contains", Kind.PATTERN),
  STARTS_WITH("startsWith", Kind.PATTERN),
  ENDS_WITH("endsWith", Kind.PATTERN),
  REGEX("regex", Kind.PATTERN);

  public enum Kind { COMPARISON, MEMBERSHIP, RANGE, PATTERN }

  private final String tag;
  private final Kind kind;

  Operator(String tag, Kind kind) {
    this.tag = tag;
    this.kind = kind;
  }

  /** External name used in JSON requests. */
  public String tag() { return tag; }
  public Kind kind() { return kind; }

  /** Lenient lookup; returns null for unknown tags. Accepts tags and enum names case-insensitively. */
  public static Operator tryTag(String tag) {
    if (tag == null) return null;
    String t = tag.trim();
    for (Operator op : values()) {
      if (op.tag.equalsIgnoreCase(t) || op.name().equalsIgnoreCase(t)) return op;
    }
    switch (t.toLowerCase(Locale.ROOT)) {
      case "equal": case "equals": return EQ;
      case "notequal": case "notequals": return NE;
      case "greaterthan": return GT;
      case "ge": case "greaterthanorequal": case "greaterthanorequals": return GTE;
      case "lessthan": return LT;
      case "le": case "lessthanorequal": case "lessthanorequals": return LTE;
      case "notin": case "not_in": case "not-in": return NIN;
      case "range": return BETWEEN;
      default: return null;
    }
  }

  public static Operator fromTag(String tag) {
    Operator op = tryTag(tag);
    if (op == null) throw new UnsupportedOperatorException(tag);
    return op;
  }
}
