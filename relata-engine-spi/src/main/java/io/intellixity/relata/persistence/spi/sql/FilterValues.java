package io.intellixity.relata.persistence.spi.sql;

import io.intellixity.relata.persistence.error.MalformedFilterException;
import io.intellixity.relata.persistence.query.Condition;

import java.lang.reflect.Array;
import java.util.*;

/** Shape checks shared by filter translators. */
public final class FilterValues {
  private FilterValues() {}

  /** Members of an {@code in}/{@code nin} value, which must be a collection or an array. */
  public static List<Object> members(Condition c) {
    Object v = c.value();
    if (v instanceof Collection<?> col) return new ArrayList<>(col);
    if (v != null && v.getClass().isArray()) {
      int n = Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(v, i));
      return out;
    }
    throw new MalformedFilterException(c.operator().tag() + " on '" + c.field() + "' requires an array value");
  }

  public static Object requireScalar(Condition c) {
    if (c.value() == null) throw new MalformedFilterException(c.operator().tag() + " on '" + c.field() + "' requires a non-null value");
    return scalarOrNull(c);
  }

  /** Equality values: a scalar, or null for the missing/null test. */
  public static Object scalarOrNull(Condition c) {
    Object v = c.value();
    if (v instanceof Collection<?> || v instanceof Map<?, ?> || (v != null && v.getClass().isArray())) {
      throw new MalformedFilterException(c.operator().tag() + " on '" + c.field() + "' requires a scalar value");
    }
    return v;
  }

  public static String requireText(Condition c) {
    if (!(c.value() instanceof CharSequence s)) {
      throw new MalformedFilterException(c.operator().tag() + " on '" + c.field() + "' requires a string value");
    }
    return s.toString();
  }

  public static void requireBounds(Condition c) {
    if (c.lower() == null || c.upper() == null) {
      throw new MalformedFilterException("between on '" + c.field() + "' requires both lower and upper bounds");
    }
  }
}
