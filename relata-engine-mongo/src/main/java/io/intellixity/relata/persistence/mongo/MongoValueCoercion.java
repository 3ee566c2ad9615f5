package io.intellixity.relata.persistence.mongo;

import org.bson.types.ObjectId;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns request strings into the BSON types documents actually store.
 * <p>
 * Order: 24-hex string to {@link ObjectId}, ISO date or date-time to {@link Date} (UTC when no
 * offset is given), numeric string to {@link Long} or {@link Double}. Anything else is returned
 * unchanged.
 */
final class MongoValueCoercion {
  private static final Pattern DATE = Pattern.compile(
      "^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:\\d{2})?)?$");
  private static final Pattern INTEGRAL = Pattern.compile("^[+-]?\\d+$");
  private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?$");

  private MongoValueCoercion() {}

  static Object coerce(Object v) {
    if (!(v instanceof String s)) return v;
    String t = s.trim();
    if (t.isEmpty()) return v;
    if (ObjectId.isValid(t)) return new ObjectId(t);
    if (DATE.matcher(t).matches()) {
      Date d = parseDate(t);
      return d == null ? v : d;
    }
    if (INTEGRAL.matcher(t).matches()) {
      try {
        return Long.parseLong(t);
      } catch (NumberFormatException tooLong) {
        return Double.parseDouble(t);
      }
    }
    if (DECIMAL.matcher(t).matches()) return Double.parseDouble(t);
    return v;
  }

  static List<Object> coerceAll(Collection<?> values) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(coerce(v));
    return out;
  }

  /**
   * Values to match a key against: each raw id, plus its {@link ObjectId} form when it is a
   * 24-hex string, so keys stored either way are found.
   */
  static List<Object> idCandidates(Collection<?> ids) {
    LinkedHashSet<Object> out = new LinkedHashSet<>();
    for (Object id : ids) {
      if (id == null) continue;
      out.add(id);
      if (id instanceof String s && ObjectId.isValid(s)) out.add(new ObjectId(s));
    }
    return new ArrayList<>(out);
  }

  /** Null when the text has the shape of a date but is not a valid one (e.g. month 13). */
  private static Date parseDate(String t) {
    try {
      if (t.length() == 10) {
        return Date.from(LocalDate.parse(t).atStartOfDay(ZoneOffset.UTC).toInstant());
      }
      if (t.endsWith("Z") || t.lastIndexOf('+') > 10 || t.lastIndexOf('-') > 10) {
        return Date.from(OffsetDateTime.parse(t).toInstant());
      }
      return Date.from(LocalDateTime.parse(t).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
