package io.intellixity.relata.persistence.enhance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Adds readable labels (and selected attributes) of referenced records to result rows.
 * <p>
 * One lookup per referenced entity and page. Rows are never dropped or reordered, input maps are
 * not mutated, and a failed lookup leaves the affected rows undecorated.
 */
public final class ResultEnhancer {
  private static final Logger log = LoggerFactory.getLogger(ResultEnhancer.class);

  private final List<ReferenceDef> references;

  public ResultEnhancer(List<ReferenceDef> references) {
    this.references = List.copyOf(references == null ? List.of() : references);
  }

  public static ResultEnhancer none() { return new ResultEnhancer(List.of()); }

  public List<ReferenceDef> references() { return references; }

  public List<Map<String, Object>> enhance(List<Map<String, Object>> rows, ReferenceLookup lookup) {
    if (rows == null || rows.isEmpty()) return List.of();
    if (references.isEmpty() || lookup == null) return rows;

    // (entity, idField) -> normalized id -> raw id as found in the rows
    Map<Target, Map<Object, Object>> wanted = new LinkedHashMap<>();
    for (ReferenceDef def : references) {
      Map<Object, Object> ids = wanted.computeIfAbsent(new Target(def.entity(), def.idField()), k -> new LinkedHashMap<>());
      for (Map<String, Object> row : rows) {
        Object raw = row.get(def.keyField());
        if (raw != null) ids.putIfAbsent(normalizeId(raw), raw);
      }
    }

    Map<Target, Map<Object, Map<String, Object>>> found = new HashMap<>();
    for (Map.Entry<Target, Map<Object, Object>> e : wanted.entrySet()) {
      Target t = e.getKey();
      if (e.getValue().isEmpty()) continue;
      try {
        List<Map<String, Object>> records = lookup.findByIds(t.entity(), t.idField(), List.copyOf(e.getValue().values()));
        Map<Object, Map<String, Object>> byId = new HashMap<>();
        for (Map<String, Object> rec : records == null ? List.<Map<String, Object>>of() : records) {
          Object id = rec.get(t.idField());
          if (id != null) byId.putIfAbsent(normalizeId(id), rec);
        }
        found.put(t, byId);
        log.debug("relata.enhance entity={} ids={} found={}", t.entity(), e.getValue().size(), byId.size());
      } catch (RuntimeException ex) {
        log.warn("relata.enhance lookup failed entity={} ids={}; rows left undecorated", t.entity(), e.getValue().size(), ex);
      }
    }

    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> copy = new LinkedHashMap<>(row);
      for (ReferenceDef def : references) {
        Object raw = row.get(def.keyField());
        if (raw == null) continue;
        Map<Object, Map<String, Object>> byId = found.get(new Target(def.entity(), def.idField()));
        if (byId == null) continue;
        Map<String, Object> rec = byId.get(normalizeId(raw));
        if (rec == null) continue;
        copy.put(def.labelField(), label(def, rec, raw));
        for (Map.Entry<String, String> x : def.extraFields().entrySet()) {
          if (rec.containsKey(x.getKey())) copy.put(x.getValue(), rec.get(x.getKey()));
        }
      }
      out.add(copy);
    }
    return out;
  }

  private static Object label(ReferenceDef def, Map<String, Object> rec, Object raw) {
    for (String c : def.labelCandidates()) {
      Object v = rec.get(c);
      if (v != null) return v;
    }
    Object id = rec.get(def.idField());
    return id != null ? id : raw;
  }

  /** Numbers compare by value (Integer 7 equals Long 7); everything else by its string form. */
  static Object normalizeId(Object id) {
    if (id instanceof Byte || id instanceof Short || id instanceof Integer || id instanceof Long) {
      return ((Number) id).longValue();
    }
    if (id instanceof BigInteger bi) {
      return bi.bitLength() < 64 ? (Object) bi.longValue() : bi;
    }
    if (id instanceof Number n) {
      if (Double.isNaN(n.doubleValue()) || Double.isInfinite(n.doubleValue())) return String.valueOf(id);
      BigDecimal d = new BigDecimal(n.toString()).stripTrailingZeros();
      if (d.scale() <= 0 && d.precision() - d.scale() < 19) return d.longValueExact();
      return d;
    }
    return String.valueOf(id);
  }

  private record Target(String entity, String idField) {}
}
