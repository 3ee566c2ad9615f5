package io.intellixity.relata.persistence.enhance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A foreign-key column of result rows whose referenced record should be inlined.
 *
 * @param keyField        row attribute holding the foreign key (e.g. {@code customer_id})
 * @param entity          referenced table or collection
 * @param idField         key attribute of the referenced entity
 * @param labelField      row attribute receiving the readable label, default {@code <entity>_name}
 * @param labelCandidates referenced attributes tried in order for the label, default name, title, label
 * @param extraFields     referenced attribute to row attribute copies (e.g. region to customer_region)
 */
public record ReferenceDef(String keyField, String entity, String idField, String labelField,
                           List<String> labelCandidates, Map<String, String> extraFields) {
  public static final List<String> DEFAULT_LABEL_CANDIDATES = List.of("name", "title", "label");

  public ReferenceDef {
    if (keyField == null || keyField.isBlank()) throw new IllegalArgumentException("ReferenceDef.keyField must be non-blank");
    if (entity == null || entity.isBlank()) throw new IllegalArgumentException("ReferenceDef.entity must be non-blank");
    if (idField == null || idField.isBlank()) idField = "id";
    if (labelField == null || labelField.isBlank()) labelField = entity + "_name";
    labelCandidates = List.copyOf(labelCandidates == null || labelCandidates.isEmpty() ? DEFAULT_LABEL_CANDIDATES : labelCandidates);
    extraFields = extraFields == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
  }

  public static ReferenceDef of(String keyField, String entity, String idField) {
    return new ReferenceDef(keyField, entity, idField, null, null, null);
  }

  public ReferenceDef withExtra(String source, String target) {
    Map<String, String> m = new LinkedHashMap<>(extraFields);
    m.put(source, target);
    return new ReferenceDef(keyField, entity, idField, labelField, labelCandidates, m);
  }
}
