package ca.gc.cra.recon.domain.record;

import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Prunes records down to the requested dotted field paths.
 * <p><strong>Why:</strong> Aggregations and listings only need a few fields of large host documents.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge overlapping requests into a prefix tree where a whole-subtree request wins.</li>
 *   <li>Replicate array structure element by element for registered array paths.</li>
 *   <li>Always keep the record identity and omit absent fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built.</p>
 *
 * @since 0.1.0
 */
public final class RecordProjector {
  private final FieldSchema schema;
  private final Map<String, Object> tree;

  private RecordProjector(FieldSchema schema, Map<String, Object> tree) {
    this.schema = schema;
    this.tree = tree;
  }

  /**
   * Compiles a projection.
   *
   * @param schema array registry of the collection
   * @param fields requested dotted paths
   * @return projector
   */
  public static RecordProjector of(FieldSchema schema, Collection<String> fields) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> tree = new LinkedHashMap<>();
    for (String field : fields) {
      insert(tree, field.split("\\."));
    }
    return new RecordProjector(schema, tree);
  }

  /**
   * Copies the requested subtrees of a record.
   *
   * @param record source document, left untouched
   * @return new document holding only the requested fields and {@code _id}
   */
  public Map<String, Object> project(Map<String, Object> record) {
    Map<String, Object> result = extract(record, tree, "");
    if (record.containsKey(Records.ID)) {
      result.put(Records.ID, Records.copyValue(record.get(Records.ID)));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static void insert(Map<String, Object> tree, String[] segments) {
    Map<String, Object> current = tree;
    for (int i = 0; i < segments.length; i++) {
      String segment = segments[i];
      Object existing = current.get(segment);
      if (existing == Boolean.TRUE) {
        return;
      }
      if (i == segments.length - 1) {
        current.put(segment, Boolean.TRUE);
        return;
      }
      if (existing == null) {
        existing = new LinkedHashMap<String, Object>();
        current.put(segment, existing);
      }
      current = (Map<String, Object>) existing;
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> extract(Map<?, ?> record, Map<String, Object> wanted, String base) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : wanted.entrySet()) {
      String field = entry.getKey();
      if (!record.containsKey(field)) {
        continue;
      }
      Object value = record.get(field);
      if (entry.getValue() == Boolean.TRUE) {
        result.put(field, Records.copyValue(value));
        continue;
      }
      Map<String, Object> subtree = (Map<String, Object>) entry.getValue();
      String fullField = FieldSchema.join(base, field);
      if (schema.isList(fullField) && value instanceof List<?> list) {
        List<Object> copies = new ArrayList<>(list.size());
        for (Object element : list) {
          if (element instanceof Map<?, ?> map) {
            copies.add(extract(map, subtree, fullField));
          }
        }
        result.put(field, copies);
      } else if (value instanceof Map<?, ?> map) {
        result.put(field, extract(map, subtree, fullField));
      }
    }
    return result;
  }
}
