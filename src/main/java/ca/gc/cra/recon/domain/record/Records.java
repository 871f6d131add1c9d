package ca.gc.cra.recon.domain.record;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for JSON-like documents made of maps, lists, and scalars.
 *
 * @since 0.1.0
 */
public final class Records {
  /** Key under which every stored document keeps its identity. */
  public static final String ID = "_id";

  private Records() {
    // Utility
  }

  /**
   * Deep-copies a document so callers can mutate the copy without touching stored state.
   *
   * @param record document to copy
   * @return mutable copy preserving key order
   */
  public static Map<String, Object> deepCopy(Map<String, ?> record) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : record.entrySet()) {
      copy.put(entry.getKey(), copyValue(entry.getValue()));
    }
    return copy;
  }

  /**
   * Deep-copies any document value.
   *
   * @param value map, list, array, or scalar
   * @return mutable copy for containers, the value itself for immutable scalars
   */
  public static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(copyValue(element));
      }
      return copy;
    }
    if (value instanceof byte[] bytes) {
      return Arrays.copyOf(bytes, bytes.length);
    }
    return value;
  }

  /**
   * Returns the nested map stored at {@code key}, or an empty map when absent or not a map.
   *
   * @param record document
   * @param key direct child key
   * @return child map (live view when present)
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> child(Map<String, ?> record, String key) {
    Object value = record == null ? null : record.get(key);
    return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
  }

  /**
   * Returns the list stored at {@code key}, or an empty list when absent or not a list.
   *
   * @param record document
   * @param key direct child key
   * @return child list (live view when present)
   */
  @SuppressWarnings("unchecked")
  public static List<Object> list(Map<String, ?> record, String key) {
    Object value = record == null ? null : record.get(key);
    return value instanceof List<?> ? (List<Object>) value : List.of();
  }

  /**
   * Returns the maps contained in the list stored at {@code key}, skipping non-map members.
   *
   * @param record document
   * @param key direct child key
   * @return list of child documents
   */
  @SuppressWarnings("unchecked")
  public static List<Map<String, Object>> maps(Map<String, ?> record, String key) {
    List<Map<String, Object>> result = new ArrayList<>();
    for (Object element : list(record, key)) {
      if (element instanceof Map<?, ?>) {
        result.add((Map<String, Object>) element);
      }
    }
    return result;
  }
}
