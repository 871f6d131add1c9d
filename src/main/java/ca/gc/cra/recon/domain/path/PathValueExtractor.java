package ca.gc.cra.recon.domain.path;

import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Resolves a dotted path against a record and streams every value it reaches.
 * <p><strong>Why:</strong> Records nest arrays at several levels ({@code ports.scripts.vulns.id}); a single
 * registry-driven descent keeps filtering, aggregation, and distinct-value queries consistent.</p>
 * <p><strong>Role:</strong> Domain service shared by the filter evaluator and the query services.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map over every registered array level and flatten the results.</li>
 *   <li>Yield nothing for missing branches instead of failing.</li>
 *   <li>Optionally pair each value with a weight read from a count field.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; returned streams are single-use.</p>
 * <p><strong>Performance:</strong> Lazy; elements are produced as the stream is consumed.</p>
 *
 * @since 0.1.0
 */
public final class PathValueExtractor {
  private final FieldSchema schema;

  /**
   * Creates an extractor bound to a collection's array registry.
   *
   * @param schema array path registry
   */
  public PathValueExtractor(FieldSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public FieldSchema schema() {
    return schema;
  }

  /**
   * Streams all values reached by {@code path} from the record root.
   *
   * @param record record or sub-document
   * @param path dotted path
   * @return lazy stream of values, empty when the path is absent
   */
  public Stream<Object> values(Object record, String path) {
    return values(record, "", path);
  }

  /**
   * Streams all values reached by {@code path} from a nested node.
   *
   * @param node sub-document located at {@code base}
   * @param base full dotted path of {@code node} from the record root, empty for the root itself
   * @param path dotted path relative to {@code node}
   * @return lazy stream of values, empty when the path is absent
   */
  public Stream<Object> values(Object node, String base, String path) {
    Objects.requireNonNull(path, "path");
    return descend(node, base == null ? "" : base, path, null, null).map(Weighted::value);
  }

  /**
   * Streams values paired with the count read from {@code countField}.
   *
   * <p>While the count field shares the array prefix being walked, the weight is read from the same array
   * element that produced the value; otherwise it is read once from the enclosing document. Missing
   * counts weigh {@code 1}.</p>
   *
   * @param record record root
   * @param path dotted path of the values
   * @param countField dotted path of the weight
   * @return lazy stream of weighted values
   */
  public Stream<Weighted> weightedValues(Object record, String path, String countField) {
    Objects.requireNonNull(countField, "countField");
    return descend(record, "", path, countField, null);
  }

  /**
   * Streams values all carrying the same explicit weight.
   *
   * @param record record root
   * @param path dotted path of the values
   * @param weight weight to attach to every value
   * @return lazy stream of weighted values
   */
  public Stream<Weighted> weightedValues(Object record, String path, long weight) {
    return descend(record, "", path, null, null).map(w -> new Weighted(w.value(), weight));
  }

  /**
   * Plain nested lookup that does not cross arrays.
   *
   * @param node document
   * @param path dotted path
   * @return the value, or {@code null} when any segment is missing or not a map
   */
  public static Object lookup(Object node, String path) {
    Object current = node;
    int start = 0;
    while (current instanceof Map<?, ?> map) {
      int dot = path.indexOf('.', start);
      String segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
      current = map.get(segment);
      if (dot < 0) {
        return current;
      }
      start = dot + 1;
    }
    return null;
  }

  /**
   * Indicates whether a plain nested lookup finds a key, even one mapped to {@code null}.
   *
   * @param node document
   * @param path dotted path
   * @return {@code true} when the last segment is a present key
   */
  public static boolean containsPath(Object node, String path) {
    int dot = path.lastIndexOf('.');
    Object parent = dot < 0 ? node : lookup(node, path.substring(0, dot));
    return parent instanceof Map<?, ?> map && map.containsKey(path.substring(dot + 1));
  }

  private Stream<Weighted> descend(Object node, String base, String path, String countField, Long countValue) {
    if (!(node instanceof Map<?, ?> record)) {
      return Stream.empty();
    }
    int dot = path.indexOf('.');
    if (dot < 0) {
      if (!record.containsKey(path)) {
        return Stream.empty();
      }
      Object value = record.get(path);
      long weight = countValue != null ? countValue : countField != null ? countOf(record, countField) : 1L;
      if (schema.isList(FieldSchema.join(base, path)) && value instanceof List<?> list) {
        return list.stream().map(element -> new Weighted(element, weight));
      }
      return Stream.of(new Weighted(value, weight));
    }
    String head = path.substring(0, dot);
    String rest = path.substring(dot + 1);
    if (!record.containsKey(head)) {
      return Stream.empty();
    }
    String nextCountField = countField;
    Long nextCountValue = countValue;
    if (countField != null) {
      if (countField.startsWith(head + '.')) {
        nextCountField = countField.substring(head.length() + 1);
      } else {
        nextCountValue = countOf(record, countField);
        nextCountField = null;
      }
    }
    Object child = record.get(head);
    String childBase = FieldSchema.join(base, head);
    String finalCountField = nextCountField;
    Long finalCountValue = nextCountValue;
    if (schema.isList(childBase) && child instanceof List<?> list) {
      return list.stream()
          .flatMap(element -> descend(element, childBase, rest, finalCountField, finalCountValue));
    }
    return descend(child, childBase, rest, finalCountField, finalCountValue);
  }

  private static long countOf(Map<?, ?> record, String countField) {
    Object count = lookup(record, countField);
    if (count instanceof Number number) {
      return number.longValue();
    }
    return 1L;
  }
}
