package ca.gc.cra.recon.application.topvalues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ranked value of a top-values aggregation.
 *
 * @param value aggregated value after the pseudo-field's output step
 * @param count number of occurrences (or summed weight)
 * @since 0.1.0
 */
public record TopValue(Object value, long count) {

  /**
   * Renders the entry as a {@code {_id, count}} document.
   *
   * @return new mutable map
   */
  public Map<String, Object> toDocument() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("_id", value);
    document.put("count", count);
    return document;
  }
}
