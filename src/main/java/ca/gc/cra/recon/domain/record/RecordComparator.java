package ca.gc.cra.recon.domain.record;

import ca.gc.cra.recon.domain.path.PathValueExtractor;
import ca.gc.cra.recon.domain.path.Values;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-key record ordering.
 *
 * <p>Keys are tried in order and the first one that differs decides. A missing or {@code null} value is
 * lower than any present value when ascending and higher when descending. Combine with a stable sort such
 * as {@link List#sort(Comparator)} so fully tied records keep their original order.</p>
 *
 * @since 0.1.0
 */
public final class RecordComparator implements Comparator<Map<String, Object>> {
  private final List<SortKey> keys;

  public RecordComparator(List<SortKey> keys) {
    this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
  }

  @Override
  public int compare(Map<String, Object> left, Map<String, Object> right) {
    for (SortKey key : keys) {
      Object a = PathValueExtractor.lookup(left, key.path());
      Object b = PathValueExtractor.lookup(right, key.path());
      if (Values.equal(a, b)) {
        continue;
      }
      return Values.compare(a, b) * key.direction().sign();
    }
    return 0;
  }
}
