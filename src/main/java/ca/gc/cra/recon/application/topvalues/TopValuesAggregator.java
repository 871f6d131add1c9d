package ca.gc.cra.recon.application.topvalues;

import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.path.Weighted;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Counts weighted values and ranks them.
 *
 * <p>Values are grouped by content (see {@link Values#normalize(Object)}), so {@code 80} read as a
 * {@code Long} and as an {@code Integer} land in the same bucket. Ranking is by descending count; equal
 * counts keep the order in which their values were first seen.</p>
 *
 * @since 0.1.0
 */
public final class TopValuesAggregator {

  /**
   * Ranks the values of a stream.
   *
   * @param values weighted values; consumed
   * @param output transformation applied to each ranked value
   * @param topN maximum number of entries, or {@code null} for all of them
   * @return ranked entries, at most {@code topN}
   */
  public List<TopValue> rank(Stream<Weighted> values, UnaryOperator<Object> output, Integer topN) {
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(output, "output");
    if (topN != null && topN < 0) {
      throw new IllegalArgumentException("topN must be >= 0");
    }
    Map<Object, Bucket> buckets = new LinkedHashMap<>();
    try (values) {
      values.forEach(weighted -> buckets
          .computeIfAbsent(Values.normalize(weighted.value()), key -> new Bucket(weighted.value()))
          .add(weighted.weight()));
    }
    List<Bucket> ranked = new ArrayList<>(buckets.values());
    ranked.sort(Comparator.comparingLong(Bucket::count).reversed());
    int size = topN == null ? ranked.size() : Math.min(topN, ranked.size());
    List<TopValue> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      Bucket bucket = ranked.get(i);
      result.add(new TopValue(output.apply(bucket.value), bucket.count));
    }
    return result;
  }

  private static final class Bucket {
    private final Object value;
    private long count;

    Bucket(Object value) {
      this.value = value;
    }

    void add(long weight) {
      count += weight;
    }

    long count() {
      return count;
    }
  }
}
