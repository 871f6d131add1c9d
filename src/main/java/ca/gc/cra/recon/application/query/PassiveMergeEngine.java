package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.domain.codec.TimestampCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.record.Records;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds repeated passive sightings into a single record.
 * <p><strong>Why:</strong> Sensors report the same observation many times; storing one record per distinct
 * observation with a count and a first/last seen window keeps the collection small and queryable.</p>
 * <p><strong>Role:</strong> Application service used by {@link PassiveQueryService#insertOrUpdate}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive the uniqueness key: every field except {@code infos}, {@code count}, {@code firstseen},
 *   {@code lastseen} and {@code _id}.</li>
 *   <li>Fold a sighting into the matching record ({@code count += n}, {@code firstseen = min},
 *   {@code lastseen = max}) or create it.</li>
 *   <li>Resolve the {@code infos} block only when a record is created.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The lookup and the write are two store calls; callers sharing a store
 * between threads must serialize {@link #insertOrUpdate} themselves.</p>
 * <p><strong>Observability:</strong> Counts {@code recon.passive.merge.created} and
 * {@code recon.passive.merge.folded}; logs each outcome at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class PassiveMergeEngine {
  private static final Logger log = LoggerFactory.getLogger(PassiveMergeEngine.class);
  private static final List<String> NON_KEY_FIELDS = List.of(
      "infos", "count", "firstseen", "lastseen", Records.ID);

  /** Result of one {@link #insertOrUpdate} call. */
  public enum Outcome {
    /** A new record was written. */
    CREATED,
    /** The sighting was folded into an existing record. */
    FOLDED,
    /** Nothing was written because the record was {@code null}. */
    SKIPPED
  }

  private final Supplier<? extends DocumentStorePort> store;
  private final UnaryOperator<Map<String, Object>> toInternal;
  private final MetricsPort metrics;

  /**
   * Creates an engine.
   *
   * @param store current passive collection
   * @param toInternal conversion of an external record to its stored form
   * @param metrics metrics sink
   */
  public PassiveMergeEngine(Supplier<? extends DocumentStorePort> store,
      UnaryOperator<Map<String, Object>> toInternal, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.toInternal = Objects.requireNonNull(toInternal, "toInternal");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Records one sighting.
   *
   * @param timestamp time of the sighting (any accepted timestamp form)
   * @param record observation in external form, may carry a {@code count}; {@code null} is ignored
   * @param infoResolver computes {@code infos} for new records, or {@code null}
   * @param lastseen end of the sighting window when it differs from {@code timestamp}, or {@code null}
   * @return what happened
   */
  public Outcome insertOrUpdate(Object timestamp, Map<String, Object> record, InfoResolver infoResolver,
      Object lastseen) {
    if (record == null) {
      return Outcome.SKIPPED;
    }
    Map<String, Object> original = Records.deepCopy(record);
    Map<String, Object> spec = toInternal.apply(record);
    Object rawCount = spec.getOrDefault("count", 1L);
    if (!(rawCount instanceof Number)) {
      throw new IllegalArgumentException("count must be numeric (was " + rawCount + ")");
    }
    Number count = (Number) rawCount;
    for (String field : NON_KEY_FIELDS) {
      spec.remove(field);
    }
    Filter match = matchAll(spec);
    Number first = TimestampCodec.toEpoch(timestamp);
    Number last = lastseen == null ? first : TimestampCodec.toEpoch(lastseen);

    DocumentStorePort collection = store.get();
    List<Map<String, Object>> current = collection.search(match);
    if (!current.isEmpty()) {
      collection.update(fold(count, first, last), List.of(current.get(0).get(Records.ID)));
      metrics.increment("recon.passive.merge.folded");
      log.debug("Passive record folded: {}", current.get(0).get(Records.ID));
      return Outcome.FOLDED;
    }
    Map<String, Object> doc = new LinkedHashMap<>(spec);
    doc.put("count", count);
    doc.put("firstseen", first);
    doc.put("lastseen", last);
    if (infoResolver != null) {
      original.putAll(infoResolver.resolve(original));
      if (original.containsKey("infos")) {
        doc.put("infos", original.get("infos"));
      }
    }
    List<Object> ids = collection.upsert(doc, match);
    metrics.increment("recon.passive.merge.created");
    log.debug("Passive record created: {}", ids);
    return Outcome.CREATED;
  }

  private static Filter matchAll(Map<String, Object> spec) {
    List<Filter> equalities = new ArrayList<>(spec.size());
    spec.forEach((key, value) -> equalities.add(Filters.eq(key, value)));
    return Filters.and(equalities);
  }

  /**
   * Folding transformation applied to a stored record.
   *
   * @param count sightings to add
   * @param firstseen candidate first sighting, or {@code null}
   * @param lastseen candidate last sighting, or {@code null}
   * @return in-place update
   */
  static Consumer<Map<String, Object>> fold(Number count, Number firstseen, Number lastseen) {
    return doc -> {
      Object stored = doc.get("count");
      long previous = stored instanceof Number number ? number.longValue() : 0L;
      doc.put("count", previous + count.longValue());
      if (firstseen != null) {
        Object current = doc.getOrDefault("firstseen", firstseen);
        doc.put("firstseen", Values.compare(current, firstseen) <= 0 ? current : firstseen);
      }
      if (lastseen != null) {
        Object current = doc.getOrDefault("lastseen", lastseen);
        doc.put("lastseen", Values.compare(current, lastseen) >= 0 ? current : lastseen);
      }
    };
  }
}
