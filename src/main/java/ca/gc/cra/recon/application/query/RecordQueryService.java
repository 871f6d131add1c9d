package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.topvalues.PseudoField;
import ca.gc.cra.recon.application.topvalues.TopValue;
import ca.gc.cra.recon.application.topvalues.TopValuesAggregator;
import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.path.PathValueExtractor;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.record.RecordComparator;
import ca.gc.cra.recon.domain.record.RecordProjector;
import ca.gc.cra.recon.domain.record.Records;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base query service over one record collection.
 * <p><strong>Why:</strong> Host and passive collections share listing, counting, distinct values, address
 * predicates and the top-values pipeline; subclasses add their record conversions and domain searches.</p>
 * <p><strong>Role:</strong> Application service driving a {@link DocumentStorePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the collection lazily and reopen it after {@link #invalidateCache()}.</li>
 *   <li>Apply sort (stable), skip, limit and projection, in that order, to search results.</li>
 *   <li>Convert stored records to their external form through {@link #toExternal(Map)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The store handle is guarded by the service; record processing is
 * single-threaded per call.</p>
 * <p><strong>Observability:</strong> Increments {@code recon.<collection>.get} per listing and records
 * {@code recon.<collection>.topvalues.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public abstract class RecordQueryService implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordQueryService.class);

  protected final String collection;
  protected final FieldSchema schema;
  protected final PathValueExtractor extractor;
  protected final MetricsPort metrics;
  protected final ClockPort clock;
  private final Supplier<? extends DocumentStorePort> storeFactory;
  private final TopValuesAggregator aggregator = new TopValuesAggregator();
  private DocumentStorePort store;

  /**
   * Creates a service.
   *
   * @param collection collection name used in metric keys and logs
   * @param schema array registry of the collection
   * @param storeFactory opens the collection; invoked lazily and again after invalidation
   * @param metrics metrics sink
   * @param clock time source for relative time searches
   */
  protected RecordQueryService(String collection, FieldSchema schema,
      Supplier<? extends DocumentStorePort> storeFactory, MetricsPort metrics, ClockPort clock) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.extractor = new PathValueExtractor(schema);
  }

  /**
   * Returns the collection handle, opening it on first use.
   *
   * @return open store
   */
  protected synchronized DocumentStorePort store() {
    if (store == null) {
      store = Objects.requireNonNull(storeFactory.get(), "storeFactory returned null");
      log.debug("Opened {} collection", collection);
    }
    return store;
  }

  /** Closes the current handle; the next operation opens a fresh one. */
  public synchronized void invalidateCache() {
    if (store != null) {
      store.close();
      store = null;
    }
  }

  @Override
  public void close() {
    invalidateCache();
  }

  /** Removes every record of the collection. */
  public void init() {
    store().purge();
    log.info("Initialized {} collection", collection);
  }

  public String collection() {
    return collection;
  }

  public FieldSchema schema() {
    return schema;
  }

  public long count(Filter filter) {
    return store().count(filter == null ? Filter.TRUE : filter);
  }

  public List<Map<String, Object>> get(Filter filter) {
    return get(filter, QueryOptions.DEFAULT);
  }

  /**
   * Lists matching records in their external form.
   *
   * @param filter predicate, {@code null} for all records
   * @param options projection, sort and paging
   * @return records
   */
  public List<Map<String, Object>> get(Filter filter, QueryOptions options) {
    metrics.increment("recon." + collection + ".get");
    List<Map<String, Object>> stored = getStored(filter, options);
    List<Map<String, Object>> result = new ArrayList<>(stored.size());
    for (Map<String, Object> record : stored) {
      result.add(toExternal(record));
    }
    return result;
  }

  /**
   * Returns the first matching record.
   *
   * @param filter predicate
   * @param options projection and sort
   * @return record in external form, or {@code null} when nothing matches
   */
  public Map<String, Object> getOne(Filter filter, QueryOptions options) {
    List<Map<String, Object>> records = get(filter, options.withLimit(1));
    return records.isEmpty() ? null : records.get(0);
  }

  /**
   * Lists matching records as stored.
   *
   * @param filter predicate, {@code null} for all records
   * @param options projection, sort and paging
   * @return records in internal form
   */
  protected List<Map<String, Object>> getStored(Filter filter, QueryOptions options) {
    QueryOptions opts = options == null ? QueryOptions.DEFAULT : options;
    List<Map<String, Object>> records = store().search(filter == null ? Filter.TRUE : filter);
    if (!opts.sort().isEmpty()) {
      records.sort(new RecordComparator(opts.sort()));
    }
    int from = opts.skip() == null ? 0 : Math.min(opts.skip(), records.size());
    int to = opts.limit() == null
        ? records.size()
        : (int) Math.min(records.size(), (long) from + opts.limit());
    List<Map<String, Object>> page = records.subList(from, to);
    if (opts.fields() == null) {
      return new ArrayList<>(page);
    }
    RecordProjector projector = RecordProjector.of(schema, opts.fields());
    List<Map<String, Object>> projected = new ArrayList<>(page.size());
    for (Map<String, Object> record : page) {
      projected.add(projector.project(record));
    }
    return projected;
  }

  /**
   * Converts a stored record into the form returned to callers.
   *
   * @param stored record as stored; owned by the caller and may be modified in place
   * @return external record
   */
  protected Map<String, Object> toExternal(Map<String, Object> stored) {
    return stored;
  }

  /**
   * Returns the distinct values reached by {@code field} in matching records.
   *
   * @param field dotted path
   * @param filter predicate, {@code null} for all records
   * @param options sort and paging applied to the records before extraction
   * @return values in first-seen order; numbers are normalized so {@code 80} and {@code 80L} collapse
   */
  public Set<Object> distinct(String field, Filter filter, QueryOptions options) {
    Objects.requireNonNull(field, "field");
    Filter flt = Filters.and(filter == null ? Filter.TRUE : filter, searchFieldExists(field));
    QueryOptions opts = (options == null ? QueryOptions.DEFAULT : options).withFields(List.of(field));
    Map<Object, Object> seen = new LinkedHashMap<>();
    for (Map<String, Object> record : get(flt, opts)) {
      extractor.values(record, field).forEach(value -> {
        Object key = Values.normalize(value);
        seen.putIfAbsent(key, value instanceof byte[] ? value : key);
      });
    }
    return new LinkedHashSet<>(seen.values());
  }

  public Set<Object> distinct(String field) {
    return distinct(field, null, QueryOptions.DEFAULT);
  }

  /**
   * Runs the top-values pipeline for a resolved dimension.
   *
   * @param pseudoField resolved dimension
   * @param filter caller filter
   * @param topN maximum entries, {@code null} for all
   * @param options sort and paging applied to the records before extraction
   * @return ranked entries
   */
  protected List<TopValue> topValues(PseudoField pseudoField, Filter filter, Integer topN, QueryOptions options) {
    long start = System.nanoTime();
    Filter flt = Filters.and(filter == null ? Filter.TRUE : filter, pseudoField.preFilter());
    QueryOptions opts = (options == null ? QueryOptions.DEFAULT : options).withFields(pseudoField.projection());
    List<Map<String, Object>> records = get(flt, opts);
    List<TopValue> result = aggregator.rank(records.stream().flatMap(pseudoField.extractor()),
        pseudoField.output(), topN);
    metrics.observe("recon." + collection + ".topvalues.latencyNanos", System.nanoTime() - start);
    log.debug("Top values of {} over {} records of {}", pseudoField.field(), records.size(), collection);
    return result;
  }

  /**
   * Removes records by identity.
   *
   * @param ids identities
   * @return number of removed records
   */
  public int removeById(Collection<?> ids) {
    return store().removeById(ids);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + collection + "]";
  }

  // Generic searches

  /**
   * Presence test following the collection's array levels.
   *
   * @param field dotted path
   * @return filter
   */
  public Filter searchFieldExists(String field) {
    return Filters.exists(schema, field);
  }

  public Filter searchNonExistent() {
    return Filter.FALSE;
  }

  public Filter searchObjectId(Object id, boolean neg) {
    return neg ? Filters.ne(Records.ID, id) : Filters.eq(Records.ID, id);
  }

  public Filter searchObjectIds(Collection<?> ids, boolean neg) {
    Filter res = Filters.oneOf(Records.ID, ids);
    return neg ? Filters.not(res) : res;
  }

  /**
   * Filters on the document schema version.
   *
   * @param version version, or {@code null} for any versioned record
   * @return filter
   */
  public Filter searchVersion(Integer version) {
    if (version == null) {
      return Filters.exists("schema_version");
    }
    return Filters.eq("schema_version", version);
  }

  public Filter searchHost(Object address, boolean neg) {
    BigInteger internal = AddressCodec.toInternal(address);
    return neg ? Filters.ne("addr", internal) : Filters.eq("addr", internal);
  }

  public Filter searchHosts(Collection<?> addresses, boolean neg) {
    List<BigInteger> internal = new ArrayList<>(addresses.size());
    for (Object address : addresses) {
      internal.add(AddressCodec.toInternal(address));
    }
    Filter res = Filters.oneOf("addr", internal);
    return neg ? Filters.not(res) : res;
  }

  /**
   * Closed address interval.
   *
   * @param start first address, textual or internal
   * @param stop last address, textual or internal
   * @param neg {@code true} to exclude the interval instead
   * @return filter
   */
  public Filter searchRange(Object start, Object stop, boolean neg) {
    Filter res = Filters.and(
        Filters.gte("addr", AddressCodec.toInternal(start)),
        Filters.lte("addr", AddressCodec.toInternal(stop)));
    return neg ? Filters.not(res) : res;
  }

  /**
   * Addresses inside a CIDR network.
   *
   * @param cidr network such as {@code 192.0.2.0/24} or {@code 2001:db8::/32}
   * @param neg {@code true} to exclude the network instead
   * @return filter
   */
  public Filter searchNet(String cidr, boolean neg) {
    AddressCodec.Range range = AddressCodec.network(cidr);
    return searchRange(range.start(), range.end(), neg);
  }

  public Filter searchIpv4() {
    return searchRange(AddressCodec.IPV4_MAPPED_BASE, AddressCodec.IPV4_MAPPED_LAST, false);
  }

  public Filter searchIpv6() {
    return Filters.and(Filters.exists("addr"), Filters.not(searchIpv4()));
  }

  public Filter searchVal(String key, Object value) {
    return Filters.eq(key, value);
  }

  /**
   * Ordering comparison on a field.
   *
   * @param key dotted path
   * @param value operand
   * @param operator {@code <}, {@code <=}, {@code >} or {@code >=}
   * @return filter
   * @throws IllegalArgumentException for any other operator
   */
  public Filter searchCmp(String key, Object value, String operator) {
    return Filters.compare(key, operator, value);
  }
}
