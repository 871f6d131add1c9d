package ca.gc.cra.recon.infrastructure.store;

import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.FilterEvaluator;
import ca.gc.cra.recon.domain.path.Values;
import ca.gc.cra.recon.domain.record.DuplicateKeyException;
import ca.gc.cra.recon.domain.record.Records;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DocumentStorePort} keeping one collection in memory.
 * <p><strong>Why:</strong> Backs tests and short-lived CLI sessions; {@link JsonFileDocumentStore} layers
 * persistence on top of it.</p>
 * <p><strong>Role:</strong> Infrastructure adapter evaluating filters with {@link FilterEvaluator}.</p>
 * <p><strong>Thread-safety:</strong> All operations synchronize on the store.</p>
 * <p><strong>Performance:</strong> Every query scans the whole collection.</p>
 * <p><strong>Observability:</strong> Logs inserts, removals and purges at DEBUG.</p>
 *
 * @since 0.1.0
 */
public class InMemoryDocumentStore implements DocumentStorePort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  private final FieldSchema schema;
  private final FilterEvaluator evaluator;
  private final Map<Object, Map<String, Object>> documents = new LinkedHashMap<>();
  private long nextId = 1L;
  private boolean closed;

  /**
   * Creates an empty collection.
   *
   * @param schema array registry used to evaluate filters
   */
  public InMemoryDocumentStore(FieldSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.evaluator = new FilterEvaluator(schema);
  }

  public FieldSchema schema() {
    return schema;
  }

  @Override
  public synchronized List<Map<String, Object>> search(Filter filter) {
    ensureOpen();
    Predicate<Map<String, Object>> predicate = evaluator.predicate(filter);
    List<Map<String, Object>> result = new ArrayList<>();
    for (Map<String, Object> document : documents.values()) {
      if (predicate.test(document)) {
        result.add(Records.deepCopy(document));
      }
    }
    return result;
  }

  @Override
  public synchronized long count(Filter filter) {
    ensureOpen();
    Predicate<Map<String, Object>> predicate = evaluator.predicate(filter);
    return documents.values().stream().filter(predicate).count();
  }

  @Override
  public synchronized Object insert(Map<String, Object> document) {
    ensureOpen();
    Objects.requireNonNull(document, "document");
    Map<String, Object> copy = Records.deepCopy(document);
    Checkpoint checkpoint = checkpoint();
    Object id = copy.get(Records.ID);
    if (id == null) {
      id = allocateId();
      copy.put(Records.ID, id);
    } else {
      id = Values.normalize(id);
      if (documents.containsKey(id)) {
        throw new DuplicateKeyException(id);
      }
    }
    documents.put(id, copy);
    log.debug("Inserted document {} into {}", id, schema.name());
    flush(checkpoint);
    return id;
  }

  @Override
  public synchronized int remove(Filter filter) {
    ensureOpen();
    Predicate<Map<String, Object>> predicate = evaluator.predicate(filter);
    Checkpoint checkpoint = checkpoint();
    int removed = 0;
    Iterator<Map<String, Object>> it = documents.values().iterator();
    while (it.hasNext()) {
      if (predicate.test(it.next())) {
        it.remove();
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Removed {} documents from {}", removed, schema.name());
      flush(checkpoint);
    }
    return removed;
  }

  @Override
  public synchronized int removeById(Collection<?> ids) {
    ensureOpen();
    Checkpoint checkpoint = checkpoint();
    int removed = 0;
    for (Object id : ids) {
      if (id != null && documents.remove(Values.normalize(id)) != null) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Removed {} documents by id from {}", removed, schema.name());
      flush(checkpoint);
    }
    return removed;
  }

  @Override
  public synchronized int update(Consumer<Map<String, Object>> transform, Collection<?> ids) {
    ensureOpen();
    Objects.requireNonNull(transform, "transform");
    Checkpoint checkpoint = checkpoint();
    int updated = 0;
    for (Object id : ids) {
      Map<String, Object> document = id == null ? null : documents.get(Values.normalize(id));
      if (document == null) {
        continue;
      }
      Object key = document.get(Records.ID);
      transform.accept(document);
      document.put(Records.ID, key);
      updated++;
    }
    if (updated > 0) {
      flush(checkpoint);
    }
    return updated;
  }

  @Override
  public synchronized List<Object> upsert(Map<String, Object> document, Filter match) {
    ensureOpen();
    Objects.requireNonNull(document, "document");
    Predicate<Map<String, Object>> predicate = evaluator.predicate(match);
    Checkpoint checkpoint = checkpoint();
    List<Object> written = new ArrayList<>();
    for (Map.Entry<Object, Map<String, Object>> entry : documents.entrySet()) {
      if (predicate.test(entry.getValue())) {
        Map<String, Object> target = entry.getValue();
        for (Map.Entry<String, Object> field : document.entrySet()) {
          if (!Records.ID.equals(field.getKey())) {
            target.put(field.getKey(), Records.copyValue(field.getValue()));
          }
        }
        written.add(entry.getKey());
      }
    }
    if (written.isEmpty()) {
      written.add(insert(document));
    } else {
      flush(checkpoint);
    }
    return written;
  }

  @Override
  public synchronized void purge() {
    ensureOpen();
    Checkpoint checkpoint = checkpoint();
    int size = documents.size();
    documents.clear();
    nextId = 1L;
    log.debug("Purged {} documents from {}", size, schema.name());
    flush(checkpoint);
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  /**
   * Returns the number of stored documents.
   *
   * @return collection size
   */
  public synchronized int size() {
    return documents.size();
  }

  /**
   * Loads documents without triggering {@link #changed()}; used when restoring persisted state.
   *
   * @param loaded documents to add, keeping their identities
   */
  protected synchronized void restore(Collection<Map<String, Object>> loaded) {
    for (Map<String, Object> document : loaded) {
      Map<String, Object> copy = Records.deepCopy(document);
      Object id = copy.get(Records.ID);
      if (id == null) {
        id = allocateId();
        copy.put(Records.ID, id);
      }
      documents.put(Values.normalize(id), copy);
    }
  }

  /**
   * Returns deep copies of every stored document in insertion order.
   *
   * @return snapshot of the collection
   */
  protected synchronized List<Map<String, Object>> snapshot() {
    List<Map<String, Object>> copies = new ArrayList<>(documents.size());
    for (Map<String, Object> document : documents.values()) {
      copies.add(Records.deepCopy(document));
    }
    return copies;
  }

  /**
   * Hook invoked, while holding the store lock, after every mutation.
   *
   * <p>When it throws, the mutation is rolled back before the exception reaches the caller.</p>
   */
  protected void changed() {
    // In-memory collections have nothing to flush.
  }

  /**
   * Whether {@link #changed()} can fail, so that mutations must be reversible.
   *
   * @return {@code false} for purely in-memory collections
   */
  protected boolean writesThrough() {
    return false;
  }

  private Checkpoint checkpoint() {
    if (!writesThrough()) {
      return null;
    }
    Map<Object, Map<String, Object>> copies = new LinkedHashMap<>();
    for (Map.Entry<Object, Map<String, Object>> entry : documents.entrySet()) {
      copies.put(entry.getKey(), Records.deepCopy(entry.getValue()));
    }
    return new Checkpoint(copies, nextId);
  }

  private void flush(Checkpoint checkpoint) {
    try {
      changed();
    } catch (RuntimeException ex) {
      if (checkpoint != null) {
        documents.clear();
        documents.putAll(checkpoint.documents());
        nextId = checkpoint.nextId();
        log.warn("Rolled back {} after failed write: {}", schema.name(), ex.getMessage());
      }
      throw ex;
    }
  }

  private record Checkpoint(Map<Object, Map<String, Object>> documents, long nextId) {}

  private Object allocateId() {
    while (documents.containsKey(nextId)) {
      nextId++;
    }
    return nextId++;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Store " + schema.name() + " is closed");
    }
  }
}
