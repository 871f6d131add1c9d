package ca.gc.cra.recon.application.port;

import ca.gc.cra.recon.domain.filter.Filter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Domain port for a single collection of JSON-like documents.
 * <p><strong>Why:</strong> Keeps query services independent of where records live (memory, JSON files).</p>
 * <p><strong>Role:</strong> Storage collaborator consumed by the query services; implemented by adapters in
 * {@code infrastructure.store}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evaluate {@link Filter} trees and return matching documents in insertion order.</li>
 *   <li>Assign identities on insert and keep them under the {@code _id} key.</li>
 *   <li>Apply single-document updates and upserts atomically.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations serialize access internally; callers coordinating
 * read-modify-write cycles across calls need external locking.</p>
 * <p><strong>Performance:</strong> Reference adapters scan the whole collection per query.</p>
 * <p><strong>Observability:</strong> Adapters log mutations at DEBUG.</p>
 *
 * @implNote Returned documents are copies; mutating them does not change stored state.
 * @since 0.1.0
 */
public interface DocumentStorePort extends AutoCloseable {
  /**
   * Returns copies of all documents matching {@code filter}, in insertion order.
   *
   * @param filter predicate; {@link Filter#TRUE} returns everything
   * @return matching documents
   */
  List<Map<String, Object>> search(Filter filter);

  /**
   * Counts matching documents.
   *
   * @param filter predicate
   * @return number of matching documents
   */
  long count(Filter filter);

  /**
   * Stores a new document. An existing {@code _id} value is kept, otherwise the store assigns one.
   *
   * @param document document to store; copied
   * @return identity of the stored document
   * @throws IllegalStateException when a document with the same identity already exists
   */
  Object insert(Map<String, Object> document);

  /**
   * Removes matching documents.
   *
   * @param filter predicate
   * @return number of removed documents
   */
  int remove(Filter filter);

  /**
   * Removes documents by identity.
   *
   * @param ids identities to remove
   * @return number of removed documents
   */
  int removeById(Collection<?> ids);

  /**
   * Applies {@code transform} in place to each listed document.
   *
   * @param transform mutation applied to the stored document
   * @param ids identities of the documents to update
   * @return number of updated documents
   */
  int update(Consumer<Map<String, Object>> transform, Collection<?> ids);

  /**
   * Replaces the fields of every document matching {@code match} with those of {@code document}, or inserts
   * {@code document} when nothing matches.
   *
   * @param document fields to write
   * @param match predicate selecting the documents to overwrite
   * @return identities of the written documents
   */
  List<Object> upsert(Map<String, Object> document, Filter match);

  /** Removes every document. */
  void purge();

  /** Releases resources held by the adapter; the store must not be used afterwards. */
  @Override
  void close();
}
