package ca.gc.cra.recon.application.port;

import java.util.Map;

/**
 * Collaborator that folds a freshly scanned host into an existing view record.
 *
 * <p>The merge policy (which scan wins for each field) belongs to the view builder, not to the query engine.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostMergePort {
  /**
   * Attempts to merge {@code host} into a stored record for the same address.
   *
   * @param host host record in external form
   * @return {@code true} when a stored record absorbed the host, {@code false} when the caller must store it
   */
  boolean merge(Map<String, Object> host);

  /** Never merges; every host is stored as a new record. */
  HostMergePort NEVER = host -> false;
}
