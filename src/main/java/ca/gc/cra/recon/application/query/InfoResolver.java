package ca.gc.cra.recon.application.query;

import java.util.Map;

/**
 * Computes the derived {@code infos} block of a passive record.
 *
 * <p>Called once, when a record is created; folded sightings never invoke it again.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface InfoResolver {
  /**
   * Resolves extra fields for a record.
   *
   * @param record observation in external form
   * @return fields to merge into the record, typically a single {@code infos} entry; may be empty
   */
  Map<String, Object> resolve(Map<String, Object> record);
}
