package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.domain.record.SortKey;
import java.util.List;

/**
 * Projection, ordering and paging applied to a record listing.
 *
 * @param fields dotted paths to keep, or {@code null} for whole records
 * @param sort sort keys, empty to keep store order
 * @param limit maximum number of records, or {@code null} for no limit
 * @param skip number of leading records to drop, or {@code null}
 * @since 0.1.0
 */
public record QueryOptions(List<String> fields, List<SortKey> sort, Integer limit, Integer skip) {
  /** Whole records in store order. */
  public static final QueryOptions DEFAULT = new QueryOptions(null, List.of(), null, null);

  public QueryOptions {
    fields = fields == null ? null : List.copyOf(fields);
    sort = sort == null ? List.of() : List.copyOf(sort);
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    if (skip != null && skip < 0) {
      throw new IllegalArgumentException("skip must be >= 0");
    }
  }

  public QueryOptions withFields(List<String> newFields) {
    return new QueryOptions(newFields, sort, limit, skip);
  }

  public QueryOptions withSort(List<SortKey> newSort) {
    return new QueryOptions(fields, newSort, limit, skip);
  }

  public QueryOptions withLimit(Integer newLimit) {
    return new QueryOptions(fields, sort, newLimit, skip);
  }

  public QueryOptions withSkip(Integer newSkip) {
    return new QueryOptions(fields, sort, limit, newSkip);
  }
}
