package ca.gc.cra.recon.application.topvalues;

import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.path.Weighted;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Resolved aggregation dimension.
 * <p><strong>Role:</strong> Produced by {@link PseudoFieldRegistry}; tells the query service which records to
 * read, which fields to load, how to pull values out of each record, and how to present each ranked
 * value.</p>
 *
 * @param field stored path the dimension is based on
 * @param preFilter filter conjoined with the caller's filter
 * @param projection dotted paths the extractor reads
 * @param extractor values (or tuples, as lists) emitted for one record
 * @param output transformation applied to each ranked value
 * @since 0.1.0
 */
public record PseudoField(String field, Filter preFilter, List<String> projection,
    Function<Map<String, Object>, Stream<Weighted>> extractor, UnaryOperator<Object> output) {

  public PseudoField {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(preFilter, "preFilter");
    projection = List.copyOf(projection);
    Objects.requireNonNull(extractor, "extractor");
    output = output == null ? UnaryOperator.identity() : output;
  }

  /**
   * Creates a dimension whose ranked values are returned unchanged.
   *
   * @param field stored path
   * @param preFilter pre-filter
   * @param projection paths to load
   * @param extractor per-record values
   * @return pseudo-field
   */
  public static PseudoField of(String field, Filter preFilter, List<String> projection,
      Function<Map<String, Object>, Stream<Weighted>> extractor) {
    return new PseudoField(field, preFilter, projection, extractor, UnaryOperator.identity());
  }

  /**
   * Returns a copy with another output step.
   *
   * @param newOutput transformation applied to ranked values
   * @return pseudo-field
   */
  public PseudoField withOutput(UnaryOperator<Object> newOutput) {
    return new PseudoField(field, preFilter, projection, extractor, newOutput);
  }
}
