package ca.gc.cra.recon.application.topvalues;

import ca.gc.cra.recon.application.query.PassiveQueryService;
import ca.gc.cra.recon.domain.codec.AddressCodec;
import ca.gc.cra.recon.domain.path.PathValueExtractor;
import ca.gc.cra.recon.domain.path.Weighted;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Pseudo-fields of passive top-values queries.
 *
 * <p>Only {@code net[:bits]} is special; every other path-shaped name aggregates the stored path. In
 * distinct mode each observation counts once; in weighted mode it counts for its {@code count} field.</p>
 *
 * @since 0.1.0
 */
public final class PassivePseudoFields {
  private static final String COUNT_FIELD = "count";

  private PassivePseudoFields() {
    // Utility
  }

  /**
   * Builds the registry for a passive service.
   *
   * @param service service whose search builders supply the pre-filters
   * @param distinct {@code true} to count records, {@code false} to sum their {@code count} field
   * @return registry
   */
  public static PseudoFieldRegistry registry(PassiveQueryService service, boolean distinct) {
    PathValueExtractor extractor = new PathValueExtractor(FieldSchema.PASSIVE);
    return PseudoFieldRegistry.builder(field -> distinct
            ? PseudoField.of(field, service.searchFieldExists(field), List.of(field),
                rec -> extractor.values(rec, field).map(Weighted::one))
            : PseudoField.of(field, service.searchFieldExists(field), List.of(field, COUNT_FIELD),
                rec -> extractor.weightedValues(rec, field, COUNT_FIELD)))
        .register("net(?::(.*))?", m -> net(service, m.group(1), distinct))
        .build();
  }

  private static PseudoField net(PassiveQueryService service, String bitsText, boolean distinct) {
    int bits;
    try {
      bits = bitsText == null ? 24 : Integer.parseInt(bitsText);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid prefix length in pseudo-field net:" + bitsText, ex);
    }
    if (bits < 0 || bits > 32) {
      throw new IllegalArgumentException("IPv4 prefix length must be between 0 and 32 (was " + bits + ")");
    }
    return PseudoField.of("addr", service.searchIpv4(), List.of("addr", COUNT_FIELD),
        rec -> Stream.of(new Weighted(
            AddressCodec.ipv4Network(AddressCodec.toInternal(rec.get("addr")), bits),
            distinct ? 1L : weight(rec))));
  }

  private static long weight(Map<String, Object> rec) {
    return rec.get(COUNT_FIELD) instanceof Number count ? count.longValue() : 1L;
  }
}
