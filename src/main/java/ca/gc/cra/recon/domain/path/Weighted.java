package ca.gc.cra.recon.domain.path;

/**
 * A value produced by path extraction together with the number of occurrences it stands for.
 *
 * @param value extracted value, may be {@code null}
 * @param weight occurrence count, {@code 1} unless a count field says otherwise
 * @since 0.1.0
 */
public record Weighted(Object value, long weight) {
  public static Weighted one(Object value) {
    return new Weighted(value, 1L);
  }
}
