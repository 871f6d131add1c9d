package ca.gc.cra.recon.application.query;

import java.util.List;
import java.util.Map;

/**
 * Lightweight host listing together with a count.
 *
 * <p>The meaning of {@code count} depends on the producing call: number of listed hosts, or number of ports
 * across them for {@code getIpsPorts}.</p>
 *
 * @param records summarized host documents
 * @param count associated count
 * @since 0.1.0
 */
public record Listing(List<Map<String, Object>> records, long count) {
  public Listing {
    records = List.copyOf(records);
  }
}
