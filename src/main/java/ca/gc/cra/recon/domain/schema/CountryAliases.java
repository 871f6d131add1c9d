package ca.gc.cra.recon.domain.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands country aliases into ISO 3166 alpha-2 codes.
 *
 * @since 0.1.0
 */
public final class CountryAliases {
  private static final Map<String, List<String>> ALIASES = Map.of(
      "UK", List.of("GB"),
      "EU", List.of("AT", "BE", "BG", "HR", "CY", "CZ", "DK", "EE", "FI", "FR", "DE", "GR", "HU", "IE", "IT",
          "LV", "LT", "LU", "MT", "NL", "PL", "PT", "RO", "SK", "SI", "ES", "SE"));

  private CountryAliases() {
    // Utility
  }

  /**
   * Expands one code.
   *
   * @param country code or alias
   * @return codes denoted by {@code country}; a single element for plain codes
   */
  public static List<String> expand(String country) {
    Objects.requireNonNull(country, "country");
    return ALIASES.getOrDefault(country, List.of(country));
  }

  /**
   * Expands several codes, keeping their order.
   *
   * @param countries codes or aliases
   * @return flattened codes
   */
  public static List<String> expand(Collection<String> countries) {
    List<String> codes = new ArrayList<>();
    for (String country : countries) {
      codes.addAll(expand(country));
    }
    return codes;
  }
}
