package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.domain.filter.StringMatch;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * JA3 fingerprint criterion: which stored key to test ({@code md5}, {@code sha1}, {@code sha256} or
 * {@code raw}) and the value to test it against.
 *
 * <p>Hexadecimal literals of 32, 40 or 64 digits are read as hashes and lowercased; regular expressions
 * and other literals are matched against the raw JA3 string.</p>
 *
 * @param key stored subkey
 * @param value criterion
 * @since 0.1.0
 */
public record Ja3Criterion(String key, StringMatch value) {
  private static final Pattern HEX = Pattern.compile("\\A[0-9A-Fa-f]+\\z");

  public Ja3Criterion {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  /**
   * Classifies a value or hash.
   *
   * @param valueOrHash raw JA3 string, hash, or regular expression
   * @return criterion
   */
  public static Ja3Criterion of(StringMatch valueOrHash) {
    Objects.requireNonNull(valueOrHash, "valueOrHash");
    if (valueOrHash instanceof StringMatch.Exact exact && HEX.matcher(exact.value()).matches()) {
      String key = switch (exact.value().length()) {
        case 32 -> "md5";
        case 40 -> "sha1";
        case 64 -> "sha256";
        default -> null;
      };
      if (key != null) {
        return new Ja3Criterion(key, StringMatch.exact(exact.value().toLowerCase(Locale.ROOT)));
      }
    }
    return new Ja3Criterion("raw", valueOrHash);
  }

  /**
   * Tests a stored JA3 entry.
   *
   * @param entry value stored under {@link #key()}, may be {@code null}
   * @return {@code true} when it satisfies the criterion
   */
  public boolean test(Object entry) {
    if (value instanceof StringMatch.Regex) {
      return value.test(entry == null ? "" : entry);
    }
    return value.test(entry);
  }
}
