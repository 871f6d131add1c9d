package ca.gc.cra.recon.api;

import ca.gc.cra.recon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>The value runs from the first {@code '='} to the end, so CIDR blocks and regular expressions may
 * contain further {@code '='} signs. A leading {@code '!'} on the key ({@code !port=80}) is kept in
 * the map key and read as a negated filter by {@link CliFilters}.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^!?[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code key=value}, a key is malformed, or
   *         a key is repeated
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1));
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument given twice: " + key);
      }
    }
    return map;
  }
}
