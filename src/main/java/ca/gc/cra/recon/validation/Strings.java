package ca.gc.cra.recon.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML configuration.
 * <p><strong>Why:</strong> Collection names become file names and metric keys; rejecting odd characters
 * before a store is opened keeps both predictable.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict identifiers to {@code [A-Za-z0-9._-]}.</li>
 *   <li>Check a value against a closed set of choices.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an identifier such as a collection or exporter name.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identifier
   * @return sanitized identifier
   * @throws IllegalArgumentException if the value is blank or uses unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates that a value is one of a fixed set of lower-case choices, ignoring case.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate
   * @param choices accepted lower-case values
   * @return the lower-cased value
   * @throws IllegalArgumentException if the value is not one of {@code choices}
   */
  public static String requireOneOf(String name, String value, Set<String> choices) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if (!choices.contains(normalized)) {
      throw new IllegalArgumentException(message(name, "must be one of " + choices + " (was " + value + ")"));
    }
    return normalized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
