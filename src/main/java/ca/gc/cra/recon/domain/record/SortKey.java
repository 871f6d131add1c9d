package ca.gc.cra.recon.domain.record;

import java.util.Locale;
import java.util.Objects;

/**
 * One ordering criterion: a dotted path and a direction.
 *
 * @param path dotted path, resolved without crossing arrays
 * @param direction ascending or descending
 * @since 0.1.0
 */
public record SortKey(String path, Direction direction) {
  public SortKey {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(direction, "direction");
  }

  public static SortKey asc(String path) {
    return new SortKey(path, Direction.ASC);
  }

  public static SortKey desc(String path) {
    return new SortKey(path, Direction.DESC);
  }

  /**
   * Parses {@code path}, {@code path:asc} or {@code path:desc}; also accepts {@code 1} and {@code -1}.
   *
   * @param spec textual sort key
   * @return parsed key
   * @throws IllegalArgumentException for an unknown direction
   */
  public static SortKey parse(String spec) {
    Objects.requireNonNull(spec, "spec");
    String trimmed = spec.trim();
    int colon = trimmed.lastIndexOf(':');
    if (colon < 0) {
      return asc(trimmed);
    }
    String path = trimmed.substring(0, colon);
    String direction = trimmed.substring(colon + 1).toLowerCase(Locale.ROOT);
    return switch (direction) {
      case "asc", "1" -> asc(path);
      case "desc", "-1" -> desc(path);
      default -> throw new IllegalArgumentException("unknown sort direction '" + direction + "' in " + spec);
    };
  }

  /** Sort direction; the sign multiplies the natural comparison result. */
  public enum Direction {
    ASC(1),
    DESC(-1);

    private final int sign;

    Direction(int sign) {
      this.sign = sign;
    }

    public int sign() {
      return sign;
    }
  }
}
