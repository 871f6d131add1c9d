package ca.gc.cra.recon.domain.path;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Comparison and equality rules shared by filters, sorting, and aggregation.
 *
 * <p>Numbers compare by value regardless of their boxed type, so a {@code Long} read from JSON equals the
 * {@code Integer} a caller passed in a filter. Values of unrelated kinds order by kind:
 * numbers, then text, then booleans, then lists, then maps.</p>
 *
 * @since 0.1.0
 */
public final class Values {
  private static final int KIND_NUMBER = 0;
  private static final int KIND_TEXT = 1;
  private static final int KIND_BOOLEAN = 2;
  private static final int KIND_LIST = 3;
  private static final int KIND_MAP = 4;
  private static final int KIND_OTHER = 5;

  private Values() {
    // Utility
  }

  /**
   * Deep, number-aware equality.
   *
   * @param left first value, may be {@code null}
   * @param right second value, may be {@code null}
   * @return {@code true} when both values denote the same document content
   */
  public static boolean equal(Object left, Object right) {
    if (left == right) {
      return true;
    }
    if (left == null || right == null) {
      return false;
    }
    if (left instanceof Number a && right instanceof Number b) {
      return toDecimal(a).compareTo(toDecimal(b)) == 0;
    }
    if (left instanceof byte[] a && right instanceof byte[] b) {
      return Arrays.equals(a, b);
    }
    if (left instanceof List<?> a && right instanceof List<?> b) {
      if (a.size() != b.size()) {
        return false;
      }
      Iterator<?> ia = a.iterator();
      Iterator<?> ib = b.iterator();
      while (ia.hasNext()) {
        if (!equal(ia.next(), ib.next())) {
          return false;
        }
      }
      return true;
    }
    if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
      if (a.size() != b.size()) {
        return false;
      }
      for (Map.Entry<?, ?> entry : a.entrySet()) {
        if (!b.containsKey(entry.getKey()) || !equal(entry.getValue(), b.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    return left.equals(right);
  }

  /**
   * Indicates whether two non-null values have an ordering between them.
   *
   * @param left first value
   * @param right second value
   * @return {@code true} for number/number, text/text, boolean/boolean, and list/list pairs
   */
  public static boolean comparable(Object left, Object right) {
    if (left == null || right == null) {
      return false;
    }
    int kind = kind(left);
    return kind == kind(right) && kind != KIND_MAP && kind != KIND_OTHER;
  }

  /**
   * Total order over document values; {@code null} sorts before everything else.
   *
   * @param left first value
   * @param right second value
   * @return negative, zero, or positive like {@link java.util.Comparator#compare}
   */
  public static int compare(Object left, Object right) {
    if (left == right) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    int leftKind = kind(left);
    int rightKind = kind(right);
    if (leftKind != rightKind) {
      return Integer.compare(leftKind, rightKind);
    }
    switch (leftKind) {
      case KIND_NUMBER:
        return toDecimal((Number) left).compareTo(toDecimal((Number) right));
      case KIND_TEXT:
        return left.toString().compareTo(right.toString());
      case KIND_BOOLEAN:
        return Boolean.compare((Boolean) left, (Boolean) right);
      case KIND_LIST: {
        List<?> a = (List<?>) left;
        List<?> b = (List<?>) right;
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
          int cmp = compare(a.get(i), b.get(i));
          if (cmp != 0) {
            return cmp;
          }
        }
        return Integer.compare(a.size(), b.size());
      }
      default:
        return left.toString().compareTo(right.toString());
    }
  }

  /**
   * Rebuilds a value so that equal content yields equal {@link Object#hashCode()} keys.
   *
   * <p>Integral numbers become {@link Long} (or {@link BigInteger} beyond its range), fractional numbers
   * become stripped {@link BigDecimal}s, byte arrays become read-only {@link ByteBuffer}s, and containers are
   * copied recursively into unmodifiable collections that tolerate {@code null} members.</p>
   *
   * @param value document value
   * @return normalized key suitable for hash-based counting
   */
  public static Object normalize(Object value) {
    if (value instanceof Number number) {
      BigDecimal decimal = toDecimal(number).stripTrailingZeros();
      if (decimal.scale() <= 0) {
        BigInteger integral = decimal.toBigIntegerExact();
        return integral.bitLength() < 64 ? (Object) integral.longValue() : integral;
      }
      return decimal;
    }
    if (value instanceof byte[] bytes) {
      return ByteBuffer.wrap(Arrays.copyOf(bytes, bytes.length)).asReadOnlyBuffer();
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(normalize(element));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(entry.getKey(), normalize(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    return value;
  }

  /**
   * Converts any boxed number to an exact decimal.
   *
   * @param number boxed number
   * @return decimal with the same value
   */
  public static BigDecimal toDecimal(Number number) {
    Objects.requireNonNull(number, "number");
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof BigInteger big) {
      return new BigDecimal(big);
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }

  private static int kind(Object value) {
    if (value instanceof Number) {
      return KIND_NUMBER;
    }
    if (value instanceof CharSequence) {
      return KIND_TEXT;
    }
    if (value instanceof Boolean) {
      return KIND_BOOLEAN;
    }
    if (value instanceof List<?>) {
      return KIND_LIST;
    }
    if (value instanceof Map<?, ?>) {
      return KIND_MAP;
    }
    return KIND_OTHER;
  }
}
