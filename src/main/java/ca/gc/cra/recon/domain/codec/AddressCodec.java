package ca.gc.cra.recon.domain.codec;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Converts IP address literals to and from the engine's internal 128-bit integer form.
 * <p><strong>Why:</strong> Integer addresses order naturally, so host lookups, ranges, and network filters become
 * numeric comparisons.</p>
 * <p><strong>Role:</strong> Domain codec used when storing records, building address predicates, and rendering
 * query results.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Embed IPv4 addresses in {@code ::ffff:0:0/96}.</li>
 *   <li>Render IPv6 in RFC 5952 canonical text and IPv4-mapped values as dotted quads.</li>
 *   <li>Compute CIDR bounds for range predicates and network aggregation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Only literals are parsed; no name resolution ever takes place.
 * @since 0.1.0
 */
public final class AddressCodec {
  /** Largest internal value (2^128 - 1). */
  public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
  /** First address of the IPv4-mapped range ({@code ::ffff:0.0.0.0}). */
  public static final BigInteger IPV4_MAPPED_BASE = BigInteger.valueOf(0xffffL).shiftLeft(32);
  /** Last address of the IPv4-mapped range ({@code ::ffff:255.255.255.255}). */
  public static final BigInteger IPV4_MAPPED_LAST = IPV4_MAPPED_BASE.add(BigInteger.valueOf(0xffffffffL));

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private AddressCodec() {
    // Utility
  }

  /**
   * Converts an address to its internal integer form.
   *
   * @param address textual literal or an already-internal number
   * @return unsigned 128-bit integer
   * @throws DecodingException when the input is not an IP literal or is out of range
   */
  public static BigInteger toInternal(Object address) {
    if (address instanceof BigInteger big) {
      return requireRange(big);
    }
    if (address instanceof Long || address instanceof Integer || address instanceof Short) {
      return requireRange(BigInteger.valueOf(((Number) address).longValue()));
    }
    if (address instanceof Number number) {
      throw new DecodingException("address number must be integral (was " + number + ")");
    }
    if (!(address instanceof String text)) {
      throw new DecodingException("unsupported address value: " + address);
    }
    String trimmed = text.trim();
    if (IPV4_PATTERN.matcher(trimmed).matches()) {
      return IPV4_MAPPED_BASE.add(BigInteger.valueOf(parseIpv4(trimmed)));
    }
    if (trimmed.indexOf(':') >= 0 && IPV6_CHARS.matcher(trimmed).matches()) {
      return parseIpv6(trimmed);
    }
    throw new DecodingException("not an IP address literal: " + text);
  }

  /**
   * Renders an internal address as text.
   *
   * @param internal internal number (any integral {@link Number})
   * @return dotted quad for IPv4-mapped values, RFC 5952 text otherwise
   * @throws DecodingException when the value is not a valid internal address
   */
  public static String toText(Object internal) {
    Objects.requireNonNull(internal, "internal");
    if (internal instanceof String text) {
      throw new DecodingException("internal address must be numeric (was text '" + text + "')");
    }
    BigInteger value = toInternal(internal);
    if (isIpv4Mapped(value)) {
      return ipv4Text(value.subtract(IPV4_MAPPED_BASE).longValue());
    }
    return ipv6Text(value);
  }

  /**
   * Indicates whether an internal address lies in {@code ::ffff:0:0/96}.
   *
   * @param internal internal value
   * @return {@code true} for embedded IPv4 addresses
   */
  public static boolean isIpv4Mapped(BigInteger internal) {
    return internal.compareTo(IPV4_MAPPED_BASE) >= 0 && internal.compareTo(IPV4_MAPPED_LAST) <= 0;
  }

  /**
   * Masks an IPv4-mapped address to the given prefix and renders it as {@code a.b.c.d/bits}.
   *
   * @param internal IPv4-mapped internal address
   * @param bits prefix length in {@code [0, 32]}
   * @return network label
   */
  public static String ipv4Network(BigInteger internal, int bits) {
    if (!isIpv4Mapped(internal)) {
      throw new DecodingException("not an IPv4 address: " + ipv6Text(internal));
    }
    if (bits < 0 || bits > 32) {
      throw new IllegalArgumentException("IPv4 prefix length must be between 0 and 32 (was " + bits + ")");
    }
    long mask = bits == 0 ? 0L : (0xffffffffL << (32 - bits)) & 0xffffffffL;
    long network = internal.subtract(IPV4_MAPPED_BASE).longValue() & mask;
    return ipv4Text(network) + '/' + bits;
  }

  /**
   * Parses {@code address/bits} (or a bare address) into its first and last internal addresses.
   *
   * @param cidr network in CIDR notation; IPv4 prefixes count from the IPv4 address bits
   * @return closed range covered by the network
   */
  public static Range network(String cidr) {
    Objects.requireNonNull(cidr, "cidr");
    String trimmed = cidr.trim();
    int slash = trimmed.indexOf('/');
    String addressPart = slash < 0 ? trimmed : trimmed.substring(0, slash);
    BigInteger address = toInternal(addressPart);
    boolean ipv4 = addressPart.indexOf(':') < 0;
    int maxBits = ipv4 ? 32 : 128;
    int bits = maxBits;
    if (slash >= 0) {
      try {
        bits = Integer.parseInt(trimmed.substring(slash + 1));
      } catch (NumberFormatException ex) {
        throw new DecodingException("invalid prefix length in " + cidr, ex);
      }
      if (bits < 0 || bits > maxBits) {
        throw new DecodingException("prefix length out of range in " + cidr);
      }
    }
    int hostBits = maxBits - bits;
    BigInteger hostMask = BigInteger.ONE.shiftLeft(hostBits).subtract(BigInteger.ONE);
    BigInteger start = address.andNot(hostMask);
    return new Range(start, start.or(hostMask));
  }

  /** Closed interval of internal addresses. */
  public record Range(BigInteger start, BigInteger end) {
    public Range {
      Objects.requireNonNull(start, "start");
      Objects.requireNonNull(end, "end");
    }
  }

  private static BigInteger requireRange(BigInteger value) {
    if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
      throw new DecodingException("address out of 128-bit range: " + value);
    }
    return value;
  }

  private static long parseIpv4(String text) {
    long result = 0;
    int start = 0;
    for (int i = 0; i < 4; i++) {
      int end = i < 3 ? text.indexOf('.', start) : text.length();
      String digits = text.substring(start, end);
      if (digits.length() > 1 && digits.charAt(0) == '0') {
        throw new DecodingException("IPv4 octet with leading zero in " + text);
      }
      int octet = Integer.parseInt(digits);
      if (octet > 255) {
        throw new DecodingException("IPv4 octet out of range in " + text);
      }
      result = (result << 8) | octet;
      start = end + 1;
    }
    return result;
  }

  private static BigInteger parseIpv6(String text) {
    int[] groups = new int[8];
    String head = text;
    String tail = null;
    int gap = text.indexOf("::");
    if (gap >= 0) {
      if (text.indexOf("::", gap + 1) >= 0) {
        throw new DecodingException("invalid IPv6 literal (multiple '::'): " + text);
      }
      head = text.substring(0, gap);
      tail = text.substring(gap + 2);
    }
    int[] headGroups = parseGroups(head, text, tail == null);
    int[] tailGroups = tail == null ? new int[0] : parseGroups(tail, text, true);
    int used = headGroups.length + tailGroups.length;
    if (tail == null ? used != 8 : used > 7) {
      throw new DecodingException("invalid IPv6 literal (wrong group count): " + text);
    }
    System.arraycopy(headGroups, 0, groups, 0, headGroups.length);
    System.arraycopy(tailGroups, 0, groups, 8 - tailGroups.length, tailGroups.length);
    BigInteger value = BigInteger.ZERO;
    for (int group : groups) {
      value = value.shiftLeft(16).or(BigInteger.valueOf(group));
    }
    return value;
  }

  private static int[] parseGroups(String part, String literal, boolean allowIpv4Suffix) {
    if (part.isEmpty()) {
      return new int[0];
    }
    String[] tokens = part.split(":", -1);
    int count = tokens.length;
    String last = tokens[count - 1];
    boolean ipv4Suffix = last.indexOf('.') >= 0;
    if (ipv4Suffix && (!allowIpv4Suffix || !IPV4_PATTERN.matcher(last).matches())) {
      throw new DecodingException("invalid IPv6 literal: " + literal);
    }
    int[] groups = new int[ipv4Suffix ? count + 1 : count];
    for (int i = 0; i < (ipv4Suffix ? count - 1 : count); i++) {
      String token = tokens[i];
      if (token.isEmpty() || token.length() > 4 || token.indexOf('.') >= 0) {
        throw new DecodingException("invalid IPv6 literal: " + literal);
      }
      groups[i] = Integer.parseInt(token, 16);
    }
    if (ipv4Suffix) {
      long v4 = parseIpv4(last);
      groups[count - 1] = (int) (v4 >>> 16);
      groups[count] = (int) (v4 & 0xffff);
    }
    return groups;
  }

  private static String ipv4Text(long value) {
    return ((value >>> 24) & 0xff) + "." + ((value >>> 16) & 0xff) + "."
        + ((value >>> 8) & 0xff) + "." + (value & 0xff);
  }

  private static String ipv6Text(BigInteger value) {
    int[] groups = new int[8];
    for (int i = 0; i < 8; i++) {
      groups[i] = value.shiftRight((7 - i) * 16).intValue() & 0xffff;
    }
    int bestStart = -1;
    int bestLength = 0;
    int runStart = -1;
    for (int i = 0; i <= 8; i++) {
      if (i < 8 && groups[i] == 0) {
        if (runStart < 0) {
          runStart = i;
        }
        continue;
      }
      if (runStart >= 0) {
        int length = i - runStart;
        if (length > bestLength && length >= 2) {
          bestStart = runStart;
          bestLength = length;
        }
        runStart = -1;
      }
    }
    StringBuilder out = new StringBuilder(39);
    for (int i = 0; i < 8; i++) {
      if (i == bestStart) {
        out.append("::");
        i += bestLength - 1;
        continue;
      }
      if (out.length() > 0 && out.charAt(out.length() - 1) != ':') {
        out.append(':');
      }
      out.append(Integer.toHexString(groups[i]));
    }
    return out.toString();
  }
}
