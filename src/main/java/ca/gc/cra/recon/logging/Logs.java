package ca.gc.cra.recon.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps record payloads in log lines short.
 * <p><strong>Why:</strong> Reconnaissance records carry script outputs and certificates that can run to
 * kilobytes; a malformed value should be recognizable in a log line without flooding it.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut in the middle of a code point is dropped.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default UTF-8 budget for values quoted in log messages. */
  public static final int DEFAULT_MAX_BYTES = 256;
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a value to {@link #DEFAULT_MAX_BYTES} UTF-8 bytes.
   *
   * @param value text to quote; {@code null} gives {@code "<null>"}
   * @return the value, shortened when needed
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }

  /**
   * Truncates a value to the requested UTF-8 byte length and records the original length.
   *
   * @param value text to quote; {@code null} gives {@code "<null>"}
   * @param maxBytes bytes to keep; must be positive
   * @return the value when it fits, otherwise its prefix followed by {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }
}
