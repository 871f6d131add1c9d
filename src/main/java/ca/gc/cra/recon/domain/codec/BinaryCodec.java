package ca.gc.cra.recon.domain.codec;

import java.util.Base64;
import java.util.Objects;

/**
 * Base64 conversion for binary payloads stored as text (certificates, raw banners).
 *
 * @since 0.1.0
 */
public final class BinaryCodec {
  private static final Base64.Encoder ENCODER = Base64.getEncoder();
  private static final Base64.Decoder DECODER = Base64.getDecoder();

  private BinaryCodec() {
    // Utility
  }

  public static String encode(byte[] data) {
    return ENCODER.encodeToString(Objects.requireNonNull(data, "data"));
  }

  /**
   * Decodes standard (padded) base64 text.
   *
   * @param text base64 text
   * @return decoded bytes
   * @throws DecodingException when the text is not valid base64
   */
  public static byte[] decode(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return DECODER.decode(text.trim());
    } catch (IllegalArgumentException ex) {
      throw new DecodingException("invalid base64 payload", ex);
    }
  }
}
