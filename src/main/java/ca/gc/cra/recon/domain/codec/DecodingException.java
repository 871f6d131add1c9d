package ca.gc.cra.recon.domain.codec;

/**
 * Raised when an external value (address, timestamp, binary payload) cannot be converted to or from its
 * internal form.
 *
 * @since 0.1.0
 */
public class DecodingException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public DecodingException(String message) {
    super(message);
  }

  public DecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
