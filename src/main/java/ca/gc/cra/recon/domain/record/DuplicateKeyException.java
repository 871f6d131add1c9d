package ca.gc.cra.recon.domain.record;

/**
 * Raised when a document is created with an identity that is already taken.
 *
 * @since 0.1.0
 */
public class DuplicateKeyException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient Object id;

  public DuplicateKeyException(Object id) {
    super("Duplicate entry for id " + id);
    this.id = id;
  }

  public Object id() {
    return id;
  }
}
