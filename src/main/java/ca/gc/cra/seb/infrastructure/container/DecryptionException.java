package ca.gc.cra.seb.infrastructure.container;

/**
 * Raised when an encrypted container cannot be decrypted, most often because the password is wrong.
 *
 * @since 0.1.0
 */
public final class DecryptionException extends ContainerException {
  private static final long serialVersionUID = 1L;

  public DecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
