package ca.gc.cra.seb.infrastructure.container;

/**
 * Raised when an encrypted ({@code pwcc}) container is decoded without a password. Distinct from a wrong
 * password, which surfaces as {@link DecryptionException}.
 *
 * @since 0.1.0
 */
public final class PasswordRequiredException extends ContainerException {
  private static final long serialVersionUID = 1L;

  public PasswordRequiredException() {
    super("Password required for encrypted SEB file");
  }
}
