package ca.gc.cra.seb.infrastructure.crypto;

import ca.gc.cra.seb.application.port.CapabilityUnavailableException;
import ca.gc.cra.seb.application.port.DigestPort;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DigestPort} backed by the JCA {@code SHA-256} {@link MessageDigest}.
 *
 * <p>Thread-safe: a digest instance is created per call.</p>
 *
 * @since 0.1.0
 */
public final class JdkSha256DigestAdapter implements DigestPort {
  private static final String ALGORITHM = "SHA-256";

  /**
   * Creates the adapter after checking that the platform offers SHA-256.
   *
   * @throws CapabilityUnavailableException when no provider implements SHA-256
   */
  public JdkSha256DigestAdapter() {
    newDigest();
  }

  /**
   * Looks up the platform digest, reporting absence as an empty handle.
   *
   * @return adapter, or empty when SHA-256 is unavailable
   */
  public static Optional<DigestPort> lookup() {
    try {
      return Optional.of(new JdkSha256DigestAdapter());
    } catch (CapabilityUnavailableException e) {
      return Optional.empty();
    }
  }

  @Override
  public byte[] sha256(byte[] data) {
    Objects.requireNonNull(data, "data");
    return newDigest().digest(data);
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new CapabilityUnavailableException("SHA-256 digest is not available", e);
    }
  }
}
