package ca.gc.cra.seb.application.port;

/**
 * <strong>What:</strong> Capability handle exposing a SHA-256 digest.
 * <p><strong>Why:</strong> The Config Key protocol must run against a local JCA provider on servers and against a
 * platform crypto facility elsewhere; callers obtain the handle once and pass it down.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code JdkSha256DigestAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DigestPort {
  /**
   * Computes the SHA-256 digest of {@code data}.
   *
   * @param data input bytes; never {@code null}
   * @return 32-byte digest
   * @throws CapabilityUnavailableException when the digest facility is missing at call time
   */
  byte[] sha256(byte[] data);
}
