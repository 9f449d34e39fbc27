package ca.gc.cra.seb.domain.client;

import java.util.Optional;

/**
 * Operating systems an SEB client may report in its version string.
 *
 * @since 0.1.0
 */
public enum ClientOs {
  WINDOWS("Windows"),
  MACOS("macOS"),
  IOS("iOS");

  private final String token;

  ClientOs(String token) {
    this.token = token;
  }

  /**
   * Token as it appears in the version string.
   *
   * @return case-sensitive OS token
   */
  public String token() {
    return token;
  }

  /**
   * Resolves a version-string token; matching is case-sensitive.
   *
   * @param token raw token
   * @return matching OS, or empty when unrecognized
   */
  public static Optional<ClientOs> fromToken(String token) {
    for (ClientOs os : values()) {
      if (os.token.equals(token)) {
        return Optional.of(os);
      }
    }
    return Optional.empty();
  }
}
