package ca.gc.cra.seb.domain.config;

import ca.gc.cra.seb.domain.util.Hex;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-request hash of a fragment-free URL and a Config Key, as carried in the
 * {@code X-SafeExamBrowser-ConfigKeyHash} header.
 *
 * @param hex lowercase hex digest
 * @since 0.1.0
 */
public record RequestHash(String hex) {
  public RequestHash {
    Objects.requireNonNull(hex, "hex");
    hex = hex.toLowerCase(Locale.ROOT);
    if (!Hex.isSha256Hex(hex)) {
      throw new IllegalArgumentException("request hash must be 64 hexadecimal characters");
    }
  }

  /**
   * Compares against a received header value ignoring case. Surrounding whitespace is not stripped.
   *
   * @param received header value; {@code null} never matches
   * @return {@code true} when both encode the same digest
   */
  public boolean matches(String received) {
    return received != null && hex.equalsIgnoreCase(received);
  }

  @Override
  public String toString() {
    return hex;
  }
}
