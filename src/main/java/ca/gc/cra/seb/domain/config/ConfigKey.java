package ca.gc.cra.seb.domain.config;

import ca.gc.cra.seb.domain.util.Hex;
import java.util.Locale;
import java.util.Objects;

/**
 * SHA-256 Config Key of a configuration's canonical form, held as 64 lowercase hex characters.
 *
 * @param hex lowercase hex digest
 * @since 0.1.0
 */
public record ConfigKey(String hex) {
  public ConfigKey {
    Objects.requireNonNull(hex, "hex");
    hex = hex.trim().toLowerCase(Locale.ROOT);
    if (!Hex.isSha256Hex(hex)) {
      throw new IllegalArgumentException("Config Key must be 64 hexadecimal characters");
    }
  }

  /**
   * Parses a Config Key supplied by an operator or a stored record; case is normalized.
   *
   * @param hex 64 hex characters
   * @return config key
   * @throws IllegalArgumentException when the text is not a SHA-256 hex digest
   */
  public static ConfigKey of(String hex) {
    return new ConfigKey(hex);
  }

  @Override
  public String toString() {
    return hex;
  }
}
