package ca.gc.cra.seb.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep secrets and large payloads out of logs.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bound plist excerpts to a byte budget without splitting a UTF-8 sequence.</li>
 *   <li>Mask passwords entirely and Config Keys down to a short prefix.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int FINGERPRINT_CHARS = 8;

  private Logs() {}

  /**
   * Truncates text to at most {@code maxBytes} UTF-8 bytes, noting the original size.
   *
   * @param value text; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value itself when it fits, otherwise a truncated copy with a size suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // back off continuation bytes (10xxxxxx)
    while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
      end--;
    }
    return new String(bytes, 0, end, StandardCharsets.UTF_8)
        + "... (truncated, " + end + " of " + bytes.length + " bytes)";
  }

  /**
   * Returns the redaction placeholder.
   *
   * @param value ignored secret
   * @return {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Shortens a key or hash to its first eight characters so log lines can be correlated without exposing it.
   *
   * @param hex key or hash text
   * @return prefix followed by {@code "..."}, or the placeholder for short or {@code null} input
   */
  public static String fingerprint(String hex) {
    if (hex == null) {
      return NULL_PLACEHOLDER;
    }
    if (hex.length() <= FINGERPRINT_CHARS) {
      return REDACTED_PLACEHOLDER;
    }
    return hex.substring(0, FINGERPRINT_CHARS) + "...";
  }
}
