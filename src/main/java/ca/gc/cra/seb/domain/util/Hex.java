package ca.gc.cra.seb.domain.util;

/**
 * <strong>What:</strong> Lowercase hexadecimal encoding helpers for digests.
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Hex {
  private static final char[] DIGITS = "0123456789abcdef".toCharArray();
  private static final int SHA256_HEX_LENGTH = 64;

  private Hex() {}

  /**
   * Encodes bytes as lowercase hex.
   *
   * @param data bytes to encode; {@code null} yields an empty string
   * @return hex text, two characters per byte
   */
  public static String encode(byte[] data) {
    if (data == null) {
      return "";
    }
    char[] out = new char[data.length * 2];
    for (int i = 0; i < data.length; i++) {
      int v = data[i] & 0xFF;
      out[i * 2] = DIGITS[v >>> 4];
      out[i * 2 + 1] = DIGITS[v & 0x0F];
    }
    return new String(out);
  }

  /**
   * Checks that a string is exactly 64 hex characters (either case).
   *
   * @param value candidate text; may be {@code null}
   * @return {@code true} for a well-formed SHA-256 hex digest
   */
  public static boolean isSha256Hex(String value) {
    if (value == null || value.length() != SHA256_HEX_LENGTH) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
      if (!hex) {
        return false;
      }
    }
    return true;
  }
}
