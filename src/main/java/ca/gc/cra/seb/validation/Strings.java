package ca.gc.cra.seb.validation;

/**
 * <strong>What:</strong> String checks for CLI arguments and configuration values.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character input.</li>
 *   <li>Enforce printable ASCII with a length budget for identifiers such as environment variable names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> None; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Paths
 * @see Urls
 */
public final class Strings {
  private Strings() {}

  /**
   * Ensures a value is non-blank and free of ISO control characters.
   *
   * @param name parameter name used in messages; {@code null} means {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws IllegalArgumentException if the value is missing, blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    if (value == null) {
      throw new IllegalArgumentException(label(name) + " is required");
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Ensures a value is printable ASCII ({@code 0x20-0x7E}) and at most {@code maxLength} characters.
   *
   * @param name parameter name used in messages
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if {@code maxLength} is negative or the value is too long or not printable
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative");
    }
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return sanitized;
  }

  /**
   * Reports whether the text contains an ISO control character.
   *
   * @param value text to scan
   * @return {@code true} when any character is a control character
   */
  public static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
