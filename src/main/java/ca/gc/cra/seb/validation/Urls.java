package ca.gc.cra.seb.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Checks for URLs supplied on the command line.
 *
 * @since 0.1.0
 */
public final class Urls {
  private Urls() {}

  /**
   * Ensures {@code value} is an absolute {@code http} or {@code https} URL with a host. Fragments are allowed;
   * the Config Key protocol strips them itself.
   *
   * @param name parameter name used in messages
   * @param value candidate URL
   * @return trimmed URL text, unchanged otherwise
   * @throws IllegalArgumentException when the URL is malformed, relative, lacks a host or uses another scheme
   */
  public static String requireHttpUrl(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URL", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    return trimmed;
  }
}
