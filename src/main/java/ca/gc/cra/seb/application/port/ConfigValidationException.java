package ca.gc.cra.seb.application.port;

import java.util.List;

/**
 * Raised by a {@link ConfigurationValidator} when a document violates the option schema.
 * Propagated to callers unchanged.
 *
 * @since 0.1.0
 */
public final class ConfigValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final List<String> violations;

  /**
   * Creates an exception listing schema violations.
   *
   * @param violations human-readable violations, one per offending key
   */
  public ConfigValidationException(List<String> violations) {
    super(buildMessage(violations));
    this.violations = List.copyOf(violations);
  }

  /**
   * Violations in detection order.
   *
   * @return immutable list
   */
  public List<String> violations() {
    return violations;
  }

  private static String buildMessage(List<String> violations) {
    if (violations == null || violations.isEmpty()) {
      return "Invalid SEB configuration";
    }
    return "Invalid SEB configuration: " + String.join("; ", violations);
  }
}
