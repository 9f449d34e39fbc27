package ca.gc.cra.seb.application.port;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;

/**
 * <strong>What:</strong> Seam to the SEB option schema.
 * <p><strong>Why:</strong> The schema (option names, types, ranges) evolves independently of the serialization and
 * container protocol; exporters call it before rendering.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code SettingsValidator}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or immutable.</p>
 *
 * @implNote Implementations must not inject defaults; the document passed in is the document hashed.
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfigurationValidator {
  /**
   * Validates a document.
   *
   * @param document candidate configuration
   * @return the same document when valid
   * @throws ConfigValidationException listing every violation found
   */
  ConfigurationDocument validate(ConfigurationDocument document);

  /** Validator that accepts every document. */
  ConfigurationValidator NO_OP = document -> document;
}
