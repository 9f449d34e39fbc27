package ca.gc.cra.seb.application.export;

import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.infrastructure.container.ContainerTag;
import java.util.Objects;

/**
 * Contents recovered from a {@code .seb} container.
 *
 * @param tag container tag found
 * @param xml decoded plist payload
 * @param document parsed configuration
 * @param configKey Config Key of the parsed configuration
 * @since 0.1.0
 */
public record ImportResult(ContainerTag tag, String xml, ConfigurationDocument document, ConfigKey configKey) {
  public ImportResult {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(xml, "xml");
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(configKey, "configKey");
  }
}
