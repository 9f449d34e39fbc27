package ca.gc.cra.seb.infrastructure.document;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValues;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads YAML configuration documents with SnakeYAML's safe constructor.
 *
 * <p>{@code !!binary} scalars become byte values and YAML timestamps become timestamps; no arbitrary types are
 * instantiated.</p>
 *
 * @since 0.1.0
 */
public final class YamlDocumentReader implements DocumentReader {

  @Override
  public ConfigurationDocument parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(yaml);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML configuration", ex);
    }
    if (document == null) {
      return ConfigurationDocument.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("YAML configuration must be a mapping");
    }
    return new ConfigurationDocument(ConfigValues.mapOf(map));
  }
}
