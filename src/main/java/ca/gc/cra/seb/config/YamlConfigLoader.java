package ca.gc.cra.seb.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads CLI settings from a YAML file, merging the {@code common} section with the section named after the
 * command ({@code export}, {@code inspect}). Nested mappings flatten to dotted keys.
 *
 * <pre>
 * common:
 *   metricsExporter: none
 * export:
 *   encrypt: true
 *   passwordEnv: SEB_PASSWORD
 * </pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads and flattens the sections relevant to {@code command}.
   *
   * @param path YAML file
   * @param command CLI command name
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a section is not a mapping
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = command.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<?, ?> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = root.get("common");
    if (common != null) {
      flatten(asMap(common, "common"), "", flattened);
    }
    Object commandSection = root.get(section);
    if (commandSection != null) {
      flatten(asMap(commandSection, section), "", flattened);
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<?, ?> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    return map;
  }

  private static void flatten(Map<?, ?> source, String prefix, Map<String, String> target) {
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings"
            + (prefix.isEmpty() ? "" : " under " + prefix));
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(nested, composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
