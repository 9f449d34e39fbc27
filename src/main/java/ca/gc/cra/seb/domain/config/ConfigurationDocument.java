package ca.gc.cra.seb.domain.config;

import ca.gc.cra.seb.domain.value.ConfigValue;
import ca.gc.cra.seb.domain.value.ConfigValues;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Root of an SEB configuration; always a map.
 * <p><strong>Why:</strong> Gives the serializers a typed entry point and names the one root key that is excluded
 * from hashing.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by document readers or the schema collaborator.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param root root mapping; never {@code null}
 * @since 0.1.0
 */
public record ConfigurationDocument(ConfigValue.MapValue root) {
  /** Root key recording the producing application version; excluded from the canonical form. */
  public static final String ORIGINATOR_VERSION_KEY = "originatorVersion";

  public ConfigurationDocument {
    Objects.requireNonNull(root, "root");
  }

  /**
   * Wraps a plain Java map.
   *
   * @param settings settings keyed by option name
   * @return document
   */
  public static ConfigurationDocument of(Map<String, ?> settings) {
    return new ConfigurationDocument(ConfigValues.mapOf(settings));
  }

  /**
   * Returns the producer version recorded in the document, when it is a string.
   *
   * @return originator version if present
   */
  public Optional<String> originatorVersion() {
    ConfigValue value = root.get(ORIGINATOR_VERSION_KEY);
    if (value instanceof ConfigValue.Str str) {
      return Optional.of(str.value());
    }
    return Optional.empty();
  }

  /**
   * Looks up a root-level setting.
   *
   * @param key option name
   * @return value if present
   */
  public Optional<ConfigValue> get(String key) {
    return Optional.ofNullable(root.get(key));
  }

  public int size() {
    return root.entries().size();
  }
}
