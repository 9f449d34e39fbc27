package ca.gc.cra.seb.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults, then checks cross-key rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings for a command.
   *
   * @param command CLI command name
   * @param yaml YAML-derived settings, if a config file was given
   * @param cli CLI {@code key=value} settings
   * @param defaults defaults for the command
   * @param warn receives a message for every CLI key that overrides a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when cross-key rules fail
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlSettings = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlSettings);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (yamlSettings.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    boolean hasFile = !trim(effective.get("passwordFile")).isEmpty();
    boolean hasEnv = !trim(effective.get("passwordEnv")).isEmpty();
    if (hasFile && hasEnv) {
      throw new IllegalArgumentException("passwordFile and passwordEnv are mutually exclusive");
    }
    if (Boolean.parseBoolean(trim(effective.get("encrypt"))) && !hasFile && !hasEnv) {
      throw new IllegalArgumentException("encrypt=true requires passwordFile or passwordEnv");
    }
    if (effective.containsKey("password")) {
      throw new IllegalArgumentException(
          "passwords are not accepted as arguments; use passwordFile or passwordEnv");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
