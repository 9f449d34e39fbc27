package ca.gc.cra.seb.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flat default settings per CLI command, the lowest-precedence layer under YAML and CLI arguments.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "");

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code command} merged over the common defaults.
   *
   * @param command {@code export} or {@code inspect}
   * @return unmodifiable defaults
   * @throws IllegalArgumentException for commands without configurable settings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON);
    switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "export" -> {
        defaults.put("encrypt", "false");
        defaults.put("validate", "true");
        defaults.put("passwordFile", "");
        defaults.put("passwordEnv", "");
      }
      case "inspect" -> {
        defaults.put("passwordFile", "");
        defaults.put("passwordEnv", "");
        defaults.put("xmlOut", "");
      }
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    }
    return Map.copyOf(defaults);
  }
}
