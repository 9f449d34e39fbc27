package ca.gc.cra.seb.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the {@code export} command.
 *
 * @param input source configuration (JSON, YAML or plist)
 * @param output {@code .seb} file to write
 * @param encrypt whether to write an encrypted container
 * @param password where the encryption password comes from
 * @param validate whether to check the settings against the option table first
 * @since 0.1.0
 */
public record ExportConfig(Path input, Path output, boolean encrypt, PasswordSource password, boolean validate) {
  public ExportConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(password, "password");
    if (encrypt && !password.isPresent()) {
      throw new IllegalArgumentException("encrypt=true requires passwordFile or passwordEnv");
    }
  }

  /**
   * Parses merged settings.
   *
   * @param map effective settings
   * @return export settings
   * @throws IllegalArgumentException when {@code in} or {@code out} is missing or a flag is not a boolean
   */
  public static ExportConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    return new ExportConfig(
        requirePath(map, "in"),
        requirePath(map, "out"),
        parseBoolean(map, "encrypt", false),
        PasswordSource.fromMap(map),
        parseBoolean(map, "validate", true));
  }

  static Path requirePath(Map<String, String> map, String key) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Path.of(value.trim());
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false");
    };
  }
}
