package ca.gc.cra.seb.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the {@code inspect} command.
 *
 * @param input {@code .seb} file to open
 * @param password password source for encrypted containers
 * @param xmlOut optional file receiving the decoded plist
 * @since 0.1.0
 */
public record InspectConfig(Path input, PasswordSource password, Optional<Path> xmlOut) {
  public InspectConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(password, "password");
    xmlOut = Objects.requireNonNullElse(xmlOut, Optional.empty());
  }

  /**
   * Parses merged settings.
   *
   * @param map effective settings
   * @return inspect settings
   * @throws IllegalArgumentException when {@code in} is missing
   */
  public static InspectConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String xmlOut = map.getOrDefault("xmlOut", "").trim();
    return new InspectConfig(
        ExportConfig.requirePath(map, "in"),
        PasswordSource.fromMap(map),
        xmlOut.isEmpty() ? Optional.empty() : Optional.of(Path.of(xmlOut)));
  }
}
