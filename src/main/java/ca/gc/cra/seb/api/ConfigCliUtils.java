package ca.gc.cra.seb.api;

import ca.gc.cra.seb.config.ConfigMerger;
import ca.gc.cra.seb.config.DefaultsForMode;
import ca.gc.cra.seb.config.YamlConfigLoader;
import ca.gc.cra.seb.validation.Paths;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers shared by the commands that read a YAML config file and write output files.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from the CLI map.
   *
   * @param args mutable CLI map
   * @return config path, if given
   */
  static Optional<Path> extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return Optional.empty();
    }
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(value.trim()));
  }

  /**
   * Rejects keys a command does not understand.
   *
   * @param args remaining settings
   * @param allowed accepted keys
   * @throws IllegalArgumentException naming the unknown keys in sorted order
   */
  static void rejectUnknownKeys(Map<String, String> args, Set<String> allowed) {
    Set<String> unknown = new TreeSet<>(args.keySet());
    unknown.removeAll(allowed);
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", unknown));
    }
  }

  /**
   * Layers defaults, the optional YAML file and the CLI map for {@code command}, then applies telemetry
   * settings.
   *
   * @param command {@code export} or {@code inspect}
   * @param cli mutable CLI map; {@code config} is consumed
   * @return mutable effective settings without telemetry keys
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the YAML or the merged settings are invalid
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli) throws IOException {
    Optional<Path> configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath.isPresent()) {
      yaml = YamlConfigLoader.load(Paths.requireReadableFile("config", configPath.get()), command);
      log.debug("Loaded {} settings from {}", command, configPath.get());
    }
    Map<String, String> merged = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        command, yaml, cli, DefaultsForMode.asFlatMap(command), log::warn));
    TelemetryConfigurator.configureMetrics(merged);
    return merged;
  }

  /**
   * Writes {@code data} through a sibling temporary file so readers never observe a partial file.
   *
   * @param target destination file
   * @param data file contents
   * @throws IOException when writing or moving fails; the temporary file is removed
   */
  static void writeAtomically(Path target, byte[] data) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    try {
      Files.write(tmp, data);
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }
}
