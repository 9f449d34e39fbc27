package ca.gc.cra.seb.api;

import ca.gc.cra.seb.application.canonical.CanonicalSerializer;
import ca.gc.cra.seb.config.CompositionRoot;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.infrastructure.document.DocumentReader;
import ca.gc.cra.seb.infrastructure.document.DocumentReaders;
import ca.gc.cra.seb.logging.LoggingConfigurator;
import ca.gc.cra.seb.logging.Logs;
import ca.gc.cra.seb.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code seb key} prints the Config Key of a configuration file.
 * <p><strong>Why:</strong> Exam servers store the key of the configuration they distributed and compare
 * request hashes against it.</p>
 * <p><strong>Role:</strong> Adapter from the command line to
 * {@link ca.gc.cra.seb.application.key.ConfigKeyProtocol#computeConfigKey(ConfigurationDocument)}.</p>
 *
 * @since 0.1.0
 */
public final class KeyCli {
  private static final Logger log = LoggerFactory.getLogger(KeyCli.class);
  private static final Set<String> FLAGS = Set.of("--show-canonical");
  private static final Set<String> KEYS = Set.of("in");
  private static final String SUMMARY_USAGE = "usage: seb key in=PATH [--show-canonical] [--verbose]";
  private static final String HELP_TEXT = """
      Compute the SEB Config Key of a configuration.

      Usage:
        seb key in=PATH [--show-canonical] [--verbose]

      Arguments:
        in=PATH            JSON, YAML or plist configuration (.json, .yaml, .yml, .plist, .xml)

      Flags:
        --show-canonical   Also print the canonical form that is hashed
        --verbose          Enable DEBUG logging
        --help             Show this message

      Output:
        The 64-character lowercase hex Config Key on the last line.
      """;

  private KeyCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path source;
    DocumentReader reader;
    try {
      List<String> unknownFlags = input.unknownFlags(FLAGS);
      if (!unknownFlags.isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + String.join(", ", unknownFlags));
      }
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      String in = kv.remove("in");
      ConfigCliUtils.rejectUnknownKeys(kv, KEYS);
      if (in == null) {
        throw new IllegalArgumentException("in is required");
      }
      source = Paths.requireReadableFile("in", Path.of(in));
      reader = DocumentReaders.forPath(source);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      ConfigurationDocument document = reader.read(source);
      ConfigKey key = root.configKeyProtocol().computeConfigKey(document);
      if (input.hasFlag("--show-canonical")) {
        CliPrinter.println(new CanonicalSerializer().serialize(document));
      }
      CliPrinter.println(key.hex());
      log.info("Computed Config Key {} for {} ({} settings)", Logs.fingerprint(key.hex()), source, document.size());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", source, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Malformed configuration {}: {}", source, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure computing Config Key", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception computing Config Key", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
