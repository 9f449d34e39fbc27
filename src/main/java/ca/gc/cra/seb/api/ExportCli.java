package ca.gc.cra.seb.api;

import ca.gc.cra.seb.application.export.ExportOptions;
import ca.gc.cra.seb.application.export.ExportResult;
import ca.gc.cra.seb.application.port.ConfigValidationException;
import ca.gc.cra.seb.config.CompositionRoot;
import ca.gc.cra.seb.config.ExportConfig;
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
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code seb export} turns a JSON, YAML or plist configuration into a {@code .seb} file.
 * <p><strong>Why:</strong> Exam administrators author settings as text and distribute them as SEB containers.</p>
 * <p><strong>Role:</strong> Adapter that merges defaults, YAML and CLI settings, resolves the password source,
 * and drives {@link ca.gc.cra.seb.application.export.ConfigExporter}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Validate input and output paths, refusing to replace files without {@code --allow-overwrite}.</li>
 *   <li>Read passwords only from a file or an environment variable.</li>
 *   <li>Write the container through a temporary file so a failed export leaves no partial output.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final Set<String> FLAGS = Set.of("--allow-overwrite", "--dry-run");
  private static final Set<String> KEYS = Set.of("in", "out", "encrypt", "passwordFile", "passwordEnv", "validate");
  private static final String SUMMARY_USAGE =
      "usage: seb export in=PATH out=PATH [encrypt=true passwordFile=PATH|passwordEnv=VAR] [validate=false] "
          + "[config=PATH] [--allow-overwrite] [--dry-run]";
  private static final String HELP_TEXT = """
      Export a SEB configuration file.

      Usage:
        seb export in=PATH out=PATH [options] [--allow-overwrite] [--dry-run]

      Required:
        in=PATH                 Source configuration (.json, .yaml, .yml, .plist, .xml)
        out=PATH                Destination .seb file

      Optional:
        encrypt=true|false      Password-encrypt the container (default false)
        passwordFile=PATH       File whose first line is the password
        passwordEnv=VAR         Environment variable holding the password
        validate=true|false     Check settings against known SEB options (default true)
        config=PATH             YAML file with 'common' and 'export' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL        OTLP endpoint when metricsExporter=otlp

      Flags:
        --allow-overwrite       Replace an existing output file
        --dry-run               Validate settings and print the plan without writing
        --verbose               Enable DEBUG logging
        --help                  Show this message

      Passwords are never accepted directly on the command line.

      The printed Config Key is computed from the source settings. Plist dates keep
      whole seconds and nulls are written as empty strings, so a source with either
      yields a different key once the .seb file is read back; a note reports it.
      """;

  private ExportCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the export and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for export");
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> effective;
    try {
      List<String> unknownFlags = input.unknownFlags(FLAGS);
      if (!unknownFlags.isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + String.join(", ", unknownFlags));
      }
      effective = ConfigCliUtils.effectiveConfig("export", CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.rejectUnknownKeys(effective, KEYS);
    } catch (IOException ex) {
      log.error("Unable to read config file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ExportConfig config;
    Path source;
    Path target;
    DocumentReader reader;
    try {
      config = ExportConfig.fromMap(effective);
      source = Paths.requireReadableFile("in", config.input());
      target = Paths.requireWritableFile("out", config.output(), allowOverwrite);
      reader = DocumentReaders.forPath(source);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!config.encrypt() && config.password().isPresent()) {
      log.warn("Ignoring password source {} because encrypt=false", config.password());
    }
    Optional<String> password;
    try {
      password = config.encrypt() ? config.password().resolve() : Optional.empty();
    } catch (IOException ex) {
      log.error("Unable to read password file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid password source: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, source, target, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      ConfigurationDocument document = reader.read(source);
      ExportOptions options = config.encrypt()
          ? ExportOptions.encrypted(password.orElseThrow())
          : ExportOptions.defaults();
      ExportResult result = root.exporter().export(document, options.withValidate(config.validate()));
      ConfigKey key = root.configKeyProtocol().computeConfigKey(document);
      ConfigKey written = root.configKeyProtocol().computeConfigKey(root.plistParser().parse(result.xml()));
      ConfigCliUtils.writeAtomically(target, result.data());
      log.info("Exported {} to {} ({} bytes, Config Key {})",
          source, target, result.size(), Logs.fingerprint(key.hex()));
      CliPrinter.printLines(
          "Wrote " + target + " (" + result.size() + " bytes, " + (config.encrypt() ? "encrypted" : "plain") + ")",
          "Config Key: " + key.hex());
      if (!written.equals(key)) {
        log.warn("Config Key of {} as read back differs from the source key", target);
        CliPrinter.printLines(
            "Note: reading " + target + " back yields Config Key " + written.hex(),
            "      (plist dates keep whole seconds and nulls become empty strings)");
      }
      return ExitCode.SUCCESS;
    } catch (ConfigValidationException ex) {
      log.error("Configuration {} failed validation:", source);
      for (String violation : ex.violations()) {
        log.error("  {}", violation);
      }
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Export I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Malformed configuration {}: {}", source, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during export", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception during export", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(ExportConfig config, Path source, Path target, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Export dry-run: no file will be written.",
        " Input            : " + source,
        " Output           : " + target,
        " Container        : " + (config.encrypt() ? "encrypted (pwcc)" : "plain (plnd)"),
        " Password source  : " + describePassword(config),
        " Validate         : " + config.validate(),
        " Allow overwrite  : " + allowOverwrite,
        " Re-run without --dry-run to write the file.");
  }

  private static String describePassword(ExportConfig config) {
    if (config.password().file().isPresent()) {
      return "file " + config.password().file().get();
    }
    return config.password().environmentVariable().map(name -> "environment " + name).orElse("<none>");
  }
}
