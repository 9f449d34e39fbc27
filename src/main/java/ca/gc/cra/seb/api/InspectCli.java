package ca.gc.cra.seb.api;

import ca.gc.cra.seb.application.export.ImportResult;
import ca.gc.cra.seb.config.CompositionRoot;
import ca.gc.cra.seb.config.InspectConfig;
import ca.gc.cra.seb.infrastructure.container.ContainerException;
import ca.gc.cra.seb.infrastructure.container.ContainerTag;
import ca.gc.cra.seb.infrastructure.container.PasswordRequiredException;
import ca.gc.cra.seb.logging.LoggingConfigurator;
import ca.gc.cra.seb.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code seb inspect} opens a {@code .seb} file, prints its container tag, size and Config Key, and can write
 * the recovered plist.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final Set<String> FLAGS = Set.of("--allow-overwrite");
  private static final Set<String> KEYS = Set.of("in", "passwordFile", "passwordEnv", "xmlOut");
  private static final String SUMMARY_USAGE =
      "usage: seb inspect in=PATH [passwordFile=PATH|passwordEnv=VAR] [xmlOut=PATH] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Inspect a SEB configuration file.

      Usage:
        seb inspect in=PATH [options] [--allow-overwrite]

      Arguments:
        in=PATH              .seb file to open
        passwordFile=PATH    File whose first line is the password (encrypted files)
        passwordEnv=VAR      Environment variable holding the password (encrypted files)
        xmlOut=PATH          Write the decoded plist XML here
        config=PATH          YAML file with 'common' and 'inspect' sections

      Flags:
        --allow-overwrite    Replace an existing xmlOut file
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    InspectConfig config;
    Path source;
    Optional<Path> xmlOut;
    try {
      List<String> unknownFlags = input.unknownFlags(FLAGS);
      if (!unknownFlags.isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + String.join(", ", unknownFlags));
      }
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("inspect", CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.rejectUnknownKeys(effective, KEYS);
      config = InspectConfig.fromMap(effective);
      source = Paths.requireReadableFile("in", config.input());
      xmlOut = config.xmlOut().map(path -> Paths.requireWritableFile("xmlOut", path, allowOverwrite));
    } catch (IOException ex) {
      log.error("Unable to read config file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      byte[] data = Files.readAllBytes(source);
      ContainerTag tag = root.containerCodec().inspect(data);
      CliPrinter.printLines(
          "File     : " + source,
          "Size     : " + data.length + " bytes",
          "Tag      : " + tag.text() + " (" + (tag == ContainerTag.PASSWORD ? "password-encrypted" : "plain") + ")");
      ImportResult result = root.importer().importFile(data, config.password().resolve());
      CliPrinter.printLines(
          "Settings : " + result.document().size(),
          "Version  : " + result.document().originatorVersion().orElse("<none>"),
          "Config Key: " + result.configKey().hex());
      if (xmlOut.isPresent()) {
        ConfigCliUtils.writeAtomically(xmlOut.get(), result.xml().getBytes(StandardCharsets.UTF_8));
        CliPrinter.println("Wrote plist to " + xmlOut.get());
      }
      return ExitCode.SUCCESS;
    } catch (PasswordRequiredException ex) {
      log.error("{}; supply passwordFile=PATH or passwordEnv=VAR", ex.getMessage());
      return ExitCode.CONTAINER_ERROR;
    } catch (ContainerException ex) {
      log.error("Unable to open {}: {}", source, ex.getMessage());
      return ExitCode.CONTAINER_ERROR;
    } catch (IOException ex) {
      log.error("Inspect I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Malformed configuration in {}: {}", source, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception during inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
