package ca.gc.cra.seb.api;

import ca.gc.cra.seb.config.CompositionRoot;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.util.Hex;
import ca.gc.cra.seb.logging.LoggingConfigurator;
import ca.gc.cra.seb.validation.Strings;
import ca.gc.cra.seb.validation.Urls;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code seb verify} checks a request hash received from a SEB client.
 * <p><strong>Why:</strong> Lets an operator reproduce a server-side rejection from logged request data.</p>
 * <p>Exits {@link ExitCode#SUCCESS} on a match and {@link ExitCode#VERIFICATION_FAILED} otherwise.</p>
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final Set<String> KEYS = Set.of("url", "configKey", "hash");
  private static final String SUMMARY_USAGE = "usage: seb verify url=URL configKey=HEX hash=HEX";
  private static final String HELP_TEXT = """
      Verify a SEB request hash.

      Usage:
        seb verify url=URL configKey=HEX hash=HEX [--verbose]

      Arguments:
        url=URL          Absolute http(s) URL of the request; any #fragment is ignored
        configKey=HEX    Expected Config Key
        hash=HEX         Value of the X-SafeExamBrowser-ConfigKeyHash header

      Exit status:
        0 when the hash matches, 1 when it does not.
      """;

  private VerifyCli() {}

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

    String url;
    ConfigKey configKey;
    String received;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliUtils.rejectUnknownKeys(kv, KEYS);
      url = Urls.requireHttpUrl("url", kv.get("url"));
      configKey = ConfigKey.of(HashCli.requireKey(kv));
      received = Strings.requireNonBlank("hash", kv.get("hash"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!Hex.isSha256Hex(received.trim().toLowerCase(Locale.ROOT))) {
      log.warn("Received hash is not a SHA-256 hex digest; it cannot match");
    }

    try (CompositionRoot root = new CompositionRoot()) {
      boolean match = root.configKeyProtocol().verify(url, configKey, received);
      CliPrinter.println(match ? "match" : "mismatch");
      return match ? ExitCode.SUCCESS : ExitCode.VERIFICATION_FAILED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure verifying request hash", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception verifying request hash", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
