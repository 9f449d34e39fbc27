package ca.gc.cra.seb.api;

import ca.gc.cra.seb.application.key.ConfigKeyProtocol;
import ca.gc.cra.seb.config.CompositionRoot;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.RequestHash;
import ca.gc.cra.seb.logging.LoggingConfigurator;
import ca.gc.cra.seb.validation.Urls;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code seb hash} prints the value a SEB client sends in the
 * {@value ConfigKeyProtocol#CONFIG_KEY_HASH_HEADER} header for a URL.
 *
 * @since 0.1.0
 */
public final class HashCli {
  private static final Logger log = LoggerFactory.getLogger(HashCli.class);
  private static final Set<String> KEYS = Set.of("url", "configKey");
  private static final String SUMMARY_USAGE = "usage: seb hash url=URL configKey=HEX";
  private static final String HELP_TEXT = """
      Compute a SEB request hash.

      Usage:
        seb hash url=URL configKey=HEX [--verbose]

      Arguments:
        url=URL          Absolute http(s) URL of the request; any #fragment is ignored
        configKey=HEX    64-character Config Key
      """;

  private HashCli() {}

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
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliUtils.rejectUnknownKeys(kv, KEYS);
      url = Urls.requireHttpUrl("url", kv.get("url"));
      configKey = ConfigKey.of(requireKey(kv));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      RequestHash hash = root.configKeyProtocol().computeRequestHash(url, configKey);
      CliPrinter.println(hash.hex());
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure computing request hash", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception computing request hash", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String requireKey(Map<String, String> kv) {
    String value = kv.get("configKey");
    if (value == null) {
      throw new IllegalArgumentException("configKey is required");
    }
    return value;
  }
}
