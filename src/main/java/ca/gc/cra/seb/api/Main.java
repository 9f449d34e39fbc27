package ca.gc.cra.seb.api;

import ca.gc.cra.seb.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code seb} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: seb <key|hash|verify|export|inspect> [options]";
  private static final String HELP_TEXT = """
      SEB configuration toolkit

      Usage:
        seb <command> [options]

      Commands:
        key      Compute the Config Key of a JSON, YAML or plist configuration
        hash     Compute the request hash a SEB client sends for a URL
        verify   Compare a received request hash with the expected one
        export   Write a .seb file, optionally password-encrypted
        inspect  Open a .seb file and report its tag, size and Config Key

      Global flags:
        --help      Show this message (or <command> --help for details)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command without terminating the JVM.
   *
   * @param args command name followed by its arguments
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "key" -> KeyCli.run(delegateArgs);
      case "hash" -> HashCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      case "inspect" -> InspectCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
