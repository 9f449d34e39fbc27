package ca.gc.cra.seb.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback levels from CLI flags.
 * <p><strong>Role:</strong> Adapter-side utility called once during CLI start-up.</p>
 * <p><strong>Thread-safety:</strong> Intended for the start-up thread only.</p>
 *
 * @implNote Only Logback supports the level change; other SLF4J backends keep their configuration and a warning is
 * logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /** Lowers the root logger to WARN so only the command's own output reaches the console. */
  public static void enableQuietLogging() {
    setRootLevel(Level.WARN);
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      root.setLevel(level);
      return;
    }
    log.warn("Cannot set log level {}: SLF4J backend {} is not Logback", level, factory.getClass().getName());
  }
}
