package io.qzss.dcragent.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts agent logging at runtime from CLI flags.
 * <p><strong>Why:</strong> Operators raise verbosity while tuning keyword filters without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread and the shutdown hook.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level.
   *
   * @param level Logback level name such as {@code INFO} or {@code WARN}
   * @throws IllegalArgumentException if the name is not a Logback level
   */
  public static void setRootLevel(String level) {
    Level parsed = Level.toLevel(level, null);
    if (parsed == null) {
      throw new IllegalArgumentException("logLevel must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (was "
          + level + ")");
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      root.setLevel(parsed);
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }

  /**
   * Stops the Logback context so buffered appenders, including the report file, reach disk before the JVM halts.
   */
  public static void shutdown() {
    if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
      context.stop();
    }
  }
}
