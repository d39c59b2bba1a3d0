package ca.gc.cra.opencoffee.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the configured log level and optional file output to Logback at startup.
 * <p><strong>Role:</strong> Adapter-side utility bridging {@code log.*} settings and CLI flags to the logging backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Set the root level from configuration, or DEBUG when {@code --verbose} is given.</li>
 *   <li>Attach a daily-rolling {@code opencoffee.log} appender when file logging is enabled.</li>
 *   <li>Warn when the SLF4J backend is not Logback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Name of the file appender attached by {@link #configure}. */
  public static final String FILE_APPENDER_NAME = "OPENCOFFEE_FILE";
  /** Base name of the active log file. */
  public static final String LOG_FILE_NAME = "opencoffee.log";

  private static final String FILE_PATTERN = "[%d{yyyy-MM-dd HH:mm:ss}] %-5level: %msg%n";
  private static final int MAX_HISTORY_DAYS = 30;

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    LoggerContext context = logbackContext();
    if (context != null) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
    }
  }

  /**
   * Applies level and file output settings.
   *
   * @param levelName Logback level name such as {@code INFO}; unknown names fall back to INFO
   * @param verbose when {@code true}, DEBUG wins over {@code levelName}
   * @param toFile whether to attach the rolling file appender
   * @param logDirectory directory of the log file; required when {@code toFile} is {@code true}
   */
  public static void configure(String levelName, boolean verbose, boolean toFile, Path logDirectory) {
    LoggerContext context = logbackContext();
    if (context == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(verbose ? Level.DEBUG : Level.toLevel(levelName, Level.INFO));

    detachFileAppender(root);
    if (toFile) {
      Objects.requireNonNull(logDirectory, "logDirectory");
      root.addAppender(rollingFileAppender(context, logDirectory));
      log.debug("File logging enabled under {}", logDirectory);
    }
  }

  /**
   * Detaches and stops the file appender attached by {@link #configure}, closing its file.
   *
   * @param root root logger
   * @return {@code true} if an appender was attached
   */
  static boolean detachFileAppender(Logger root) {
    Appender<ILoggingEvent> current = root.getAppender(FILE_APPENDER_NAME);
    if (current == null) {
      return false;
    }
    root.detachAppender(current);
    current.stop();
    return true;
  }

  private static RollingFileAppender<ILoggingEvent> rollingFileAppender(LoggerContext context, Path directory) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER_NAME);
    appender.setFile(directory.resolve(LOG_FILE_NAME).toString());
    appender.setEncoder(encoder);

    TimeBasedRollingPolicy<ILoggingEvent> policy = new TimeBasedRollingPolicy<>();
    policy.setContext(context);
    policy.setParent(appender);
    policy.setFileNamePattern(directory.resolve("opencoffee.%d{yyyy-MM-dd}.log").toString());
    policy.setMaxHistory(MAX_HISTORY_DAYS);
    policy.start();

    appender.setRollingPolicy(policy);
    appender.start();
    return appender;
  }

  private static LoggerContext logbackContext() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context;
    }
    log.warn("Logging configuration requested but backend {} does not support dynamic updates",
        factory.getClass().getName());
    return null;
  }
}
