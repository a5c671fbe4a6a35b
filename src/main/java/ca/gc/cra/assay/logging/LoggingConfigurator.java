package ca.gc.cra.assay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the verbosity of the library's own loggers.
 * <p><strong>Why:</strong> Lets a test suite surface conversion and diff diagnostics without editing the
 * logging configuration of the project under test.</p>
 * <p><strong>Role:</strong> Utility invoked by {@link ca.gc.cra.assay.config.AssayConfigLoader} when
 * {@code verboseLogging} is enabled.</p>
 * <p><strong>Thread-safety:</strong> Intended for one-off use while defaults are loaded.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when the backend does not support level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Root logger name of this library. */
  public static final String LIBRARY_LOGGER = "ca.gc.cra.assay";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the library logger threshold to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was applied; {@code false} when the backend is not Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger library = context.getLogger(LIBRARY_LOGGER);
      if (!Level.DEBUG.equals(library.getLevel())) {
        library.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
