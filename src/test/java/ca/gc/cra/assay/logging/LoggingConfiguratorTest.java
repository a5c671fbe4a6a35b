package ca.gc.cra.assay.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  private Level previous;

  @AfterEach
  void restoreLevel() {
    library().setLevel(previous);
  }

  @Test
  void verboseLoggingLowersLibraryLevelToDebug() {
    previous = library().getLevel();

    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, library().getLevel());
  }

  private static Logger library() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    return context.getLogger(LoggingConfigurator.LIBRARY_LOGGER);
  }
}
