package ca.gc.cra.assay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssayConfigTest {

  @Test
  void defaults() {
    AssayConfig config = AssayConfig.defaults();

    assertEquals(" - ", config.messageSeparator());
    assertEquals(Duration.ofMillis(100), config.pollInterval());
    assertTrue(config.diffEnabled());
    assertEquals(512, config.maxValueLength());
    assertFalse(config.verboseLogging());
  }

  @Test
  void defaultsMapRoundTripsToDefaults() {
    assertEquals(AssayConfig.defaults(), AssayConfig.fromMap(AssayConfig.defaultsAsMap()));
  }

  @Test
  void fromMapParsesValues() {
    AssayConfig config = AssayConfig.fromMap(Map.of(
        AssayConfig.KEY_MESSAGE_SEPARATOR, " | ",
        AssayConfig.KEY_POLL_INTERVAL_MILLIS, "25",
        AssayConfig.KEY_DIFF_ENABLED, "false",
        AssayConfig.KEY_MAX_VALUE_LENGTH, "64",
        "unknown", "ignored"));

    assertEquals(" | ", config.messageSeparator());
    assertEquals(Duration.ofMillis(25), config.pollInterval());
    assertFalse(config.diffEnabled());
    assertEquals(64, config.maxValueLength());
  }

  @Test
  void fromMapRejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class,
        () -> AssayConfig.fromMap(Map.of(AssayConfig.KEY_POLL_INTERVAL_MILLIS, "0")));
    assertThrows(IllegalArgumentException.class,
        () -> AssayConfig.fromMap(Map.of(AssayConfig.KEY_MAX_VALUE_LENGTH, "8")));
    assertThrows(IllegalArgumentException.class,
        () -> AssayConfig.fromMap(Map.of(AssayConfig.KEY_DIFF_ENABLED, "maybe")));
  }

  @Test
  void constructorRejectsEmptySeparator() {
    assertThrows(IllegalArgumentException.class,
        () -> new AssayConfig("", Duration.ofMillis(100), true, 512, false));
  }
}
