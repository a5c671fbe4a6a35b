package ca.gc.cra.assay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssayConfigLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void withoutResourceOrPropertiesUsesDefaults() throws IOException {
    try (URLClassLoader loader = loaderFor(tempDir)) {
      assertEquals(AssayConfig.defaults(), AssayConfigLoader.load(loader, new Properties()));
    }
  }

  @Test
  void resourceAndPropertiesAreLayered() throws IOException {
    Files.writeString(tempDir.resolve(AssayConfigLoader.RESOURCE), """
        common:
          maxValueLength: 128
        assay:
          pollIntervalMillis: 20
          diffEnabled: false
        """);
    Properties properties = new Properties();
    properties.setProperty("assay.pollIntervalMillis", "5");
    properties.setProperty("unrelated.key", "x");

    AssayConfig config;
    try (URLClassLoader loader = loaderFor(tempDir)) {
      config = AssayConfigLoader.load(loader, properties);
    }

    assertEquals(Duration.ofMillis(5), config.pollInterval());
    assertEquals(128, config.maxValueLength());
    assertFalse(config.diffEnabled());
  }

  @Test
  void invalidValuesFailLoading() throws IOException {
    Properties properties = new Properties();
    properties.setProperty("assay.maxValueLength", "lots");

    try (URLClassLoader loader = loaderFor(tempDir)) {
      assertThrows(IllegalArgumentException.class, () -> AssayConfigLoader.load(loader, properties));
    }
  }

  @Test
  void overridesStripPrefix() {
    Properties properties = new Properties();
    properties.setProperty("assay.diffEnabled", "false");
    properties.setProperty("assay.", "ignored");
    properties.setProperty("other", "ignored");

    assertEquals(Map.of("diffEnabled", "false"), AssayConfigLoader.overrides(properties));
    assertEquals(Map.of(), AssayConfigLoader.overrides(null));
  }

  private static URLClassLoader loaderFor(Path dir) throws IOException {
    return new URLClassLoader(new URL[] {dir.toUri().toURL()}, null);
  }
}
