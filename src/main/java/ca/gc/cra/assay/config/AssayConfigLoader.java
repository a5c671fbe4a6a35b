package ca.gc.cra.assay.config;

import ca.gc.cra.assay.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the {@link AssayConfig} used by contexts created without explicit
 * configuration.
 * <p><strong>Why:</strong> Lets a project tune separators, polling and rendering once for its whole test
 * suite.</p>
 * <p><strong>Role:</strong> Composition helper consulted by {@link ca.gc.cra.assay.api.Assay}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Layer built-in defaults, the classpath resource {@value #RESOURCE} ({@code common} and
 *   {@code assay} sections) and system properties prefixed {@value #PROPERTY_PREFIX}.</li>
 *   <li>Validate the merged values and apply {@code verboseLogging}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Process defaults are resolved once through a holder class.</p>
 * <p><strong>Observability:</strong> Logs the resource location at DEBUG and overrides at WARN.</p>
 *
 * @since 0.1.0
 */
public final class AssayConfigLoader {
  /** Classpath resource holding YAML configuration. */
  public static final String RESOURCE = "assay.yaml";
  /** YAML section layered over {@code common}. */
  public static final String SECTION = "assay";
  /** Prefix of system properties overriding configuration keys. */
  public static final String PROPERTY_PREFIX = "assay.";

  private static final Logger log = LoggerFactory.getLogger(AssayConfigLoader.class);

  private AssayConfigLoader() {}

  /**
   * Returns the process-wide defaults, loading them on first use.
   *
   * @return resolved configuration
   * @throws IllegalArgumentException (wrapped in {@link ExceptionInInitializerError} on first use) when the
   *     configuration is invalid
   */
  public static AssayConfig processDefaults() {
    return Holder.CONFIG;
  }

  /**
   * Loads configuration from the context class loader and the JVM system properties.
   *
   * @return resolved configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static AssayConfig load() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = AssayConfigLoader.class.getClassLoader();
    }
    return load(loader, System.getProperties());
  }

  /**
   * Loads configuration from {@code loader} and {@code properties}.
   *
   * @param loader class loader searched for {@value #RESOURCE}
   * @param properties source of {@value #PROPERTY_PREFIX}-prefixed overrides
   * @return resolved configuration
   * @throws IllegalArgumentException when a value is invalid
   * @throws UncheckedIOException when the resource exists but cannot be read
   */
  public static AssayConfig load(ClassLoader loader, Properties properties) {
    Objects.requireNonNull(loader, "loader");
    Optional<Map<String, String>> yaml = readResource(loader);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml, overrides(properties), AssayConfig.defaultsAsMap(), log::warn);
    AssayConfig config = AssayConfig.fromMap(effective);
    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return config;
  }

  /**
   * Extracts {@value #PROPERTY_PREFIX}-prefixed entries with the prefix removed.
   *
   * @param properties source properties; {@code null} yields an empty map
   * @return override map
   */
  static Map<String, String> overrides(Properties properties) {
    if (properties == null) {
      return Map.of();
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      if (name.startsWith(PROPERTY_PREFIX) && name.length() > PROPERTY_PREFIX.length()) {
        result.put(name.substring(PROPERTY_PREFIX.length()), properties.getProperty(name));
      }
    }
    return result;
  }

  private static Optional<Map<String, String>> readResource(ClassLoader loader) {
    URL url = loader.getResource(RESOURCE);
    if (url == null) {
      return Optional.empty();
    }
    log.debug("Loading assertion defaults from {}", url);
    try (InputStream in = url.openStream()) {
      return Optional.of(YamlConfigLoader.load(in, url.toString(), SECTION));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read " + url, ex);
    }
  }

  private static final class Holder {
    static final AssayConfig CONFIG = load();
  }
}
