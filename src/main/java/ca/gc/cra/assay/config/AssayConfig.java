package ca.gc.cra.assay.config;

import ca.gc.cra.assay.validation.Numbers;
import ca.gc.cra.assay.validation.Strings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Library-wide defaults applied to freshly created assertion contexts.
 *
 * @param messageSeparator separator joining failure messages, unless a context overrides it
 * @param pollInterval delay between predicate evaluations in {@code waitForTrue}
 * @param diffEnabled whether equality failures on collections carry a structural diff
 * @param maxValueLength maximum characters of a rendered operand in failure messages
 * @param verboseLogging whether the library loggers are raised to DEBUG when defaults load
 * @since 0.1.0
 */
public record AssayConfig(
    String messageSeparator,
    Duration pollInterval,
    boolean diffEnabled,
    int maxValueLength,
    boolean verboseLogging) {

  /** Configuration key for {@link #messageSeparator()}. */
  public static final String KEY_MESSAGE_SEPARATOR = "messageSeparator";
  /** Configuration key for {@link #pollInterval()}, in milliseconds. */
  public static final String KEY_POLL_INTERVAL_MILLIS = "pollIntervalMillis";
  /** Configuration key for {@link #diffEnabled()}. */
  public static final String KEY_DIFF_ENABLED = "diffEnabled";
  /** Configuration key for {@link #maxValueLength()}. */
  public static final String KEY_MAX_VALUE_LENGTH = "maxValueLength";
  /** Configuration key for {@link #verboseLogging()}. */
  public static final String KEY_VERBOSE_LOGGING = "verboseLogging";

  private static final String DEFAULT_SEPARATOR = " - ";
  private static final long DEFAULT_POLL_MILLIS = 100L;
  private static final long MIN_POLL_MILLIS = 1L;
  private static final long MAX_POLL_MILLIS = 60_000L;
  private static final int DEFAULT_MAX_VALUE_LENGTH = 512;
  private static final int MIN_VALUE_LENGTH = 16;
  private static final int MAX_VALUE_LENGTH = 65_536;

  /**
   * Validates the components.
   *
   * @throws NullPointerException if a reference component is {@code null}
   * @throws IllegalArgumentException if a component is out of range
   */
  public AssayConfig {
    Strings.requireNonEmpty(KEY_MESSAGE_SEPARATOR, messageSeparator);
    Objects.requireNonNull(pollInterval, "pollInterval");
    Numbers.requireRange(KEY_POLL_INTERVAL_MILLIS, pollInterval.toMillis(), MIN_POLL_MILLIS, MAX_POLL_MILLIS);
    Numbers.requireRange(KEY_MAX_VALUE_LENGTH, maxValueLength, MIN_VALUE_LENGTH, MAX_VALUE_LENGTH);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return separator {@code " - "}, 100 ms polling, diffs on, 512 character values, quiet logging
   */
  public static AssayConfig defaults() {
    return new AssayConfig(
        DEFAULT_SEPARATOR, Duration.ofMillis(DEFAULT_POLL_MILLIS), true, DEFAULT_MAX_VALUE_LENGTH, false);
  }

  /**
   * Returns the defaults as a flat key/value map, the lowest precedence layer of {@link ConfigMerger}.
   */
  public static Map<String, String> defaultsAsMap() {
    AssayConfig defaults = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(KEY_MESSAGE_SEPARATOR, defaults.messageSeparator());
    map.put(KEY_POLL_INTERVAL_MILLIS, Long.toString(defaults.pollInterval().toMillis()));
    map.put(KEY_DIFF_ENABLED, Boolean.toString(defaults.diffEnabled()));
    map.put(KEY_MAX_VALUE_LENGTH, Integer.toString(defaults.maxValueLength()));
    map.put(KEY_VERBOSE_LOGGING, Boolean.toString(defaults.verboseLogging()));
    return Map.copyOf(map);
  }

  /**
   * Builds a configuration from flat key/value pairs. Missing keys fall back to {@link #defaults()}; unknown
   * keys are ignored.
   *
   * @param values flat configuration map; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static AssayConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : values;
    AssayConfig defaults = defaults();

    String separator = kv.get(KEY_MESSAGE_SEPARATOR);
    if (separator == null) {
      separator = defaults.messageSeparator();
    }
    String pollRaw = kv.get(KEY_POLL_INTERVAL_MILLIS);
    Duration poll = pollRaw == null || pollRaw.isBlank()
        ? defaults.pollInterval()
        : Duration.ofMillis(Numbers.parseRange(KEY_POLL_INTERVAL_MILLIS, pollRaw, MIN_POLL_MILLIS, MAX_POLL_MILLIS));
    String lengthRaw = kv.get(KEY_MAX_VALUE_LENGTH);
    int maxLength = lengthRaw == null || lengthRaw.isBlank()
        ? defaults.maxValueLength()
        : (int) Numbers.parseRange(KEY_MAX_VALUE_LENGTH, lengthRaw, MIN_VALUE_LENGTH, MAX_VALUE_LENGTH);

    return new AssayConfig(
        separator,
        poll,
        Strings.parseBoolean(KEY_DIFF_ENABLED, kv.get(KEY_DIFF_ENABLED), defaults.diffEnabled()),
        maxLength,
        Strings.parseBoolean(KEY_VERBOSE_LOGGING, kv.get(KEY_VERBOSE_LOGGING), defaults.verboseLogging()));
  }
}
