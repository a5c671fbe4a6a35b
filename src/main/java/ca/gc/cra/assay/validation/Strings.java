package ca.gc.cra.assay.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings read from configuration.
 * <p><strong>Why:</strong> A message separator or flag with stray control characters silently corrupts every
 * failure report produced afterwards.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}; tab and line feed are
 * accepted because they are meaningful inside failure messages.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-empty and free of control characters other than tab and line
   * feed. Whitespace is preserved.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return {@code value} unchanged
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is empty or contains other control characters
   */
  public static String requireNonEmpty(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (raw.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be empty"));
    }
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (Character.isISOControl(c) && c != '\t' && c != '\n') {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return raw;
  }

  /**
   * Parses a strict boolean flag. Only {@code true} and {@code false} (any case) are accepted.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param defaultValue value returned when {@code value} is {@code null} or blank
   * @return parsed flag
   * @throws IllegalArgumentException if the value is neither {@code true} nor {@code false}
   */
  public static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + value.trim() + ")"));
    };
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
