package ca.gc.cra.assay.logging;

/**
 * <strong>What:</strong> Helpers that keep rendered values in failure messages and logs readable.
 * <p><strong>Why:</strong> Assertion operands can be arbitrarily large collections; dumping them whole buries
 * the useful part of a failure report.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by value rendering and diagnostics.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates one string of at most {@code maxChars} characters.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "null";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested number of characters, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "null"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input exceeds {@code maxChars}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   *
   * <p><strong>Observability:</strong> Adds {@code "... (truncated, X of Y)"} suffix to flag shortened values.</p>
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    // keep surrogate pairs intact
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + ")";
  }
}
