package ca.gc.cra.assay.domain.format;

import ca.gc.cra.assay.logging.Logs;
import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders operands and their runtime type names for failure messages.
 *
 * @since 0.1.0
 */
public final class ValueFormatter {
  /** Type name printed for an absent operand. */
  public static final String NULL_TYPE = "null";

  private final int maxValueLength;

  /**
   * Creates a formatter that truncates rendered values.
   *
   * @param maxValueLength maximum characters per rendered value; must be positive
   */
  public ValueFormatter(int maxValueLength) {
    if (maxValueLength <= 0) {
      throw new IllegalArgumentException("maxValueLength must be positive");
    }
    this.maxValueLength = maxValueLength;
  }

  /**
   * Returns the runtime type name of {@code value}, or {@code "null"} when absent.
   *
   * @param value operand
   * @return type name such as {@code java.lang.Integer} or {@code int[]}
   */
  public static String typeName(Object value) {
    return value == null ? NULL_TYPE : value.getClass().getTypeName();
  }

  /**
   * Returns the comma separated runtime type names of {@code values}.
   *
   * @param values operands; {@code null} renders as {@code "null"}
   * @return joined type names, empty for an empty list
   */
  public static String typeNames(List<?> values) {
    if (values == null) {
      return NULL_TYPE;
    }
    StringJoiner joiner = new StringJoiner(",");
    for (Object value : values) {
      joiner.add(typeName(value));
    }
    return joiner.toString();
  }

  /**
   * Renders {@code value} with array contents expanded, truncated to the configured budget.
   *
   * @param value operand
   * @return printable representation
   */
  public String render(Object value) {
    return Logs.truncate(toText(value), maxValueLength);
  }

  /** Returns the character budget applied by {@link #render(Object)}. */
  public int maxValueLength() {
    return maxValueLength;
  }

  private static String toText(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Object[] objects) {
      return Arrays.deepToString(objects);
    }
    if (value.getClass().isArray()) {
      int length = Array.getLength(value);
      StringJoiner joiner = new StringJoiner(", ", "[", "]");
      for (int i = 0; i < length; i++) {
        joiner.add(String.valueOf(Array.get(value, i)));
      }
      return joiner.toString();
    }
    try {
      return String.valueOf(value);
    } catch (RuntimeException ex) {
      return typeName(value) + "@" + Integer.toHexString(System.identityHashCode(value))
          + " (toString failed: " + ex.getClass().getSimpleName() + ")";
    }
  }
}
