package ca.gc.cra.assay.api;

import ca.gc.cra.assay.application.port.TestHandle;
import java.util.Arrays;

/**
 * Static, one-call-per-check facade with an argument order familiar from other assertion libraries
 * ({@code expected} before {@code actual}). Every call creates a strict {@link Asserter} for the given handle.
 *
 * <p>The optional trailing {@code msgAndArgs} are a format followed by its arguments and are attached to the
 * failure message.
 *
 * @since 0.1.0
 */
public final class Require {
  private Require() {
    // Utility
  }

  /** Requires {@code container} to contain {@code item}; see {@link Asserter#contains(Object, Object)}. */
  public static boolean contains(TestHandle handle, Object container, Object item, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).contains(container, item);
  }

  /** Requires {@code actual} to equal {@code expected}; see {@link Asserter#equal(Object, Object)}. */
  public static boolean equal(TestHandle handle, Object expected, Object actual, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).equal(actual, expected);
  }

  /** Requires an error whose message is {@code message}. */
  public static boolean equalError(TestHandle handle, Throwable error, String message, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).errMsg(error, message);
  }

  /**
   * Requires {@code actual} to equal {@code expected} and to have the same runtime type.
   *
   * @param handle handle of the running test
   * @param expected expected value
   * @param actual observed value
   * @param format failure message format
   * @param args failure message arguments
   * @return {@code true} when both checks passed
   */
  public static boolean equalValues(
      TestHandle handle, Object expected, Object actual, String format, Object... args) {
    Asserter asserter = Assay.of(handle).addMsg(format, args);
    boolean equal = asserter.equal(actual, expected);
    return asserter.equalType(expected, actual) && equal;
  }

  /** Requires an error to be present. */
  public static boolean error(TestHandle handle, Throwable error, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).err(error);
  }

  /** Requires {@code value} to be {@code false}. */
  public static boolean isFalse(TestHandle handle, boolean value, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).isFalse(value);
  }

  /** Requires the runtime type of {@code value} to be exactly {@code expectedType}. */
  public static boolean isType(TestHandle handle, Class<?> expectedType, Object value, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).isType(expectedType, value);
  }

  /** Requires {@code value} to hold {@code length} elements; see {@link Asserter#len(Object, int)}. */
  public static boolean len(TestHandle handle, Object value, int length, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).len(value, length);
  }

  /** Requires {@code value} to be absent. */
  public static boolean nil(TestHandle handle, Object value, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).nil(value);
  }

  /** Requires no error to be present. */
  public static boolean noError(TestHandle handle, Throwable error, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).notErr(error);
  }

  /** Requires {@code value} to be present. */
  public static boolean notNil(TestHandle handle, Object value, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).notNil(value);
  }

  /** Requires {@code callback} to throw. */
  public static boolean panics(TestHandle handle, ThrowingRunnable callback, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).shouldPanic(callback);
  }

  /** Requires {@code value} to be {@code true}. */
  public static boolean isTrue(TestHandle handle, boolean value, Object... msgAndArgs) {
    return asserter(handle, msgAndArgs).isTrue(value);
  }

  private static Asserter asserter(TestHandle handle, Object[] msgAndArgs) {
    Asserter asserter = Assay.of(handle);
    if (msgAndArgs == null || msgAndArgs.length == 0) {
      return asserter;
    }
    if (!(msgAndArgs[0] instanceof String format)) {
      throw new IllegalArgumentException("first message argument must be a format string, got "
          + (msgAndArgs[0] == null ? "null" : msgAndArgs[0].getClass().getTypeName()));
    }
    return asserter.addMsg(format, Arrays.copyOfRange(msgAndArgs, 1, msgAndArgs.length));
  }
}
