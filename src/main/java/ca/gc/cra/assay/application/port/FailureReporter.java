package ca.gc.cra.assay.application.port;

import ca.gc.cra.assay.application.AssertionContext;

/**
 * <strong>What:</strong> Strategy invoked whenever a check fails.
 * <p><strong>Why:</strong> Production contexts always use
 * {@link ca.gc.cra.assay.application.DefaultFailureReporter}; the library's own tests substitute a
 * recording strategy per context instead of patching shared state.</p>
 * <p><strong>Role:</strong> Port consumed by {@link AssertionContext}.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the asserting thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FailureReporter {
  /**
   * Reports a failed check.
   *
   * @param context context on which the check ran; carries strictness, message and handle
   * @param format {@link java.util.Formatter} pattern describing the failure
   * @param args arguments for {@code format}
   */
  void report(AssertionContext context, String format, Object... args);
}
