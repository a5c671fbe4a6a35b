package ca.gc.cra.assay.application.port;

import ca.gc.cra.assay.domain.FailureEvent;

/**
 * <strong>What:</strong> Port onto the host test runner's failure reporting.
 * <p><strong>Why:</strong> Keeps the assertion engine independent of any particular runner.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as
 * {@link ca.gc.cra.assay.infrastructure.junit.JUnitTestHandle}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record a failure and abort the current test ({@link #fatal(FailureEvent)}).</li>
 *   <li>Record a failure and let the test continue ({@link #error(FailureEvent)}).</li>
 *   <li>Optionally track helper frames so reported locations point at the caller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Ordering of reports from concurrent callers is the implementation's
 * concern; the engine performs no coordination.</p>
 *
 * @since 0.1.0
 */
public interface TestHandle {
  /**
   * Marks the calling class as an assertion helper. Handles that render source locations skip frames of
   * helper classes. The default implementation does nothing.
   */
  default void helper() {}

  /**
   * Records {@code event} and aborts the current test. Implementations must not return normally.
   *
   * @param event failure to report; never {@code null}
   */
  void fatal(FailureEvent event);

  /**
   * Records {@code event}; the test keeps running.
   *
   * @param event failure to report; never {@code null}
   */
  void error(FailureEvent event);
}
