package ca.gc.cra.assay.api;

/**
 * Zero-argument callback that may throw anything; used by {@link Asserter#shouldPanic(ThrowingRunnable)}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ThrowingRunnable {
  /**
   * Runs the callback.
   *
   * @throws Throwable any failure raised by the callback
   */
  void run() throws Throwable;
}
