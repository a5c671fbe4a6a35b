package ca.gc.cra.assay.application;

/**
 * Failure flag shared by every context derived from the same root or lax scope.
 *
 * <p>Not thread-safe; a scope lives on the asserting thread.
 *
 * @since 0.1.0
 */
final class ScopeTracker {
  private int failures;

  void recordFailure() {
    failures++;
  }

  boolean failed() {
    return failures > 0;
  }

  int failures() {
    return failures;
  }
}
