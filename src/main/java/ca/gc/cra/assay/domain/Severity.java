package ca.gc.cra.assay.domain;

/**
 * Failure severity selected by the strictness of the reporting context.
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Report the failure and abort the current test. */
  FATAL,
  /** Report the failure and let the test continue. */
  NON_FATAL
}
