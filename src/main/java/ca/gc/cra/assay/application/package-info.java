/**
 * <strong>Purpose:</strong> Assertion contexts and the failure policy that turns failed checks into reports on
 * the host test handle.
 * <p><strong>Concurrency:</strong> Contexts are immutable; lax-scope failure flags belong to the asserting
 * thread.
 * <p><strong>Observability:</strong> Failures reach the test handle; thrown callbacks expected by
 * {@code shouldPanic} are logged at DEBUG.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.application;
