/**
 * <strong>Purpose:</strong> Ports between the assertion engine and its collaborators: the host test runner,
 * the failure policy and the clock.
 * <p><strong>Concurrency:</strong> Ports are invoked on the asserting thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.application.port;
