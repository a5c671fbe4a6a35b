/**
 * <strong>Purpose:</strong> Value types shared by the comparison engine and the failure policy.
 * <p><strong>Concurrency:</strong> Records and enums are immutable; hooks run on the asserting thread.
 * <p><strong>Observability:</strong> {@link ca.gc.cra.assay.domain.FailureEvent} logs malformed formats at WARN.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.domain;
