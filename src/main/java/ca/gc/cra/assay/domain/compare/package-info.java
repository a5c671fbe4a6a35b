/**
 * <strong>Purpose:</strong> Runtime value classification and the equality engine behind every comparison.
 * <p><strong>Concurrency:</strong> Stateless utilities; each comparison allocates its own traversal state.
 * <p><strong>Performance:</strong> Reflection is used only when {@code equals} rejects a pair.
 * <p><strong>Observability:</strong> Comparison and conversion faults are logged at DEBUG.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.domain.compare;
