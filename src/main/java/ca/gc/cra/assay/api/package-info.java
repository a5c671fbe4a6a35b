/**
 * <strong>Purpose:</strong> Public assertion API: the {@link ca.gc.cra.assay.api.Asserter} contract, the
 * {@link ca.gc.cra.assay.api.Assay} factory and the {@link ca.gc.cra.assay.api.Require} facade.
 * <p><strong>Concurrency:</strong> Asserters are immutable; checks run synchronously on the caller's thread.
 * <p><strong>Failure policy:</strong> strict asserters abort the test on the first failure; lax asserters
 * record failures and continue.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.api;
