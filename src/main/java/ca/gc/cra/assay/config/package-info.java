/**
 * <strong>Purpose:</strong> Configuration records and loaders for library defaults.
 * <p><strong>Precedence:</strong> system properties &gt; {@code assay.yaml} &gt; built-in defaults.
 * <p><strong>Observability:</strong> Overrides are logged at WARN; invalid values raise
 * {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.config;
