/**
 * JUnit Jupiter adapters for the test handle port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.assay.infrastructure.junit;
