/**
 * Rendering of operands and type names for failure messages.
 */
package ca.gc.cra.assay.domain.format;
