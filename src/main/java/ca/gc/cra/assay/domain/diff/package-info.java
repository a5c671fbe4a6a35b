/**
 * Structural diffs appended to equality failures; backed by Jackson.
 */
package ca.gc.cra.assay.domain.diff;
