/**
 * {@code .strings} catalogs: hand-written single-pass parser, store backend, and template converter.
 * <p><strong>Errors:</strong> malformed input aborts parsing with an unchecked exception.</p>
 */
package ca.gc.cra.diagloc.infrastructure.persistence.strings;
