/**
 * <strong>Purpose:</strong> Domain model for localized diagnostics: identifiers, the master identifier
 * space, and per-locale message catalogs.
 * <p><strong>Concurrency:</strong> All types are immutable once built.
 * <p><strong>Observability:</strong> No logging; invalid values raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagloc.domain.diag;
