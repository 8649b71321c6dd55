/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration and CLI layers.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagloc.validation;
