/**
 * <strong>Purpose:</strong> The message store facade and its one-shot initialization state machine.
 * <p><strong>Concurrency:</strong> Single-threaded first use; read-only afterwards.
 * <p><strong>Observability:</strong> SLF4J logs for catalog load outcomes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagloc.application.localization;
