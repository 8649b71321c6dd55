/**
 * <strong>Purpose:</strong> Ports separating the message store from the catalog file formats.
 * <p><strong>Pipeline role:</strong> Application layer; storage adapters implement
 * {@link ca.gc.cra.diagloc.application.port.LocalizationBackend}.
 * <p><strong>Concurrency:</strong> Load once, then read-only.
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagloc.application.port;
