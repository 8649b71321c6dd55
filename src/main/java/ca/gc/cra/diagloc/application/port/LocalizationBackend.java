package ca.gc.cra.diagloc.application.port;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import java.io.IOException;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * <strong>What:</strong> Port implemented by each catalog format (binary table, YAML, {@code .strings}).
 * <p><strong>Why:</strong> Lets the message store stay format-agnostic while each adapter owns its own
 * on-disk layout and parsing rules.</p>
 * <p><strong>Role:</strong> Input port on the storage side; adapters live under
 * {@code infrastructure.persistence}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the catalog exactly once when {@link #initialize()} is invoked.</li>
 *   <li>Serve lookups and ordered enumeration from the loaded in-memory form.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #initialize()} is not thread-safe; lookups after a successful
 * load are safe for concurrent readers because adapters never mutate loaded state.</p>
 * <p><strong>Performance:</strong> Constructors perform no I/O; all loading is deferred to
 * {@link #initialize()}.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.diagloc.application.localization.MessageStore
 */
public interface LocalizationBackend {

  /**
   * Loads the catalog. Called at most once by the owning store.
   *
   * @throws IOException when the catalog is missing, unreadable or structurally invalid; the store
   *     recovers by falling back to default messages
   */
  void initialize() throws IOException;

  /**
   * Returns the localized text for {@code id}.
   *
   * @param id identifier to resolve
   * @return non-empty text, or empty when the identifier is not localized
   * @throws IllegalStateException if called before a successful {@link #initialize()}
   */
  Optional<String> message(DiagnosticId id);

  /**
   * Visits every localized entry in ascending identifier order, skipping empty entries.
   *
   * @param callback receives {@code (id, text)}
   * @throws IllegalStateException if called before a successful {@link #initialize()}
   */
  void forEachAvailable(BiConsumer<DiagnosticId, String> callback);

  /** @return format served by this backend */
  LocalizationFormat format();
}
