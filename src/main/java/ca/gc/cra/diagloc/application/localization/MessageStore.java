package ca.gc.cra.diagloc.application.localization;

import ca.gc.cra.diagloc.application.port.LocalizationBackend;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Format-agnostic facade answering "what is the localized text of diagnostic X".
 * <p><strong>Why:</strong> Callers need a lookup that never breaks message retrieval: a missing or partial
 * catalog degrades to the default (base-language) text.</p>
 * <p><strong>Role:</strong> Application service wrapping exactly one {@link LocalizationBackend}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Initialize the backend lazily, once, on the first query.</li>
 *   <li>Fall back to caller defaults when loading failed or an entry is missing.</li>
 *   <li>Optionally suffix returned text with {@code " [<diagnostic-name>]"} for debugging.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not safe for concurrent first use; the
 * {@code NOT_INITIALIZED -> INITIALIZED|FAILED_INITIALIZATION} transition is not atomic. Callers that fan
 * out must synchronize the first call or invoke {@link #initializeIfNeeded()} up front. Reads after
 * initialization are safe.</p>
 * <p><strong>Observability:</strong> Logs the state transition (DEBUG on success, WARN on failure).</p>
 *
 * <p>Error policy: an {@link IOException} from the backend (missing file, unreadable file, invalid YAML
 * structure, inconsistent binary header) is recovered locally. A runtime failure, notably a malformed
 * {@code .strings} file, is treated as a data-integrity error and rethrown to the caller that triggered
 * initialization; the store still records {@link ProducerState#FAILED_INITIALIZATION} so later calls fall
 * back quietly instead of re-parsing.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.diagloc.config.MessageStoreResolver
 */
public final class MessageStore {
  private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

  private final LocalizationBackend backend;
  private final DiagnosticIdentifierSpace identifiers;
  private final boolean printDiagnosticNames;
  private ProducerState state = ProducerState.NOT_INITIALIZED;

  /**
   * Creates a store bound to one backend. Performs no I/O.
   *
   * @param backend catalog adapter
   * @param identifiers identifier space used to name diagnostics in debug suffixes
   * @param printDiagnosticNames when {@code true}, localized text is suffixed with the diagnostic name
   */
  public MessageStore(
      LocalizationBackend backend,
      DiagnosticIdentifierSpace identifiers,
      boolean printDiagnosticNames) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
    this.printDiagnosticNames = printDiagnosticNames;
  }

  /**
   * Returns the localized text for {@code id}, or {@code defaultMessage} when none is available.
   *
   * @param id diagnostic to resolve
   * @param defaultMessage text returned unchanged when the catalog failed to load or lacks the entry
   * @return localized (optionally name-suffixed) text or {@code defaultMessage}
   * @throws RuntimeException propagated from the first initialization when the catalog is corrupt
   * @throws IllegalStateException when a binary catalog passed its header check but an item read during
   *     this lookup overruns the payload; the store does not guard against corrupt item data
   */
  public String messageOrDefault(DiagnosticId id, String defaultMessage) {
    Objects.requireNonNull(id, "id");
    initializeIfNeeded();
    if (state == ProducerState.FAILED_INITIALIZATION) {
      return defaultMessage;
    }
    Optional<String> localized = backend.message(id);
    if (localized.isEmpty() || localized.get().isEmpty()) {
      return defaultMessage;
    }
    if (printDiagnosticNames) {
      return localized.get() + " [" + identifiers.nameOf(id) + "]";
    }
    return localized.get();
  }

  /**
   * Returns the localized text for {@code id}, falling back to the identifier space's default text.
   *
   * @param id diagnostic inside the identifier space
   * @return localized or default text
   * @throws IllegalStateException on corrupt binary item data, as for {@link #messageOrDefault}
   */
  public String message(DiagnosticId id) {
    return messageOrDefault(id, identifiers.defaultText(id));
  }

  /**
   * Invokes {@code callback} once per localized entry in ascending identifier order. Does nothing when
   * loading failed.
   *
   * @param callback receives {@code (id, text)}; text is never empty
   * @throws IllegalStateException on corrupt binary item data, as for {@link #messageOrDefault}
   */
  public void forEachAvailable(BiConsumer<DiagnosticId, String> callback) {
    Objects.requireNonNull(callback, "callback");
    initializeIfNeeded();
    if (state == ProducerState.FAILED_INITIALIZATION) {
      return;
    }
    backend.forEachAvailable(callback);
  }

  /**
   * Performs the one-shot load if it has not been attempted yet. Subsequent calls are no-ops.
   *
   * @return resulting state
   */
  public ProducerState initializeIfNeeded() {
    if (state != ProducerState.NOT_INITIALIZED) {
      return state;
    }
    try {
      backend.initialize();
      state = ProducerState.INITIALIZED;
      log.debug("Loaded {} localization catalog", backend.format());
    } catch (IOException ex) {
      state = ProducerState.FAILED_INITIALIZATION;
      log.warn("Unable to load {} localization catalog; using default messages: {}",
          backend.format(), ex.getMessage());
    } catch (RuntimeException ex) {
      state = ProducerState.FAILED_INITIALIZATION;
      throw ex;
    }
    return state;
  }

  /** @return current initialization state */
  public ProducerState state() {
    return state;
  }

  /** @return backend serving this store, for format-specific inspection by tooling */
  public LocalizationBackend backend() {
    return backend;
  }
}
