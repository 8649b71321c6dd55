package ca.gc.cra.diagloc.application.localization;

/**
 * One-shot initialization state of a {@link MessageStore}. Moves forward only.
 *
 * @since 0.1.0
 */
public enum ProducerState {
  /** No lookup has been requested yet; the catalog is untouched. */
  NOT_INITIALIZED,
  /** The catalog loaded successfully and serves lookups. */
  INITIALIZED,
  /** Loading failed; every lookup returns the caller-supplied default. */
  FAILED_INITIALIZATION
}
