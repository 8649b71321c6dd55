package ca.gc.cra.diagloc.infrastructure.persistence.strings;

/**
 * Raised when a {@code .strings} catalog violates the {@code "id" = "msg";} grammar.
 *
 * <p>Unlike a missing file, this aborts the load: {@code MessageStore} records the failure and rethrows.</p>
 *
 * @since 0.1.0
 */
public final class MalformedStringsException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int offset;

  /**
   * @param message description of the grammar violation
   * @param offset character offset in the input where parsing stopped
   */
  public MalformedStringsException(String message, int offset) {
    super(message + " at offset " + offset);
    this.offset = offset;
  }

  /** @return character offset where the violation was detected */
  public int offset() {
    return offset;
  }
}
