package ca.gc.cra.diagloc.infrastructure.persistence.table;

import java.io.IOException;

/**
 * Raised when a serialized table's header or bucket directory points outside the buffer.
 *
 * @since 0.1.0
 */
public final class MalformedTableException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the violated bound
   */
  public MalformedTableException(String message) {
    super(message);
  }
}
