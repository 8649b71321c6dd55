package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import java.io.IOException;

/**
 * Raised when a YAML catalog is not a sequence of {@code id}/{@code msg} mappings.
 *
 * @since 0.1.0
 */
public final class LocalizationFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the structural problem
   */
  public LocalizationFormatException(String message) {
    super(message);
  }

  /**
   * @param message description of the structural problem
   * @param cause underlying parser failure
   */
  public LocalizationFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
