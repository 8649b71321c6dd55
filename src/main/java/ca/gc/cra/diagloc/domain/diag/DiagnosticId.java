package ca.gc.cra.diagloc.domain.diag;

/**
 * Stable numeric identifier naming one localizable diagnostic message slot.
 *
 * <p>The value is the declaration index of the diagnostic in the master catalog and is shared by
 * every catalog format, so a given value always refers to the same message.</p>
 *
 * @param value zero-based declaration index; never negative
 * @since 0.1.0
 */
public record DiagnosticId(int value) implements Comparable<DiagnosticId> {

  /**
   * Validates the identifier value.
   *
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public DiagnosticId {
    if (value < 0) {
      throw new IllegalArgumentException("diagnostic id must be >= 0 (was " + value + ")");
    }
  }

  /**
   * Returns the identifier for the given declaration index.
   *
   * @param value zero-based declaration index
   * @return identifier wrapping {@code value}
   */
  public static DiagnosticId of(int value) {
    return new DiagnosticId(value);
  }

  @Override
  public int compareTo(DiagnosticId other) {
    return Integer.compare(value, other.value);
  }
}
