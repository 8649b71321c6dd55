package ca.gc.cra.diagloc.domain.diag;

import java.util.Objects;

/**
 * Catalog record whose identifier is not part of the current identifier space, typically because the
 * diagnostic was renamed or removed upstream. Kept verbatim for reporting; never used for lookup.
 *
 * @param rawId identifier text exactly as found in the source file
 * @param message message text exactly as found in the source file
 * @since 0.1.0
 */
public record UnknownIdentifierRecord(String rawId, String message) {
  public UnknownIdentifierRecord {
    Objects.requireNonNull(rawId, "rawId");
    Objects.requireNonNull(message, "message");
  }
}
