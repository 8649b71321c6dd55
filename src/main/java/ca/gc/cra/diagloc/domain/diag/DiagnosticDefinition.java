package ca.gc.cra.diagloc.domain.diag;

import java.util.Objects;

/**
 * One entry of the master diagnostic catalog: the symbolic name and its default (English) text.
 *
 * @param name symbolic identifier name, e.g. {@code error_unknown_type}
 * @param defaultText unlocalized message returned when no translation exists
 * @since 0.1.0
 */
public record DiagnosticDefinition(String name, String defaultText) {

  /**
   * Validates the definition.
   *
   * @throws NullPointerException if either component is {@code null}
   * @throws IllegalArgumentException if {@code name} is blank or contains a double quote
   */
  public DiagnosticDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(defaultText, "defaultText");
    if (name.isBlank()) {
      throw new IllegalArgumentException("diagnostic name must not be blank");
    }
    // Names are written unquoted-inside-quotes in .strings files.
    if (name.indexOf('"') >= 0) {
      throw new IllegalArgumentException("diagnostic name must not contain '\"': " + name);
    }
  }
}
