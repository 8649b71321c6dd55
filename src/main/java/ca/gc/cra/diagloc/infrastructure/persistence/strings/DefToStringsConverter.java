package ca.gc.cra.diagloc.infrastructure.persistence.strings;

import ca.gc.cra.diagloc.domain.diag.DiagnosticDefinition;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Writes the master catalog as {@code "id" = "msg";} lines terminated by CR-LF.
 *
 * <p>Only {@code "} is escaped. Backslashes are written as-is, matching the parser, which treats
 * {@code \"} as a quote and leaves every other backslash alone.</p>
 *
 * @since 0.1.0
 */
public final class DefToStringsConverter {
  private final List<DiagnosticDefinition> definitions;

  /**
   * @param definitions master catalog in declaration order
   */
  public DefToStringsConverter(List<DiagnosticDefinition> definitions) {
    this.definitions = List.copyOf(Objects.requireNonNull(definitions, "definitions"));
  }

  /**
   * Emits one record per definition.
   *
   * @param out destination; not closed
   * @throws IOException when writing fails
   */
  public void convert(Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    for (DiagnosticDefinition definition : definitions) {
      out.write('"');
      out.write(definition.name());
      out.write("\" = \"");
      out.write(escape(definition.defaultText()));
      out.write("\";\r\n");
    }
    out.flush();
  }

  static String escape(String message) {
    StringBuilder sb = new StringBuilder(message.length() + 8);
    for (int i = 0; i < message.length(); i++) {
      char c = message.charAt(i);
      if (c == '"') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
