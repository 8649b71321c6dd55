package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import ca.gc.cra.diagloc.domain.diag.DiagnosticDefinition;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Writes the master catalog as a YAML translation template, one record per diagnostic in declaration order.
 *
 * <p>Messages are double-quoted with {@code "} and {@code \} escaped. The {@code id} line ends with LF
 * and the {@code msg} line with CR-LF; existing template files use exactly this layout.</p>
 *
 * @since 0.1.0
 */
public final class DefToYamlConverter {
  private final List<DiagnosticDefinition> definitions;

  /**
   * @param definitions master catalog in declaration order
   */
  public DefToYamlConverter(List<DiagnosticDefinition> definitions) {
    this.definitions = List.copyOf(Objects.requireNonNull(definitions, "definitions"));
  }

  /**
   * Emits the template.
   *
   * @param out destination; not closed
   * @throws IOException when writing fails
   */
  public void convert(Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    for (DiagnosticDefinition definition : definitions) {
      out.write("- id: ");
      out.write(definition.name());
      out.write('\n');
      out.write("  msg: \"");
      out.write(escape(definition.defaultText()));
      out.write("\"\r\n");
    }
    out.flush();
  }

  static String escape(String message) {
    StringBuilder sb = new StringBuilder(message.length() + 8);
    for (int i = 0; i < message.length(); i++) {
      char c = message.charAt(i);
      if (c == '"' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
