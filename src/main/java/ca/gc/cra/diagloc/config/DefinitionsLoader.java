package ca.gc.cra.diagloc.config;

import ca.gc.cra.diagloc.domain.diag.DiagnosticDefinition;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.PlainScalarYaml;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the master diagnostic catalog that fixes the identifier space for the tools.
 *
 * <pre>
 * - id: error_unknown_type
 *   text: "cannot find type %0 in scope"
 * - id: warning_unused_value
 *   text: "value %0 was never used"
 * </pre>
 *
 * <p>Declaration order assigns identifiers: the first record is identifier 0.</p>
 *
 * @since 0.1.0
 */
public final class DefinitionsLoader {

  private DefinitionsLoader() {}

  /**
   * Reads the master catalog at {@code path}.
   *
   * @param path YAML definitions file
   * @return identifier space in declaration order
   * @throws NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document structure is invalid or names repeat
   */
  public static DiagnosticIdentifierSpace load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "diagnostic definitions not found");
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object root = PlainScalarYaml.newLoader().load(reader);
      if (root == null) {
        return DiagnosticIdentifierSpace.of(List.of());
      }
      if (!(root instanceof List<?> records)) {
        throw new IllegalArgumentException("definitions root must be a sequence in " + path);
      }
      List<DiagnosticDefinition> definitions = new ArrayList<>(records.size());
      for (Object node : records) {
        if (!(node instanceof Map<?, ?> record)) {
          throw new IllegalArgumentException("definition " + definitions.size() + " must be a mapping");
        }
        Object id = record.get("id");
        if (id == null) {
          throw new IllegalArgumentException("definition " + definitions.size() + " is missing 'id'");
        }
        Object text = record.get("text");
        definitions.add(new DiagnosticDefinition(id.toString(), text == null ? "" : text.toString()));
      }
      return DiagnosticIdentifierSpace.of(definitions);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse diagnostic definitions at " + path, ex);
    }
  }
}
