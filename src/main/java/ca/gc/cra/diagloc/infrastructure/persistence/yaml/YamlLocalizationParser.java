package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.MessageCatalog;
import ca.gc.cra.diagloc.domain.diag.UnknownIdentifierRecord;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parses YAML catalogs of the form:
 *
 * <pre>
 * - id: error_unknown_type
 *   msg: "type %0 is not known"
 * </pre>
 *
 * <p>Records may appear in any order; the identifier, not the position, selects the slot, and a repeated
 * identifier replaces the earlier message. Records whose {@code id} is not in the identifier space are kept
 * as {@link UnknownIdentifierRecord}s in input order and never enter the catalog.</p>
 *
 * <p>Scalars are read as written: {@code msg: Yes} is the message {@code "Yes"}, not a boolean.</p>
 *
 * @since 0.1.0
 */
public final class YamlLocalizationParser {
  private final DiagnosticIdentifierSpace identifiers;

  /**
   * @param identifiers identifier space used to resolve {@code id} values
   */
  public YamlLocalizationParser(DiagnosticIdentifierSpace identifiers) {
    this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
  }

  /**
   * Parses the YAML catalog at {@code path} as UTF-8.
   *
   * @param path catalog file
   * @return parsed catalog and unknown records
   * @throws NoSuchFileException when the file does not exist
   * @throws LocalizationFormatException when the document is not a list of {@code id}/{@code msg} mappings
   * @throws IOException when the file cannot be read
   */
  public Result parse(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses a YAML catalog held in memory.
   *
   * @param document YAML text
   * @return parsed catalog and unknown records
   * @throws LocalizationFormatException when the document is not a list of {@code id}/{@code msg} mappings
   */
  public Result parse(String document) throws LocalizationFormatException {
    Objects.requireNonNull(document, "document");
    return parse(new StringReader(document), "<memory>");
  }

  private Result parse(Reader reader, String source) throws LocalizationFormatException {
    Object root;
    try {
      root = PlainScalarYaml.newLoader().load(reader);
    } catch (YAMLException ex) {
      throw new LocalizationFormatException("Failed to parse YAML catalog " + source, ex);
    }

    MessageCatalog.Builder catalog = MessageCatalog.builder(identifiers.size());
    List<UnknownIdentifierRecord> unknown = new ArrayList<>();
    if (root == null) {
      return new Result(catalog.build(), List.of());
    }
    if (!(root instanceof List<?> records)) {
      throw new LocalizationFormatException(source + ": catalog root must be a sequence of records");
    }

    int index = 0;
    for (Object node : records) {
      if (!(node instanceof Map<?, ?> record)) {
        throw new LocalizationFormatException(source + ": record " + index + " must be a mapping");
      }
      String rawId = requireScalar(record, "id", index, source);
      String message = requireScalar(record, "msg", index, source);
      OptionalInt known = identifiers.indexOf(rawId);
      if (known.isPresent()) {
        catalog.put(DiagnosticId.of(known.getAsInt()), message);
      } else {
        unknown.add(new UnknownIdentifierRecord(rawId, message));
      }
      index++;
    }
    return new Result(catalog.build(), List.copyOf(unknown));
  }

  private static String requireScalar(Map<?, ?> record, String key, int index, String source)
      throws LocalizationFormatException {
    if (!record.containsKey(key)) {
      throw new LocalizationFormatException(source + ": record " + index + " is missing '" + key + "'");
    }
    Object value = record.get(key);
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new LocalizationFormatException(source + ": record " + index + " '" + key + "' must be a scalar");
    }
    return value.toString();
  }

  /**
   * Outcome of parsing one YAML catalog.
   *
   * @param catalog messages for identifiers known to the identifier space
   * @param unknownIdentifiers records whose identifier is not known, in input order
   */
  public record Result(MessageCatalog catalog, List<UnknownIdentifierRecord> unknownIdentifiers) {
    public Result {
      Objects.requireNonNull(catalog, "catalog");
      unknownIdentifiers = List.copyOf(unknownIdentifiers);
    }
  }
}
