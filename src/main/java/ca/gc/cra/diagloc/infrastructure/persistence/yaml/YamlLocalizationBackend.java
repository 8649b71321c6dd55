package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import ca.gc.cra.diagloc.application.port.LocalizationBackend;
import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.MessageCatalog;
import ca.gc.cra.diagloc.domain.diag.UnknownIdentifierRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Backend serving a {@code .yaml} catalog. The file is read and parsed once, on {@link #initialize()}.
 *
 * @since 0.1.0
 */
public final class YamlLocalizationBackend implements LocalizationBackend {
  private final Path path;
  private final YamlLocalizationParser parser;
  private MessageCatalog catalog;
  private List<UnknownIdentifierRecord> unknownIdentifiers = List.of();

  /**
   * @param path catalog file; not touched until {@link #initialize()}
   * @param identifiers identifier space used to resolve record identifiers
   */
  public YamlLocalizationBackend(Path path, DiagnosticIdentifierSpace identifiers) {
    this.path = Objects.requireNonNull(path, "path");
    this.parser = new YamlLocalizationParser(identifiers);
  }

  @Override
  public void initialize() throws IOException {
    YamlLocalizationParser.Result result = parser.parse(path);
    catalog = result.catalog();
    unknownIdentifiers = result.unknownIdentifiers();
  }

  @Override
  public Optional<String> message(DiagnosticId id) {
    return loaded().message(id);
  }

  @Override
  public void forEachAvailable(BiConsumer<DiagnosticId, String> callback) {
    loaded().forEachAvailable(callback);
  }

  @Override
  public LocalizationFormat format() {
    return LocalizationFormat.YAML;
  }

  /**
   * Returns records whose identifier is not part of the identifier space. Empty before initialization.
   *
   * @return unknown records in file order
   */
  public List<UnknownIdentifierRecord> unknownIdentifiers() {
    return unknownIdentifiers;
  }

  /** @return catalog file backing this store */
  public Path path() {
    return path;
  }

  private MessageCatalog loaded() {
    if (catalog == null) {
      throw new IllegalStateException("YAML catalog not initialized: " + path);
    }
    return catalog;
  }
}
