package ca.gc.cra.diagloc.infrastructure.persistence.strings;

import ca.gc.cra.diagloc.application.port.LocalizationBackend;
import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.MessageCatalog;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Backend serving a {@code .strings} catalog. A missing file fails initialization quietly; a malformed one
 * propagates {@link MalformedStringsException}.
 *
 * @since 0.1.0
 */
public final class StringsLocalizationBackend implements LocalizationBackend {
  private final Path path;
  private final StringsFileParser parser;
  private MessageCatalog catalog;

  /**
   * @param path catalog file; not touched until {@link #initialize()}
   * @param identifiers identifier space used to resolve record identifiers
   */
  public StringsLocalizationBackend(Path path, DiagnosticIdentifierSpace identifiers) {
    this.path = Objects.requireNonNull(path, "path");
    this.parser = new StringsFileParser(identifiers);
  }

  @Override
  public void initialize() throws IOException {
    catalog = parser.parse(path);
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
    return LocalizationFormat.STRINGS;
  }

  private MessageCatalog loaded() {
    if (catalog == null) {
      throw new IllegalStateException(".strings catalog not initialized: " + path);
    }
    return catalog;
  }
}
