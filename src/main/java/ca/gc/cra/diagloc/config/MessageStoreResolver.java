package ca.gc.cra.diagloc.config;

import ca.gc.cra.diagloc.application.localization.MessageStore;
import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.StringsLocalizationBackend;
import ca.gc.cra.diagloc.infrastructure.persistence.table.SerializedLocalizationBackend;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.YamlLocalizationBackend;
import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Chooses the catalog file for a locale and wires the matching backend into a
 * {@link MessageStore}.
 * <p><strong>Why:</strong> Keeps file selection policy out of the store and the format adapters.</p>
 * <p><strong>Role:</strong> Composition root for message stores.</p>
 * <p><strong>Policy:</strong> {@code <dir>/<locale>.db} first, then {@code .yaml}, then {@code .strings}.
 * A {@code .db} file that exists but cannot be mapped ends resolution with no store; the text formats are
 * not consulted in that case. When nothing is found callers use the master catalog's default text
 * directly.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class MessageStoreResolver {
  private static final Logger log = LoggerFactory.getLogger(MessageStoreResolver.class);

  private MessageStoreResolver() {}

  /**
   * Resolves a store for {@code locale} with debug name suffixes disabled.
   *
   * @param locale locale tag, e.g. {@code fr}
   * @param basePath directory containing catalogs
   * @param identifiers identifier space shared by all formats
   * @return store bound to the highest-priority catalog present, or empty
   */
  public static Optional<MessageStore> resolve(
      String locale, Path basePath, DiagnosticIdentifierSpace identifiers) {
    return resolve(locale, basePath, identifiers, false);
  }

  /**
   * Resolves a store for {@code locale}.
   *
   * @param locale locale tag, e.g. {@code fr}
   * @param basePath directory containing catalogs
   * @param identifiers identifier space shared by all formats
   * @param printDiagnosticNames whether the store suffixes returned text with diagnostic names
   * @return store bound to the highest-priority catalog present, or empty
   * @throws IllegalArgumentException if {@code locale} is blank or contains path separators
   */
  public static Optional<MessageStore> resolve(
      String locale,
      Path basePath,
      DiagnosticIdentifierSpace identifiers,
      boolean printDiagnosticNames) {
    String tag = LocalizationConfig.requireLocaleTag(locale);
    Objects.requireNonNull(basePath, "basePath");
    Objects.requireNonNull(identifiers, "identifiers");

    Path serialized = LocalizationFormat.SERIALIZED.fileFor(basePath, tag);
    if (Files.exists(serialized)) {
      try {
        MappedByteBuffer buffer = map(serialized);
        log.debug("Using serialized catalog {}", serialized);
        return Optional.of(new MessageStore(
            new SerializedLocalizationBackend(buffer, identifiers), identifiers, printDiagnosticNames));
      } catch (IOException ex) {
        log.warn("Unable to map serialized catalog {}: {}", serialized, ex.getMessage());
        return Optional.empty();
      }
    }

    Path yaml = LocalizationFormat.YAML.fileFor(basePath, tag);
    if (Files.exists(yaml)) {
      log.debug("Using YAML catalog {}", yaml);
      return Optional.of(new MessageStore(
          new YamlLocalizationBackend(yaml, identifiers), identifiers, printDiagnosticNames));
    }

    Path strings = LocalizationFormat.STRINGS.fileFor(basePath, tag);
    if (Files.exists(strings)) {
      log.debug("Using .strings catalog {}", strings);
      return Optional.of(new MessageStore(
          new StringsLocalizationBackend(strings, identifiers), identifiers, printDiagnosticNames));
    }

    log.debug("No catalog for locale {} under {}", tag, basePath);
    return Optional.empty();
  }

  private static MappedByteBuffer map(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("not a regular file: " + path);
    }
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      return channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size());
    }
  }
}
