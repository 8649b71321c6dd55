package ca.gc.cra.diagloc.infrastructure.persistence.table;

import ca.gc.cra.diagloc.application.port.LocalizationBackend;
import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Backend serving a {@code .db} catalog from an in-memory or memory-mapped buffer.
 *
 * <p>Construction only stores the buffer; {@link #initialize()} validates the header. Messages are decoded
 * from the borrowed buffer on each lookup.</p>
 *
 * @since 0.1.0
 */
public final class SerializedLocalizationBackend implements LocalizationBackend {
  private final ByteBuffer buffer;
  private final DiagnosticIdentifierSpace identifiers;
  private SerializedTableReader table;

  /**
   * @param buffer complete table bytes, positioned at the header
   * @param identifiers identifier space bounding enumeration
   */
  public SerializedLocalizationBackend(ByteBuffer buffer, DiagnosticIdentifierSpace identifiers) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
  }

  @Override
  public void initialize() throws MalformedTableException {
    table = new SerializedTableReader(buffer);
  }

  @Override
  public Optional<String> message(DiagnosticId id) {
    return loaded().find(id).map(bytes -> StandardCharsets.UTF_8.decode(bytes).toString());
  }

  /**
   * Probes every identifier of the space in ascending order; the table itself is unordered.
   */
  @Override
  public void forEachAvailable(BiConsumer<DiagnosticId, String> callback) {
    Objects.requireNonNull(callback, "callback");
    SerializedTableReader reader = loaded();
    for (int i = 0; i < identifiers.size(); i++) {
      DiagnosticId id = DiagnosticId.of(i);
      reader.find(id).ifPresent(bytes -> callback.accept(id, StandardCharsets.UTF_8.decode(bytes).toString()));
    }
  }

  @Override
  public LocalizationFormat format() {
    return LocalizationFormat.SERIALIZED;
  }

  private SerializedTableReader loaded() {
    if (table == null) {
      throw new IllegalStateException("serialized catalog not initialized");
    }
    return table;
  }
}
