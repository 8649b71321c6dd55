package ca.gc.cra.diagloc.infrastructure.persistence.table;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.Optional;

/**
 * Random-access view over a table produced by {@link SerializedTableWriter}.
 *
 * <p>The reader borrows the supplied buffer (heap or memory mapped) and never copies message bytes:
 * {@link #find(DiagnosticId)} returns read-only slices of it. The header, the bucket directory and every
 * bucket offset are bounds-checked once at construction; per-item lengths are checked on lookup.</p>
 *
 * <p>Immutable after construction; safe for concurrent lookups.</p>
 *
 * @since 0.1.0
 */
public final class SerializedTableReader {
  private static final int DIRECTORY_HEADER_BYTES = 2 * Integer.BYTES;

  private final ByteBuffer data;
  private final int directoryOffset;
  private final int bucketCount;
  private final int entryCount;

  /**
   * Opens a table whose first byte is at the buffer's current position.
   *
   * @param buffer table bytes; the view is taken from {@code position()} to {@code limit()}
   * @throws MalformedTableException when the header or directory points outside the buffer
   */
  public SerializedTableReader(ByteBuffer buffer) throws MalformedTableException {
    Objects.requireNonNull(buffer, "buffer");
    this.data = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
    int limit = data.limit();
    if (limit < SerializedTableWriter.HEADER_BYTES) {
      throw new MalformedTableException("table shorter than its " + SerializedTableWriter.HEADER_BYTES
          + "-byte header (" + limit + " bytes)");
    }
    long offset = Integer.toUnsignedLong(data.getInt(0));
    if (offset < SerializedTableWriter.HEADER_BYTES || offset + DIRECTORY_HEADER_BYTES > limit) {
      throw new MalformedTableException("directory offset " + offset + " outside table of " + limit + " bytes");
    }
    this.directoryOffset = (int) offset;
    this.bucketCount = data.getInt(directoryOffset);
    this.entryCount = data.getInt(directoryOffset + Integer.BYTES);
    if (bucketCount <= 0 || Integer.bitCount(bucketCount) != 1) {
      throw new MalformedTableException("bucket count must be a positive power of two (was " + bucketCount + ")");
    }
    if (entryCount < 0) {
      throw new MalformedTableException("negative entry count " + entryCount);
    }
    long directoryEnd = offset + DIRECTORY_HEADER_BYTES + (long) bucketCount * Integer.BYTES;
    if (directoryEnd > limit) {
      throw new MalformedTableException("bucket directory ends at " + directoryEnd + " beyond " + limit);
    }
    for (int b = 0; b < bucketCount; b++) {
      long bucket = Integer.toUnsignedLong(bucketOffset(b));
      if (bucket == 0) {
        continue;
      }
      if (bucket < SerializedTableWriter.HEADER_BYTES || bucket + Short.BYTES > directoryOffset) {
        throw new MalformedTableException("bucket " + b + " offset " + bucket + " outside payload region");
      }
    }
  }

  /**
   * Looks up the message bytes stored for {@code id}.
   *
   * @param id diagnostic identifier
   * @return read-only UTF-8 slice of the underlying buffer; empty when absent or stored with zero length
   * @throws IllegalStateException if the bucket's items run past the payload region
   */
  public Optional<ByteBuffer> find(DiagnosticId id) {
    Objects.requireNonNull(id, "id");
    int key = id.value();
    int hash = TableHash.hash(key);
    int position = bucketOffset(hash & (bucketCount - 1));
    if (position == 0) {
      return Optional.empty();
    }
    int items = Short.toUnsignedInt(data.getShort(position));
    position += Short.BYTES;
    for (int i = 0; i < items; i++) {
      requirePayload(position, SerializedTableWriter.ITEM_HEADER_BYTES);
      int itemHash = data.getInt(position);
      int length = data.getInt(position + Integer.BYTES);
      int itemKey = data.getInt(position + 2 * Integer.BYTES);
      int start = position + SerializedTableWriter.ITEM_HEADER_BYTES;
      if (length < 0) {
        throw new IllegalStateException("negative data length at offset " + position);
      }
      requirePayload(start, length);
      if (itemHash == hash && itemKey == key) {
        if (length == 0) {
          return Optional.empty();
        }
        return Optional.of(data.slice(start, length).asReadOnlyBuffer());
      }
      position = start + length;
    }
    return Optional.empty();
  }

  /** @return number of entries recorded in the directory header */
  public int entryCount() {
    return entryCount;
  }

  /** @return number of hash buckets */
  public int bucketCount() {
    return bucketCount;
  }

  private int bucketOffset(int bucket) {
    return data.getInt(directoryOffset + DIRECTORY_HEADER_BYTES + bucket * Integer.BYTES);
  }

  private void requirePayload(int start, int length) {
    if ((long) start + length > directoryOffset) {
      throw new IllegalStateException(
          "item at offset " + start + " (" + length + " bytes) overruns the payload region");
    }
  }
}
