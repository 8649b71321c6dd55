package ca.gc.cra.diagloc.infrastructure.persistence.table;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the binary ({@code .db}) catalog: a chained hash table keyed by diagnostic identifier.
 *
 * <p>File layout, all integers little-endian:</p>
 * <pre>
 * [0..4)      uint32 offset of the bucket directory
 * [4..dir)    buckets; each: uint16 itemCount, then per item
 *             uint32 hash, uint32 dataLength, uint32 key, dataLength bytes of UTF-8
 *             zero padding to a 4-byte boundary
 * [dir..)     uint32 bucketCount (power of two), uint32 entryCount,
 *             bucketCount x uint32 bucket offset (0 = empty bucket)
 * </pre>
 *
 * <p>Insertions may arrive in any order; a repeated identifier replaces the earlier text. Not thread-safe.
 * Callers name the destination with the {@code .db} extension; the writer does not check it.</p>
 *
 * @since 0.1.0
 * @see SerializedTableReader
 */
public final class SerializedTableWriter {
  private static final Logger log = LoggerFactory.getLogger(SerializedTableWriter.class);

  static final int HEADER_BYTES = Integer.BYTES;
  static final int ITEM_HEADER_BYTES = 3 * Integer.BYTES;
  private static final int INITIAL_BUCKETS = 64;

  private final Map<Integer, byte[]> entries = new TreeMap<>();

  /**
   * Records the translation for {@code id}, replacing any earlier one.
   *
   * @param id diagnostic identifier
   * @param translation localized text, stored as UTF-8
   */
  public void insert(DiagnosticId id, String translation) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(translation, "translation");
    entries.put(id.value(), translation.getBytes(StandardCharsets.UTF_8));
  }

  /** @return number of distinct identifiers inserted so far */
  public int size() {
    return entries.size();
  }

  /**
   * Writes the table to {@code path}, truncating any existing file.
   *
   * @param path destination, conventionally ending in {@code .db}
   * @return {@code true} when the table was written; {@code false} when the destination could not be opened
   *     or written (the file contents are then unspecified)
   */
  public boolean emit(Path path) {
    Objects.requireNonNull(path, "path");
    try (FileChannel channel = FileChannel.open(
        path,
        StandardOpenOption.CREATE,
        StandardOpenOption.WRITE,
        StandardOpenOption.TRUNCATE_EXISTING)) {
      writeFully(channel, littleEndianInt(0));
      ByteArrayOutputStream index = new ByteArrayOutputStream();
      int tableOffset = encodeIndex(index);
      writeFully(channel, ByteBuffer.wrap(index.toByteArray()));
      channel.position(0);
      writeFully(channel, littleEndianInt(tableOffset));
      log.debug("Wrote {} translations to {} (directory at offset {})", entries.size(), path, tableOffset);
      return true;
    } catch (IOException ex) {
      log.error("Failed to write serialized localization table {}", path, ex);
      return false;
    }
  }

  /**
   * Serializes buckets and directory into {@code out}, which starts immediately after the header.
   *
   * @return absolute file offset of the bucket directory
   */
  private int encodeIndex(ByteArrayOutputStream out) {
    int bucketCount = INITIAL_BUCKETS;
    while ((long) entries.size() * 4 >= (long) bucketCount * 3) {
      bucketCount <<= 1;
    }

    List<List<Map.Entry<Integer, byte[]>>> buckets = new ArrayList<>(bucketCount);
    for (int i = 0; i < bucketCount; i++) {
      buckets.add(new ArrayList<>());
    }
    for (Map.Entry<Integer, byte[]> entry : entries.entrySet()) {
      int hash = TableHash.hash(entry.getKey());
      buckets.get(hash & (bucketCount - 1)).add(entry);
    }

    int[] bucketOffsets = new int[bucketCount];
    for (int b = 0; b < bucketCount; b++) {
      List<Map.Entry<Integer, byte[]>> items = buckets.get(b);
      if (items.isEmpty()) {
        continue;
      }
      bucketOffsets[b] = HEADER_BYTES + out.size();
      writeShort(out, items.size());
      for (Map.Entry<Integer, byte[]> item : items) {
        byte[] data = item.getValue();
        writeInt(out, TableHash.hash(item.getKey()));
        writeInt(out, data.length);
        writeInt(out, item.getKey());
        out.write(data, 0, data.length);
      }
    }

    while ((HEADER_BYTES + out.size()) % Integer.BYTES != 0) {
      out.write(0);
    }
    int tableOffset = HEADER_BYTES + out.size();
    writeInt(out, bucketCount);
    writeInt(out, entries.size());
    for (int offset : bucketOffsets) {
      writeInt(out, offset);
    }
    return tableOffset;
  }

  private static ByteBuffer littleEndianInt(int value) {
    ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(value).flip();
    return buffer;
  }

  private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
    while (buffer.hasRemaining()) {
      channel.write(buffer);
    }
  }

  private static void writeShort(ByteArrayOutputStream out, int value) {
    if (value > 0xFFFF) {
      throw new IllegalStateException("bucket holds more than 65535 items");
    }
    out.write(value & 0xFF);
    out.write((value >>> 8) & 0xFF);
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    out.write(value & 0xFF);
    out.write((value >>> 8) & 0xFF);
    out.write((value >>> 16) & 0xFF);
    out.write((value >>> 24) & 0xFF);
  }
}
