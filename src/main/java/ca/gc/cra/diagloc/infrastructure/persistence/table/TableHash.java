package ca.gc.cra.diagloc.infrastructure.persistence.table;

/**
 * Hash function shared by the table writer and reader. Must never change: it is part of the file format.
 */
final class TableHash {
  private TableHash() {}

  /**
   * Mixes a 32-bit key (MurmurHash3 finalizer).
   *
   * @param key raw diagnostic identifier value
   * @return well-distributed 32-bit hash
   */
  static int hash(int key) {
    int h = key;
    h ^= h >>> 16;
    h *= 0x85ebca6b;
    h ^= h >>> 13;
    h *= 0xc2b2ae35;
    h ^= h >>> 16;
    return h;
  }
}
