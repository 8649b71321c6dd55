/**
 * Binary {@code .db} catalog: on-disk chained hash table writer, zero-copy reader and store backend.
 * <p><strong>Concurrency:</strong> Writers are single-threaded; readers are immutable after construction.</p>
 * <p><strong>Performance:</strong> Lookups touch one bucket; message bytes are sliced, not copied.</p>
 */
package ca.gc.cra.diagloc.infrastructure.persistence.table;
