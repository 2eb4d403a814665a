// file: src/main/java/io/expbin/storage/RecordStore.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.util.Map;

/**
 * Record store hosting the field-expiration engine.
 * <p>
 * Semantics:
 *  - Every committed write is durable before the call returns (WAL + fsync).
 *  - readModifyWrite() is atomic per record: concurrent calls on the same key
 *    serialize; there is no ordering across keys.
 *  - Records whose voidTime passed are invisible to get/scan/readModifyWrite.
 *  - A record whose last bin is removed is deleted.
 */
public interface RecordStore {

    /** Live record for the key, or null when absent or void. */
    StoredRecord get(RecordKey key);

    /**
     * Plain storage write: merges 'bins' into the record (creating it if needed).
     *
     * @param recordTtlSeconds whole-record ttl: > 0 sets it, -1 clears it, 0 keeps the current one
     */
    void put(RecordKey key, Map<String, BinValue> bins, long recordTtlSeconds);

    /** Remove the whole record. Returns false if it did not exist. */
    boolean delete(RecordKey key);

    /**
     * Apply 'mutation' atomically to the record and commit what it returns.
     * Exceptions thrown by the mutation propagate and nothing is committed.
     */
    <R> R readModifyWrite(RecordKey key, RecordMutation<R> mutation);

    /**
     * Visit every live record of the set, one at a time, over a key snapshot
     * taken when the scan starts. Records deleted mid-scan are skipped.
     */
    void scan(RecordSet set, RecordVisitor visitor);
}
