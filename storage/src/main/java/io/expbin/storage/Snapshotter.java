// file: src/main/java/io/expbin/storage/Snapshotter.java
package io.expbin.storage;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's records at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay the WAL segments that survived the last checkpoint.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map. Older snapshots may be pruned
     * once the new one is durable.
     *
     * @param current immutable snapshot of key -> record
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(Map<RecordKey, StoredRecord> current);

    /** Load the latest snapshot if present, else null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, Map<RecordKey, StoredRecord> data) {}
}
