// file: src/main/java/io/expbin/storage/Wal.java
package io.expbin.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - Segments are ordered; a checkpoint rotates to a fresh segment and later
 *    drops every segment older than it.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /** Rotate log segment if the size threshold is hit. Called by the store after each write. */
    void rotateIfNeeded();

    /** Close the current segment and start a new one unconditionally. */
    void rotate();

    /** File name of the segment currently appended to. */
    String currentSegment();

    /** Delete every segment that sorts before 'segment'. */
    void deleteSegmentsBefore(String segment);

    /**
     * Open a sequential reader over all segments, oldest first.
     * The reader stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
