// file: src/main/java/io/expbin/storage/DurableRecordStore.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable record store implementation.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: key -> StoredRecord.
 *  - On write (readModifyWrite / put / delete):
 *      1) Run the mutation inside ConcurrentHashMap.compute, which is the
 *         per-record atomic section: writers of one key serialize, other keys proceed.
 *      2) Serialize the full post-write record and append+fsync it to the WAL
 *         before the new state becomes visible.
 *      3) Rotate the WAL segment if needed.
 *      4) Possibly checkpoint based on SnapshotPolicy.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay surviving WAL segments; last record per key wins.
 * <p>
 * Checkpoint: under the exclusive side of a read/write lock (writers hold the
 * shared side) the WAL is rotated and the map copied; the copy is then written
 * as a snapshot and WAL segments older than the rotation point are deleted.
 * Checkpoints run one at a time, so a snapshot is never published after a newer one.
 */
public class DurableRecordStore implements RecordStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableRecordStore.class.getName());

    private final Map<RecordKey, StoredRecord> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;
    private final ReentrantReadWriteLock checkpointLock = new ReentrantReadWriteLock();
    private final ReentrantLock checkpointSerial = new ReentrantLock();

    public DurableRecordStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    public DurableRecordStore(Wal wal, Snapshotter snaps, Clock clock) {
        this(wal, snaps, new SnapshotPolicy(50_000), clock);
    }

    @Override
    public StoredRecord get(RecordKey key) {
        Objects.requireNonNull(key, "key");
        StoredRecord rec = mem.get(key);
        if (rec == null || rec.isVoid(nowSeconds())) {
            return null;
        }
        return rec;
    }

    @Override
    public void put(RecordKey key, Map<String, BinValue> bins, long recordTtlSeconds) {
        Objects.requireNonNull(bins, "bins");
        if (recordTtlSeconds < -1) {
            throw new IllegalArgumentException("recordTtlSeconds must be >= -1, got: " + recordTtlSeconds);
        }
        commit(key, current -> {
            Map<String, BinValue> merged = new LinkedHashMap<>(current == null ? Map.of() : current.bins());
            merged.putAll(bins);
            long voidTime;
            if (recordTtlSeconds > 0) {
                voidTime = nowSeconds() + recordTtlSeconds;
            } else if (recordTtlSeconds == -1) {
                voidTime = 0L;
            } else {
                voidTime = current == null ? 0L : current.voidTime();
            }
            return new Outcome<>(merged, voidTime, null);
        });
    }

    @Override
    public boolean delete(RecordKey key) {
        Boolean existed = commit(key, current -> current == null
                ? Outcome.unchanged(false)
                : new Outcome<>(Map.of(), 0L, true));
        return existed;
    }

    @Override
    public <R> R readModifyWrite(RecordKey key, RecordMutation<R> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        return commit(key, current -> {
            RecordUpdate<R> update = mutation.apply(current == null ? StoredRecord.empty() : current);
            Objects.requireNonNull(update, "mutation returned null");
            if (!update.isWrite()) {
                return Outcome.unchanged(update.result());
            }
            long voidTime = current == null ? 0L : current.voidTime();
            return new Outcome<>(update.bins(), voidTime, update.result());
        });
    }

    @Override
    public void scan(RecordSet set, RecordVisitor visitor) {
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(visitor, "visitor");
        List<RecordKey> keys = new ArrayList<>();
        for (RecordKey k : mem.keySet()) {
            if (set.contains(k)) keys.add(k);
        }
        keys.sort(Comparator.comparing(RecordKey::userKey));
        for (RecordKey k : keys) {
            StoredRecord rec = get(k);
            if (rec == null) {
                continue; // deleted or void since the key snapshot was taken
            }
            if (!visitor.visit(k, rec)) {
                return;
            }
        }
    }

    /**
     * Return a shallow snapshot of every live record.
     * Intended for checkpoints, debugging and tests.
     */
    public Map<RecordKey, StoredRecord> snapshotAll() {
        return Map.copyOf(mem);
    }

    /** Write a snapshot now and drop the WAL segments it covers. */
    public String checkpoint() {
        checkpointSerial.lock();
        try {
            Map<RecordKey, StoredRecord> copy;
            String firstLiveSegment;
            checkpointLock.writeLock().lock();
            try {
                wal.rotate();
                firstLiveSegment = wal.currentSegment();
                copy = Map.copyOf(mem);
            } finally {
                checkpointLock.writeLock().unlock();
            }
            String id = snaps.writeSnapshot(copy);
            wal.deleteSegmentsBefore(firstLiveSegment);
            log.log(Level.INFO, "Checkpoint {0} written ({1} records), WAL now starts at {2}",
                    new Object[]{id, copy.size(), firstLiveSegment});
            return id;
        } finally {
            checkpointSerial.unlock();
        }
    }

    @Override
    public void close() {
        wal.close();
    }

    // ---------- internals ----------

    /** What a write step decided: new bins + voidTime, or nothing (bins == null). */
    private record Outcome<R>(Map<String, BinValue> bins, long voidTime, R result) {
        static <R> Outcome<R> unchanged(R result) {
            return new Outcome<>(null, 0L, result);
        }
    }

    @FunctionalInterface
    private interface WriteStep<R> {
        /** @param current live record or null */
        Outcome<R> apply(StoredRecord current);
    }

    /**
     * Run 'step' under the per-key atomic section and make its outcome durable
     * before publishing it. An exception (from the step or the WAL) leaves the
     * record as it was.
     */
    private <R> R commit(RecordKey key, WriteStep<R> step) {
        Objects.requireNonNull(key, "key");
        AtomicReference<R> result = new AtomicReference<>();
        boolean[] wrote = new boolean[1];

        checkpointLock.readLock().lock();
        try {
            mem.compute(key, (k, stored) -> {
                long now = nowSeconds();
                StoredRecord live = (stored == null || stored.isVoid(now)) ? null : stored;
                Outcome<R> out = step.apply(live);
                result.set(out.result());

                if (out.bins() == null) {
                    return live; // void records are dropped lazily; replay yields the same void state
                }
                if (out.bins().isEmpty()) {
                    if (live != null) {
                        wal.append(RecordCodec.encodeDelete(k));
                        wrote[0] = true;
                    }
                    return null;
                }
                int generation = (live == null ? 0 : live.generation()) + 1;
                StoredRecord next = new StoredRecord(out.bins(), generation, out.voidTime());
                wal.append(RecordCodec.encode(k, next));
                wrote[0] = true;
                return next;
            });
        } finally {
            checkpointLock.readLock().unlock();
        }

        if (wrote[0]) {
            wal.rotateIfNeeded();
            if (snapPolicy.recordWrite()) {
                checkpoint();
            }
        }
        return result.get();
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records in order; each carries a full record state.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            mem.putAll(loaded.data());
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.deleted()) {
                    mem.remove(rec.key());
                } else {
                    mem.put(rec.key(), rec.record());
                }
                replayed++;
            }
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Recovery failed", e);
        }
        log.log(Level.INFO, "Recovered {0} records (snapshot={1}, walRecords={2})",
                new Object[]{mem.size(), loaded == null ? "none" : loaded.id(), replayed});
    }

    private long nowSeconds() {
        return clock.millis() / 1000L;
    }
}
