// file: src/main/java/io/expbin/storage/SnapshotPolicy.java
package io.expbin.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a checkpoint after every N committed writes.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each committed write.
     *
     * @return true exactly once per threshold crossing; the caller then checkpoints
     */
    public boolean recordWrite() {
        int n = sinceLast.incrementAndGet();
        if (n >= everyOps) {
            return sinceLast.compareAndSet(n, 0);
        }
        return false;
    }
}
