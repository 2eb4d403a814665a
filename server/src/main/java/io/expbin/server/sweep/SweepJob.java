package io.expbin.server.sweep;

import io.expbin.storage.RecordSet;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle of one clean pass over a record set.
 * <p>
 * Thread-safety: counters and state are updated by the sweeping worker and
 * read by any number of pollers. cancel() only raises a flag; the worker
 * honours it between records.
 */
public final class SweepJob {
    private final String id;
    private final RecordSet recordSet;
    private final Set<String> candidates;
    private final String resumeAfter;
    private final Instant startedAt;
    private final Instant deadline;

    private final AtomicReference<SweepState> state = new AtomicReference<>(SweepState.RUNNING);
    private final AtomicLong visited = new AtomicLong();
    private final AtomicLong cleaned = new AtomicLong();
    private final AtomicLong removed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean cancelRequested;
    private volatile String lastKey;
    private volatile Instant finishedAt;
    private volatile Throwable failure;

    SweepJob(String id, RecordSet recordSet, Set<String> candidates, String resumeAfter,
             Instant startedAt, Instant deadline) {
        this.id = id;
        this.recordSet = recordSet;
        this.candidates = Set.copyOf(candidates);
        this.resumeAfter = resumeAfter;
        this.startedAt = startedAt;
        this.deadline = deadline;
        this.lastKey = resumeAfter;
    }

    public String id() { return id; }

    public RecordSet recordSet() { return recordSet; }

    /** Fields the sweep inspects; empty means every expiring field. */
    public Set<String> candidates() { return candidates; }

    /** Keys up to and including this one are skipped; null for a fresh pass. */
    public String resumeAfter() { return resumeAfter; }

    public Instant startedAt() { return startedAt; }

    public Instant deadline() { return deadline; }

    /** Null while running. */
    public Instant finishedAt() { return finishedAt; }

    /** Cause of a FAILED job, else null. */
    public Throwable failure() { return failure; }

    public SweepState state() { return state.get(); }

    public boolean isDone() { return state.get().isTerminal(); }

    public SweepProgress progress() {
        return new SweepProgress(visited.get(), cleaned.get(), removed.get(), errors.get(), lastKey);
    }

    /** Ask the job to stop at the next record boundary. No-op once finished. */
    public void cancel() {
        cancelRequested = true;
    }

    /**
     * Wait for the job to reach a terminal state.
     *
     * @return true if it finished within 'timeout'
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ---------- worker side ----------

    boolean cancelRequested() { return cancelRequested; }

    void recordVisited(String userKey) {
        visited.incrementAndGet();
        lastKey = userKey;
    }

    void recordCleaned(int bins) {
        cleaned.incrementAndGet();
        removed.addAndGet(bins);
    }

    void recordError() {
        errors.incrementAndGet();
    }

    void fail(Throwable cause, Instant at) {
        failure = cause;
        finish(SweepState.FAILED, at);
    }

    /** First terminal state wins; later calls are ignored. */
    boolean finish(SweepState terminal, Instant at) {
        if (!state.compareAndSet(SweepState.RUNNING, terminal)) {
            return false;
        }
        finishedAt = at;
        finished.countDown();
        return true;
    }
}
