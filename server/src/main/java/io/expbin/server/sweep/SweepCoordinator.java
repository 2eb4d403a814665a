package io.expbin.server.sweep;

import io.expbin.core.BinValidationException;
import io.expbin.core.BinValue;
import io.expbin.core.ExpirationCodec;
import io.expbin.storage.RecordKey;
import io.expbin.storage.RecordSet;
import io.expbin.storage.RecordStore;
import io.expbin.storage.RecordUpdate;
import io.expbin.storage.StoredRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs clean passes that physically remove expired fields from a record set.
 * <p>
 * Goals:
 *  - Visit every record of the set at least once per pass.
 *  - Leave records without reclaimable fields untouched (no write, no generation bump).
 *  - Re-check under the record's atomic section before removing anything, so a
 *    field refreshed by a concurrent touch is never dropped.
 *  - Keep going when a single record fails; the error is logged and counted.
 * <p>
 * Jobs run on a small fixed worker pool with a bounded queue. Running jobs are
 * always pollable; once the registry holds more than {@code retainedJobs} jobs,
 * the oldest finished ones are dropped.
 */
public final class SweepCoordinator implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SweepCoordinator.class.getName());

    private static final int QUEUE_CAPACITY = 64;

    private final RecordStore store;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final ExecutorService workers;
    private final int retainedJobs;
    private final Map<String, SweepJob> jobs = new LinkedHashMap<>();

    public SweepCoordinator(RecordStore store, Clock clock, int threads, Duration defaultTimeout, int retainedJobs) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        if (retainedJobs <= 0) throw new IllegalArgumentException("retainedJobs must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTimeout = requirePositive(Objects.requireNonNull(defaultTimeout, "defaultTimeout"));

        AtomicInteger n = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY), r -> {
            Thread t = new Thread(r, "sweep-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.retainedJobs = retainedJobs;
    }

    public SweepCoordinator(RecordStore store, Clock clock, int threads, Duration defaultTimeout) {
        this(store, clock, threads, defaultTimeout, 256);
    }

    /**
     * Start a pass over 'set'.
     *
     * @param candidateFields fields to inspect; empty means every expiring field
     * @param timeout         wall-clock budget of the pass, null for the default
     * @throws RejectedExecutionException if too many passes are queued
     */
    public SweepJob clean(RecordSet set, Collection<String> candidateFields, Duration timeout) {
        Objects.requireNonNull(set, "set");
        Set<String> candidates = new LinkedHashSet<>(candidateFields == null ? List.of() : candidateFields);
        candidates.forEach(ExpirationCodec::checkFieldName);
        return submit(set, candidates, null, timeout);
    }

    /**
     * Start a pass that picks up after the last record 'previous' visited.
     * Same set and candidates; only keys sorting after its last key are inspected.
     */
    public SweepJob resume(SweepJob previous, Duration timeout) {
        Objects.requireNonNull(previous, "previous");
        if (!previous.isDone()) {
            throw new BinValidationException("sweep " + previous.id() + " is still running");
        }
        return submit(previous.recordSet(), previous.candidates(), previous.progress().lastKey(), timeout);
    }

    /** Registered job by id. */
    public Optional<SweepJob> job(String id) {
        synchronized (jobs) {
            return Optional.ofNullable(jobs.get(id));
        }
    }

    @Override
    public void close() {
        synchronized (jobs) {
            jobs.values().forEach(SweepJob::cancel);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private SweepJob submit(RecordSet set, Set<String> candidates, String resumeAfter, Duration timeout) {
        Duration budget = timeout == null ? defaultTimeout : requirePositive(timeout);
        Instant start = clock.instant();
        SweepJob job = new SweepJob(UUID.randomUUID().toString(), set, candidates, resumeAfter,
                start, start.plus(budget));

        synchronized (jobs) {
            jobs.put(job.id(), job);
            evictFinished();
        }
        try {
            workers.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            synchronized (jobs) {
                jobs.remove(job.id());
            }
            throw e;
        }
        log.log(Level.INFO, "Sweep {0} started on {1} (bins={2}, resumeAfter={3})",
                new Object[]{job.id(), set, candidates.isEmpty() ? "*" : candidates, resumeAfter});
        return job;
    }

    /** Drop the oldest finished jobs while the registry is over capacity. Caller holds the jobs lock. */
    private void evictFinished() {
        Iterator<SweepJob> it = jobs.values().iterator();
        while (jobs.size() > retainedJobs && it.hasNext()) {
            if (it.next().isDone()) {
                it.remove();
            }
        }
    }

    private void run(SweepJob job) {
        try {
            store.scan(job.recordSet(), (key, rec) -> {
                if (job.cancelRequested()) {
                    job.finish(SweepState.CANCELLED, clock.instant());
                    return false;
                }
                if (!clock.instant().isBefore(job.deadline())) {
                    job.finish(SweepState.TIMED_OUT, clock.instant());
                    return false;
                }
                if (job.resumeAfter() != null && key.userKey().compareTo(job.resumeAfter()) <= 0) {
                    return true;
                }
                job.recordVisited(key.userKey());
                try {
                    int removed = sweepRecord(key, rec, job.candidates());
                    if (removed > 0) {
                        job.recordCleaned(removed);
                    }
                } catch (RuntimeException e) {
                    job.recordError();
                    log.log(Level.WARNING, "Sweep " + job.id() + " skipped " + key, e);
                }
                return true;
            });
            if (job.cancelRequested()) {
                job.finish(SweepState.CANCELLED, clock.instant());
            } else {
                job.finish(SweepState.DONE, clock.instant());
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Sweep " + job.id() + " failed", e);
            job.fail(e, clock.instant());
        }
        SweepProgress p = job.progress();
        log.log(Level.INFO, "Sweep {0} {1}: visited={2} cleaned={3} removed={4} errors={5}",
                new Object[]{job.id(), job.state(), p.recordsVisited(), p.recordsCleaned(), p.binsRemoved(), p.errors()});
    }

    /**
     * Remove reclaimable fields of one record.
     *
     * @return number of fields removed
     */
    private int sweepRecord(RecordKey key, StoredRecord snapshot, Set<String> candidates) {
        if (!ExpirationCodec.hasWrappedField(snapshot.bins(), candidates)) {
            return 0;
        }
        if (ExpirationCodec.reclaimableFields(snapshot.bins(), candidates, nowSeconds()).isEmpty()) {
            return 0;
        }
        return store.readModifyWrite(key, current -> {
            List<String> gone = ExpirationCodec.reclaimableFields(current.bins(), candidates, nowSeconds());
            if (gone.isEmpty()) {
                return RecordUpdate.unchanged(0);
            }
            Map<String, BinValue> bins = new LinkedHashMap<>(current.bins());
            for (String field : gone) {
                ExpirationCodec.remove(bins, field);
            }
            return RecordUpdate.write(bins, gone.size());
        });
    }

    private static Duration requirePositive(Duration d) {
        if (d.isNegative() || d.isZero()) {
            throw new BinValidationException("timeout must be > 0, got: " + d);
        }
        return d;
    }

    private long nowSeconds() {
        return clock.millis() / 1000L;
    }
}
