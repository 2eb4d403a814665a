// file: server/src/main/java/io/expbin/server/ExpireBinService.java
package io.expbin.server;

import io.expbin.core.BinTouch;
import io.expbin.core.BinValue;
import io.expbin.core.BinWrite;
import io.expbin.core.OpStatus;
import io.expbin.core.TtlResult;
import io.expbin.server.sweep.SweepCoordinator;
import io.expbin.server.sweep.SweepJob;
import io.expbin.server.sweep.SweepNotFoundException;
import io.expbin.storage.RecordKey;
import io.expbin.storage.RecordNotFoundException;
import io.expbin.storage.RecordSet;
import io.expbin.storage.RecordStore;
import io.expbin.storage.StoredRecord;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Application service for the expiring-bin operations.
 *
 * Responsibilities:
 *  - Single entry point for the HTTP layer (and embedders) over the
 *    field accessor, the sweep coordinator and the raw store view.
 *  - Turn "no such sweep" into a typed exception.
 */
public class ExpireBinService {

    private final RecordStore store;
    private final FieldAccessor fields;
    private final SweepCoordinator sweeps;

    public ExpireBinService(RecordStore store, FieldAccessor fields, SweepCoordinator sweeps) {
        this.store = Objects.requireNonNull(store, "store");
        this.fields = Objects.requireNonNull(fields, "fields");
        this.sweeps = Objects.requireNonNull(sweeps, "sweeps");
    }

    public Map<String, BinValue> get(RecordKey key, List<String> bins) {
        return fields.get(key, bins);
    }

    public OpStatus put(RecordKey key, String bin, BinValue value, int ttl) {
        return fields.put(key, bin, value, ttl);
    }

    public OpStatus puts(RecordKey key, List<BinWrite> entries) {
        return fields.puts(key, entries);
    }

    public OpStatus touch(RecordKey key, List<BinTouch> entries) {
        return fields.touch(key, entries);
    }

    public TtlResult ttl(RecordKey key, String bin) {
        return fields.ttl(key, bin);
    }

    /** Host-store view of the record, marker bins included. */
    public StoredRecord raw(RecordKey key) {
        StoredRecord rec = store.get(key);
        if (rec == null) {
            throw new RecordNotFoundException(key, "raw");
        }
        return rec;
    }

    public SweepJob clean(RecordSet set, Collection<String> bins, Duration timeout) {
        return sweeps.clean(set, bins, timeout);
    }

    public SweepJob resume(String jobId, Duration timeout) {
        return sweeps.resume(sweep(jobId), timeout);
    }

    public SweepJob sweep(String jobId) {
        return sweeps.job(jobId).orElseThrow(() -> new SweepNotFoundException(jobId));
    }

    public SweepJob cancel(String jobId) {
        SweepJob job = sweep(jobId);
        job.cancel();
        return job;
    }
}
