// file: server/src/main/java/io/expbin/server/FieldAccessor.java
package io.expbin.server;

import io.expbin.core.BinTouch;
import io.expbin.core.BinValidationException;
import io.expbin.core.BinValue;
import io.expbin.core.BinWrite;
import io.expbin.core.DecodedBin;
import io.expbin.core.ExpirationCodec;
import io.expbin.core.ExpirationMarker;
import io.expbin.core.OpStatus;
import io.expbin.core.TtlResult;
import io.expbin.storage.RecordKey;
import io.expbin.storage.RecordNotFoundException;
import io.expbin.storage.RecordStore;
import io.expbin.storage.RecordUpdate;
import io.expbin.storage.StorageException;
import io.expbin.storage.StoredRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Per-field expiration on top of a whole-record store.
 *
 * Responsibilities:
 *  - Validate every input before touching storage.
 *  - Run each mutation as exactly one readModifyWrite on the target record,
 *    so a batch is all-or-nothing and concurrent writers of one record serialize.
 *  - Hide expired fields from reads; purge them opportunistically on writes.
 *
 * Time is read from the injected Clock and truncated to whole seconds.
 */
public class FieldAccessor {

    private final RecordStore store;
    private final Clock clock;

    public FieldAccessor(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Read live fields.
     *
     * @param fields requested bins in answer order; empty means every live user bin
     * @return live fields only; expired or missing ones are left out
     */
    public Map<String, BinValue> get(RecordKey key, List<String> fields) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fields, "fields");
        fields.forEach(ExpirationCodec::checkFieldName);

        StoredRecord rec = onRecord("get", key, () -> store.get(key));
        if (rec == null) {
            throw new RecordNotFoundException(key, "get");
        }
        long now = nowSeconds();
        List<String> wanted = fields.isEmpty() ? userFields(rec.bins()) : fields;

        Map<String, BinValue> out = new LinkedHashMap<>();
        for (String field : wanted) {
            DecodedBin bin = ExpirationCodec.decode(rec.bins(), field);
            if (bin.isLive(now)) {
                out.put(field, bin.value());
            }
        }
        return out;
    }

    /** Write one field; creates the record if needed. */
    public OpStatus put(RecordKey key, String field, BinValue value, int ttl) {
        return puts(key, List.of(BinWrite.of(field, requireValue(field, value), ttl)));
    }

    /**
     * Write several fields of one record in a single atomic step.
     * <p>
     * An entry without a value keeps the current value of a live field and only
     * applies its ttl; if the field is absent or expired the whole batch is FAILED
     * and nothing is written. Later entries for the same field win.
     */
    public OpStatus puts(RecordKey key, List<BinWrite> entries) {
        Objects.requireNonNull(key, "key");
        checkBatch(entries);
        for (BinWrite e : entries) {
            ExpirationCodec.checkFieldName(e.field());
            ExpirationCodec.checkTtl(e.ttlOrPlain());
        }

        return onRecord("puts", key, () -> store.readModifyWrite(key, current -> {
            long now = nowSeconds();
            Map<String, BinValue> bins = new LinkedHashMap<>(current.bins());
            purgeExpired(bins, now);

            for (BinWrite e : entries) {
                DecodedBin existing = ExpirationCodec.decode(bins, e.field());
                boolean live = existing.isLive(now);
                BinValue value = e.value() != null ? e.value() : (live ? existing.value() : null);
                if (value == null) {
                    return RecordUpdate.unchanged(OpStatus.FAILED);
                }
                ExpirationMarker liveMarker = live ? existing.marker() : ExpirationMarker.none();
                ExpirationMarker marker = ExpirationCodec.markerForPut(e.ttlOrPlain(), now, liveMarker);
                ExpirationCodec.write(bins, e.field(), value, marker);
            }
            return RecordUpdate.write(bins, OpStatus.OK);
        }));
    }

    /**
     * Replace the expiration of existing fields, values untouched.
     * Every entry needs an explicit ttl. Any absent or expired target makes the
     * whole call FAILED with no write.
     */
    public OpStatus touch(RecordKey key, List<BinTouch> entries) {
        Objects.requireNonNull(key, "key");
        checkBatch(entries);
        for (BinTouch t : entries) {
            ExpirationCodec.checkFieldName(t.field());
            if (t.ttl() == null) {
                throw new BinValidationException("ttl is required for touch of bin '" + t.field() + "'");
            }
            ExpirationCodec.checkTtl(t.ttl());
        }

        return onRecord("touch", key, () -> store.readModifyWrite(key, current -> {
            if (!current.exists()) {
                throw new RecordNotFoundException(key, "touch");
            }
            long now = nowSeconds();
            Map<String, BinValue> bins = new LinkedHashMap<>(current.bins());
            purgeExpired(bins, now);

            for (BinTouch t : entries) {
                DecodedBin existing = ExpirationCodec.decode(bins, t.field());
                if (!existing.isLive(now)) {
                    return RecordUpdate.unchanged(OpStatus.FAILED);
                }
                ExpirationCodec.write(bins, t.field(), existing.value(),
                        ExpirationCodec.markerForTouch(t.ttl(), now));
            }
            return RecordUpdate.write(bins, OpStatus.OK);
        }));
    }

    /** Remaining lifetime of a field. */
    public TtlResult ttl(RecordKey key, String field) {
        Objects.requireNonNull(key, "key");
        ExpirationCodec.checkFieldName(field);

        StoredRecord rec = onRecord("ttl", key, () -> store.get(key));
        if (rec == null) {
            throw new RecordNotFoundException(key, "ttl");
        }
        long now = nowSeconds();
        DecodedBin bin = ExpirationCodec.decode(rec.bins(), field);
        if (!bin.isLive(now)) {
            return TtlResult.absent();
        }
        if (bin.marker() instanceof ExpirationMarker.ExpiresAt at) {
            return new TtlResult.Remaining(at.remainingSeconds(now));
        }
        return TtlResult.never();
    }

    // ---------- helpers ----------

    private static void checkBatch(List<?> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new BinValidationException("entries must not be empty");
        }
        for (Object e : entries) {
            if (e == null) {
                throw new BinValidationException("entries must not contain null");
            }
        }
    }

    private static BinValue requireValue(String field, BinValue value) {
        if (value == null) {
            throw new BinValidationException("value is required for put of bin '" + field + "'");
        }
        return value;
    }

    /** Drop every wrapped field that is expired or orphaned. */
    private static void purgeExpired(Map<String, BinValue> bins, long now) {
        for (String field : ExpirationCodec.reclaimableFields(bins, Set.of(), now)) {
            ExpirationCodec.remove(bins, field);
        }
    }

    private static List<String> userFields(Map<String, BinValue> bins) {
        List<String> out = new ArrayList<>(bins.size());
        for (String name : bins.keySet()) {
            if (!ExpirationCodec.isMarkerBin(name)) {
                out.add(name);
            }
        }
        return out;
    }

    /** Run a store call, tagging storage failures with the operation and key. */
    private static <R> R onRecord(String operation, RecordKey key, Supplier<R> call) {
        try {
            return call.get();
        } catch (StorageException e) {
            throw new StorageException(operation + " " + key + " failed: " + e.getMessage(), e);
        }
    }

    private long nowSeconds() {
        return clock.millis() / 1000L;
    }
}
