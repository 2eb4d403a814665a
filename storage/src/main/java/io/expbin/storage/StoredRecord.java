// file: src/main/java/io/expbin/storage/StoredRecord.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record as held by the store.
 * <p>
 * Fields:
 *  - bins:       bin name -> value (insertion order kept).
 *  - generation: bumped by the store on every committed write; 0 means "does not exist".
 *  - voidTime:   whole-record expiry in epoch seconds, 0 = never. Owned by the store.
 */
public record StoredRecord(Map<String, BinValue> bins, int generation, long voidTime) {

    private static final StoredRecord EMPTY = new StoredRecord(Map.of(), 0, 0L);

    public StoredRecord {
        Objects.requireNonNull(bins, "bins");
        if (generation < 0) throw new IllegalArgumentException("generation must be >= 0");
        if (voidTime < 0) throw new IllegalArgumentException("voidTime must be >= 0");
        bins = Collections.unmodifiableMap(new LinkedHashMap<>(bins));
    }

    /** Placeholder handed to mutations when the key has no record. */
    public static StoredRecord empty() {
        return EMPTY;
    }

    public boolean exists() {
        return generation > 0;
    }

    public boolean isVoid(long nowSeconds) {
        return voidTime != 0 && nowSeconds >= voidTime;
    }

    public BinValue bin(String name) {
        return bins.get(name);
    }
}
