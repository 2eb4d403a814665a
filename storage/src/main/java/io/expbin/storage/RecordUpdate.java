// file: src/main/java/io/expbin/storage/RecordUpdate.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.util.Map;
import java.util.Objects;

/**
 * Result of a {@link RecordMutation}:
 *  - unchanged(result): nothing is committed, generation stays as is.
 *  - write(bins, result): bins replace the record's bins; an empty map deletes the record.
 */
public final class RecordUpdate<R> {
    private final Map<String, BinValue> bins; // null => unchanged
    private final R result;

    private RecordUpdate(Map<String, BinValue> bins, R result) {
        this.bins = bins;
        this.result = result;
    }

    public static <R> RecordUpdate<R> unchanged(R result) {
        return new RecordUpdate<>(null, result);
    }

    public static <R> RecordUpdate<R> write(Map<String, BinValue> bins, R result) {
        return new RecordUpdate<>(Objects.requireNonNull(bins, "bins"), result);
    }

    public boolean isWrite() {
        return bins != null;
    }

    public Map<String, BinValue> bins() {
        return bins;
    }

    public R result() {
        return result;
    }
}
