// file: src/main/java/io/expbin/core/BinValue.java
package io.expbin.core;

import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value stored in a single bin of a record.
 * <p>
 * Tagged variant over the kinds a bin may hold:
 *  - scalars: nil, bool, long, double, string, bytes,
 *  - nested:  list and map (map keys are strings, iteration order is kept).
 * <p>
 * Invariants:
 *  - All variants are immutable; collections and byte arrays are copied on the way in.
 *  - equals/hashCode are structural (byte arrays compared by content).
 */
public sealed interface BinValue
        permits BinValue.NilValue, BinValue.BoolValue, BinValue.LongValue, BinValue.DoubleValue,
                BinValue.StringValue, BinValue.BytesValue, BinValue.ListValue, BinValue.MapValue {

    /** Short name of the variant, used in error messages and debug output. */
    String kind();

    static BinValue nil() { return NilValue.INSTANCE; }

    static BinValue of(boolean v) { return new BoolValue(v); }

    static BinValue of(long v) { return new LongValue(v); }

    static BinValue of(double v) { return new DoubleValue(v); }

    static BinValue of(String v) { return new StringValue(v); }

    static BinValue of(byte[] v) { return new BytesValue(v); }

    static BinValue of(List<BinValue> v) { return new ListValue(v); }

    static BinValue of(Map<String, BinValue> v) { return new MapValue(v); }

    final class NilValue implements BinValue {
        static final NilValue INSTANCE = new NilValue();

        private NilValue() {
        }

        @Override public String kind() { return "nil"; }

        @Override public String toString() { return "nil"; }
    }

    record BoolValue(boolean value) implements BinValue {
        @Override public String kind() { return "bool"; }
    }

    record LongValue(long value) implements BinValue {
        @Override public String kind() { return "long"; }
    }

    record DoubleValue(double value) implements BinValue {
        @Override public String kind() { return "double"; }
    }

    record StringValue(String value) implements BinValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override public String kind() { return "string"; }
    }

    final class BytesValue implements BinValue {
        private final byte[] value;

        public BytesValue(byte[] value) {
            Objects.requireNonNull(value, "value");
            this.value = Arrays.copyOf(value, value.length);
        }

        public byte[] value() { return Arrays.copyOf(value, value.length); }

        @Override public String kind() { return "bytes"; }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() { return Arrays.hashCode(value); }

        @Override
        public String toString() { return "bytes(" + Base64.getEncoder().encodeToString(value) + ")"; }
    }

    record ListValue(List<BinValue> values) implements BinValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override public String kind() { return "list"; }
    }

    record MapValue(Map<String, BinValue> entries) implements BinValue {
        public MapValue {
            Objects.requireNonNull(entries, "entries");
            Map<String, BinValue> copy = new LinkedHashMap<>(entries.size() * 2);
            for (Map.Entry<String, BinValue> e : entries.entrySet()) {
                copy.put(Objects.requireNonNull(e.getKey(), "map key"),
                        Objects.requireNonNull(e.getValue(), "map value"));
            }
            entries = Collections.unmodifiableMap(copy);
        }

        @Override public String kind() { return "map"; }
    }
}
