// file: src/main/java/io/expbin/storage/BinValueCodec.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary form of a {@link BinValue}, shared by WAL records and snapshots.
 * <p>
 * Layout: one tag byte followed by the variant body.
 *   0 nil    : (empty)
 *   1 bool   : byte 0/1
 *   2 long   : int64
 *   3 double : IEEE-754 int64 bits
 *   4 string : int32 len + UTF-8 bytes
 *   5 bytes  : int32 len + bytes
 *   6 list   : int32 count + count values
 *   7 map    : int32 count + count (string key, value) pairs
 * <p>
 * Tags are append-only: new variants get new tags, existing tags never change meaning.
 */
final class BinValueCodec {
    static final byte TAG_NIL = 0;
    static final byte TAG_BOOL = 1;
    static final byte TAG_LONG = 2;
    static final byte TAG_DOUBLE = 3;
    static final byte TAG_STRING = 4;
    static final byte TAG_BYTES = 5;
    static final byte TAG_LIST = 6;
    static final byte TAG_MAP = 7;

    private BinValueCodec() {
        // utility
    }

    static void write(DataOutput out, BinValue v) throws IOException {
        if (v instanceof BinValue.NilValue) {
            out.writeByte(TAG_NIL);
        } else if (v instanceof BinValue.BoolValue b) {
            out.writeByte(TAG_BOOL);
            out.writeBoolean(b.value());
        } else if (v instanceof BinValue.LongValue l) {
            out.writeByte(TAG_LONG);
            out.writeLong(l.value());
        } else if (v instanceof BinValue.DoubleValue d) {
            out.writeByte(TAG_DOUBLE);
            out.writeLong(Double.doubleToLongBits(d.value()));
        } else if (v instanceof BinValue.StringValue s) {
            out.writeByte(TAG_STRING);
            writeString(out, s.value());
        } else if (v instanceof BinValue.BytesValue b) {
            out.writeByte(TAG_BYTES);
            byte[] raw = b.value();
            out.writeInt(raw.length);
            out.write(raw);
        } else if (v instanceof BinValue.ListValue l) {
            out.writeByte(TAG_LIST);
            out.writeInt(l.values().size());
            for (BinValue item : l.values()) {
                write(out, item);
            }
        } else if (v instanceof BinValue.MapValue m) {
            out.writeByte(TAG_MAP);
            out.writeInt(m.entries().size());
            for (Map.Entry<String, BinValue> e : m.entries().entrySet()) {
                writeString(out, e.getKey());
                write(out, e.getValue());
            }
        } else {
            throw new IllegalStateException("Unknown BinValue variant: " + v);
        }
    }

    static BinValue read(DataInput in) throws IOException {
        byte tag = in.readByte();
        switch (tag) {
            case TAG_NIL:
                return BinValue.nil();
            case TAG_BOOL:
                return BinValue.of(in.readBoolean());
            case TAG_LONG:
                return BinValue.of(in.readLong());
            case TAG_DOUBLE:
                return BinValue.of(Double.longBitsToDouble(in.readLong()));
            case TAG_STRING:
                return BinValue.of(readString(in));
            case TAG_BYTES: {
                byte[] raw = new byte[checkedLength(in.readInt())];
                in.readFully(raw);
                return BinValue.of(raw);
            }
            case TAG_LIST: {
                int n = checkedLength(in.readInt());
                List<BinValue> items = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    items.add(read(in));
                }
                return BinValue.of(items);
            }
            case TAG_MAP: {
                int n = checkedLength(in.readInt());
                Map<String, BinValue> entries = new LinkedHashMap<>(n * 2);
                for (int i = 0; i < n; i++) {
                    String k = readString(in);
                    entries.put(k, read(in));
                }
                return BinValue.of(entries);
            }
            default:
                throw new IOException("Unknown bin value tag: " + tag);
        }
    }

    static void writeString(DataOutput out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    static String readString(DataInput in) throws IOException {
        byte[] b = new byte[checkedLength(in.readInt())];
        in.readFully(b);
        return new String(b, StandardCharsets.UTF_8);
    }

    private static int checkedLength(int len) throws IOException {
        if (len < 0) throw new IOException("negative length: " + len);
        return len;
    }
}
