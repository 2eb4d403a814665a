// file: src/main/java/io/expbin/storage/RecordCodec.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xEB1A   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, big-endian DataOutput)]
 *     - namespace, set, userKey: int32 len + UTF-8 bytes each
 *     - deleted:    byte (0 or 1)
 *     - generation: int32
 *     - voidTime:   int64 (epoch seconds, 0 = never)
 *     - binCount:   int32
 *         repeated binCount times:
 *           - name:  int32 len + UTF-8 bytes
 *           - value: see {@link BinValueCodec}
 * <p>
 * Each record carries the full post-write state of one key, so replay is
 * "last record per key wins" and needs no dedupe.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xEB1A;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Decoded WAL entry. record == null means the key was deleted. */
    record LogRecord(RecordKey key, StoredRecord record) {
        boolean deleted() { return record == null; }
    }

    /** Encode a full record state into header+payload bytes ready for append. */
    static byte[] encode(RecordKey key, StoredRecord rec) {
        byte[] payload = encodePayload(key, rec);
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[header.remaining() + payload.length];
        header.get(out, 0, header.limit());
        System.arraycopy(payload, 0, out, header.limit(), payload.length);
        return out;
    }

    /** Encode a delete marker for the key. */
    static byte[] encodeDelete(RecordKey key) {
        return encode(key, null);
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        try (var in = new DataInputStream(new ByteArrayInputStream(payload))) {
            RecordKey key = readKey(in);
            boolean deleted = in.readByte() != 0;
            int generation = in.readInt();
            long voidTime = in.readLong();
            int count = in.readInt();
            Map<String, BinValue> bins = new LinkedHashMap<>(Math.max(4, count * 2));
            for (int i = 0; i < count; i++) {
                String name = BinValueCodec.readString(in);
                bins.put(name, BinValueCodec.read(in));
            }
            return new LogRecord(key, deleted ? null : new StoredRecord(bins, generation, voidTime));
        } catch (IOException e) {
            throw new StorageException("Corrupt WAL payload", e);
        }
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(RecordKey key, StoredRecord rec) {
        var buf = new ByteArrayOutputStream(128);
        try (var out = new DataOutputStream(buf)) {
            writeKey(out, key);
            out.writeByte(rec == null ? 1 : 0);
            out.writeInt(rec == null ? 0 : rec.generation());
            out.writeLong(rec == null ? 0L : rec.voidTime());
            Map<String, BinValue> bins = rec == null ? Map.of() : rec.bins();
            out.writeInt(bins.size());
            for (Map.Entry<String, BinValue> e : bins.entrySet()) {
                BinValueCodec.writeString(out, e.getKey());
                BinValueCodec.write(out, e.getValue());
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw; keep the signature honest anyway.
            throw new StorageException("Failed to encode record " + key, e);
        }
        return buf.toByteArray();
    }

    static void writeKey(DataOutputStream out, RecordKey key) throws IOException {
        BinValueCodec.writeString(out, key.namespace());
        BinValueCodec.writeString(out, key.set());
        BinValueCodec.writeString(out, key.userKey());
    }

    static RecordKey readKey(DataInputStream in) throws IOException {
        String ns = BinValueCodec.readString(in);
        String set = BinValueCodec.readString(in);
        String userKey = BinValueCodec.readString(in);
        return new RecordKey(ns, set, userKey);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
