package io.expbin.storage;

import io.expbin.core.BinValue;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    private static final RecordKey KEY = new RecordKey("test", "users", "user:1234");

    private static byte[] payloadOf(byte[] framed) {
        ByteBuffer hdr = ByteBuffer.wrap(framed, 0, RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(RecordCodec.MAGIC, hdr.getShort());
        assertEquals(RecordCodec.VERSION, hdr.get());
        int length = hdr.getInt();
        int crc = hdr.getInt();
        assertEquals(framed.length - RecordCodec.HEADER_BYTES, length);

        byte[] payload = new byte[length];
        System.arraycopy(framed, RecordCodec.HEADER_BYTES, payload, 0, length);
        assertEquals(RecordCodec.crc32(payload), crc);
        return payload;
    }

    @Test
    void record_with_nested_bins_keeps_order_generation_and_void_time() {
        Map<String, BinValue> bins = new LinkedHashMap<>();
        bins.put("name", BinValue.of("Ada"));
        bins.put("~exp:name", BinValue.of(1_900_000_000L));
        bins.put("blob", BinValue.of(new byte[]{1, 2, 3}));
        bins.put("tags", BinValue.of(List.of(BinValue.of("a"), BinValue.nil(), BinValue.of(2.5))));
        bins.put("flags", BinValue.of(Map.of("admin", BinValue.of(true))));

        var rec = new StoredRecord(bins, 7, 1_800_000_000L);

        var decoded = RecordCodec.decode(payloadOf(RecordCodec.encode(KEY, rec)));

        assertEquals(KEY, decoded.key());
        assertFalse(decoded.deleted());
        assertEquals(7, decoded.record().generation());
        assertEquals(1_800_000_000L, decoded.record().voidTime());
        assertEquals(bins, decoded.record().bins());
        assertEquals(List.copyOf(bins.keySet()), List.copyOf(decoded.record().bins().keySet()));
    }

    @Test
    void delete_marker_decodes_as_deleted() {
        var decoded = RecordCodec.decode(payloadOf(RecordCodec.encodeDelete(KEY)));

        assertEquals(KEY, decoded.key());
        assertTrue(decoded.deleted());
        assertNull(decoded.record());
    }

    @Test
    void truncated_payload_is_reported_as_storage_error() {
        byte[] payload = payloadOf(RecordCodec.encode(KEY, new StoredRecord(Map.of("a", BinValue.of(1L)), 1, 0L)));
        byte[] cut = new byte[payload.length - 3];
        System.arraycopy(payload, 0, cut, 0, cut.length);

        assertThrows(StorageException.class, () -> RecordCodec.decode(cut));
    }
}
