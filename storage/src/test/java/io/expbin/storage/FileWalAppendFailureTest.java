package io.expbin.storage;

import io.expbin.core.BinValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.junit.jupiter.api.Assertions.*;

class FileWalAppendFailureTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
    private final AtomicReference<FaultyChannel> channel = new AtomicReference<>();

    private FileWal faultyWal() {
        return new FileWal(walDir, 1L << 60, segment -> {
            FaultyChannel c = new FaultyChannel(FileChannel.open(segment, CREATE, WRITE, READ));
            channel.set(c);
            return c;
        });
    }

    private static byte[] rec(String userKey, String v) {
        return RecordCodec.encode(new RecordKey("test", "s", userKey),
                new StoredRecord(Map.of("v", BinValue.of(v)), 1, 0L));
    }

    private DurableRecordStore reopen() {
        return new DurableRecordStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), clock);
    }

    @Test
    void appends_after_a_partial_write_survive_restart() {
        var wal = faultyWal();
        wal.append(rec("k1", "v1"));
        channel.get().failNextWriteAfter(5);
        assertThrows(StorageException.class, () -> wal.append(rec("k2", "v2")));
        wal.append(rec("k3", "v3"));
        wal.close();

        var store = reopen();
        assertEquals(BinValue.of("v1"), store.get(new RecordKey("test", "s", "k1")).bin("v"));
        assertNull(store.get(new RecordKey("test", "s", "k2")));
        assertEquals(BinValue.of("v3"), store.get(new RecordKey("test", "s", "k3")).bin("v"));
    }

    @Test
    void record_whose_fsync_failed_is_not_recovered() {
        var wal = faultyWal();
        wal.append(rec("k1", "v1"));
        channel.get().failNextForce();
        assertThrows(StorageException.class, () -> wal.append(rec("k2", "v2")));
        wal.close();

        var store = reopen();
        assertEquals(BinValue.of("v1"), store.get(new RecordKey("test", "s", "k1")).bin("v"));
        assertNull(store.get(new RecordKey("test", "s", "k2")));
    }

    @Test
    void failed_store_write_is_neither_visible_nor_recovered() {
        var wal = faultyWal();
        var store = new DurableRecordStore(wal, new FileSnapshotter(snapDir), clock);
        var key = new RecordKey("test", "s", "k1");
        store.put(key, Map.of("v", BinValue.of("v1")), 0);

        channel.get().failNextWriteAfter(3);
        assertThrows(StorageException.class, () -> store.put(key, Map.of("v", BinValue.of("v2")), 0));
        assertEquals(BinValue.of("v1"), store.get(key).bin("v"));

        store.put(key, Map.of("v", BinValue.of("v3")), 0);
        store.close();

        assertEquals(BinValue.of("v3"), reopen().get(key).bin("v"));
    }
}
