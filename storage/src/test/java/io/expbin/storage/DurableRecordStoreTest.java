package io.expbin.storage;

import io.expbin.core.BinValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior of the record store as seen by the expiration layer:
 * atomic read-modify-write, generation bookkeeping, whole-record expiry and scans.
 */
class DurableRecordStoreTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
    private DurableRecordStore store;

    private static final RecordSet USERS = new RecordSet("test", "users");

    @BeforeEach
    void open() {
        store = new DurableRecordStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), clock);
    }

    @Test
    void read_modify_write_creates_record_and_bumps_generation() {
        var key = USERS.key("u1");

        String r = store.readModifyWrite(key, cur -> {
            assertFalse(cur.exists());
            return RecordUpdate.write(Map.of("a", BinValue.of(1L)), "created");
        });

        assertEquals("created", r);
        assertEquals(1, store.get(key).generation());

        store.readModifyWrite(key, cur -> {
            var bins = new HashMap<>(cur.bins());
            bins.put("b", BinValue.of(2L));
            return RecordUpdate.write(bins, null);
        });
        assertEquals(2, store.get(key).generation());
        assertEquals(BinValue.of(2L), store.get(key).bin("b"));
    }

    @Test
    void unchanged_update_does_not_touch_generation() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 0);

        Integer seen = store.readModifyWrite(key, cur -> RecordUpdate.unchanged(cur.generation()));

        assertEquals(1, seen);
        assertEquals(1, store.get(key).generation());
    }

    @Test
    void writing_empty_bins_deletes_the_record() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 0);

        store.readModifyWrite(key, cur -> RecordUpdate.write(Map.of(), null));

        assertNull(store.get(key));
        assertFalse(store.delete(key));
    }

    @Test
    void mutation_failure_commits_nothing() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 0);

        assertThrows(IllegalStateException.class, () -> store.readModifyWrite(key, cur -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, store.get(key).generation());
        assertEquals(BinValue.of("x"), store.get(key).bin("a"));
    }

    @Test
    void put_merges_bins_into_existing_record() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 0);
        store.put(key, Map.of("b", BinValue.of("y")), 0);

        assertEquals(Map.of("a", BinValue.of("x"), "b", BinValue.of("y")), store.get(key).bins());
    }

    @Test
    void record_ttl_makes_record_invisible_once_void_time_passes() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 10);
        assertNotNull(store.get(key));

        clock.advance(Duration.ofSeconds(10));

        assertNull(store.get(key));
        Boolean sawRecord = store.readModifyWrite(key, cur -> RecordUpdate.unchanged(cur.exists()));
        assertFalse(sawRecord);
    }

    @Test
    void record_ttl_minus_one_clears_void_time_and_zero_keeps_it() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 10);
        long voidTime = store.get(key).voidTime();

        store.put(key, Map.of("b", BinValue.of("y")), 0);
        assertEquals(voidTime, store.get(key).voidTime());

        store.put(key, Map.of("c", BinValue.of("z")), -1);
        assertEquals(0L, store.get(key).voidTime());
        assertThrows(IllegalArgumentException.class, () -> store.put(key, Map.of(), -2));
    }

    @Test
    void read_modify_write_keeps_record_void_time() {
        var key = USERS.key("u1");
        store.put(key, Map.of("a", BinValue.of("x")), 100);
        long voidTime = store.get(key).voidTime();

        store.readModifyWrite(key, cur -> RecordUpdate.write(Map.of("a", BinValue.of("y")), null));

        assertEquals(voidTime, store.get(key).voidTime());
    }

    @Test
    void scan_visits_only_the_requested_set_and_can_stop_early() {
        store.put(USERS.key("a"), Map.of("v", BinValue.of(1L)), 0);
        store.put(USERS.key("b"), Map.of("v", BinValue.of(2L)), 0);
        store.put(USERS.key("c"), Map.of("v", BinValue.of(3L)), 0);
        store.put(new RecordKey("test", "orders", "a"), Map.of("v", BinValue.of(9L)), 0);

        List<String> seen = new ArrayList<>();
        store.scan(USERS, (k, rec) -> {
            seen.add(k.userKey());
            return true;
        });
        assertEquals(List.of("a", "b", "c"), seen);

        List<String> firstTwo = new ArrayList<>();
        store.scan(USERS, (k, rec) -> {
            firstTwo.add(k.userKey());
            return firstTwo.size() < 2;
        });
        assertEquals(List.of("a", "b"), firstTwo);
    }

    @Test
    void concurrent_increments_on_one_key_are_not_lost() throws Exception {
        var key = USERS.key("counter");
        store.put(key, Map.of("n", BinValue.of(0L)), 0);

        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.readModifyWrite(key, cur -> {
                        long n = ((BinValue.LongValue) cur.bin("n")).value();
                        return RecordUpdate.write(Map.of("n", BinValue.of(n + 1)), null);
                    });
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(BinValue.of((long) threads * perThread), store.get(key).bin("n"));
        assertEquals(1 + threads * perThread, store.get(key).generation());
    }
}
