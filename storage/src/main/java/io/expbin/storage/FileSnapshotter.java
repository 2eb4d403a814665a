// file: src/main/java/io/expbin/storage/FileSnapshotter.java
package io.expbin.storage;

import io.expbin.core.BinValue;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 count
 *   repeated 'count' times:
 *     - namespace, set, userKey: int32 len + UTF-8 bytes each
 *     - generation: int32
 *     - voidTime:   int64
 *     - binCount:   int32
 *         repeated binCount times:
 *           - name:  int32 len + UTF-8 bytes
 *           - value: see {@link BinValueCodec}
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshot files.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public synchronized String writeSnapshot(Map<RecordKey, StoredRecord> current) {
        List<Path> existing = listSnapshots();
        long seq = existing.isEmpty() ? 1 : sequenceOf(existing.get(existing.size() - 1)) + 1;
        String name = String.format("%s%012d%s", PREFIX, seq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeInt(current.size());
            for (Map.Entry<RecordKey, StoredRecord> e : current.entrySet()) {
                StoredRecord rec = e.getValue();
                RecordCodec.writeKey(out, e.getKey());
                out.writeInt(rec.generation());
                out.writeLong(rec.voidTime());
                out.writeInt(rec.bins().size());
                for (Map.Entry<String, BinValue> bin : rec.bins().entrySet()) {
                    BinValueCodec.writeString(out, bin.getKey());
                    BinValueCodec.write(out, bin.getValue());
                }
            }
        } catch (IOException ex) {
            throw new StorageException("Snapshot write failed: " + tmp, ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : existing) {
                Files.deleteIfExists(old);
            }
        } catch (IOException e) {
            throw new StorageException("Snapshot publish failed: " + dst, e);
        }

        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = listSnapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            int count = in.readInt();
            Map<RecordKey, StoredRecord> map = new HashMap<>(Math.max(16, count * 2));
            for (int i = 0; i < count; i++) {
                RecordKey key = RecordCodec.readKey(in);
                int generation = in.readInt();
                long voidTime = in.readLong();
                int binCount = in.readInt();
                Map<String, BinValue> bins = new LinkedHashMap<>(Math.max(4, binCount * 2));
                for (int b = 0; b < binCount; b++) {
                    String name = BinValueCodec.readString(in);
                    bins.put(name, BinValueCodec.read(in));
                }
                map.put(key, new StoredRecord(bins, generation, voidTime));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), map);
        } catch (IOException e) {
            throw new StorageException("Snapshot load failed: " + snap, e);
        }
    }

    private List<Path> listSnapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Cannot list snapshots in " + dir, e);
        }
    }

    private static long sequenceOf(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }
}
