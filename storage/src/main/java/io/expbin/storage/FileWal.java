// file: src/main/java/io/expbin/storage/FileWal.java
package io.expbin.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - truncates a torn tail left by a crash, so new appends follow the last
 *        valid record instead of garbage,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment,
 *      - on failure, truncates the segment back to the last acknowledged record
 *        so later appends never land behind a partial or unacknowledged one.
 * <p>
 *  - rotateIfNeeded() / rotate():
 *      - closes the current segment and opens a new one with incremented index.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes), validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - on a truncated or corrupt record, skips the rest of that segment.
 * <p>
 * All mutating methods are synchronized: the store appends from many threads.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private final SegmentOpener opener;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    /** Opens a segment channel for read and write. */
    @FunctionalInterface
    interface SegmentOpener {
        FileChannel open(Path segment) throws IOException;
    }

    public FileWal(Path dir, long rotateBytes) {
        this(dir, rotateBytes, segment -> FileChannel.open(segment, CREATE, WRITE, READ));
    }

    FileWal(Path dir, long rotateBytes, SegmentOpener opener) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        this.opener = opener;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            StorageException failure = new StorageException("WAL append failed on " + current, e);
            try {
                ch.truncate(writtenInSegment);
                ch.position(writtenInSegment);
                ch.force(true);
            } catch (IOException rollback) {
                failure.addSuppressed(rollback);
            }
            throw failure;
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized void rotate() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = opener.open(current);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed in " + dir, e);
        }
    }

    @Override
    public synchronized String currentSegment() {
        return current.getFileName().toString();
    }

    @Override
    public synchronized void deleteSegmentsBefore(String segment) {
        for (Path p : listSegments(dir)) {
            if (p.getFileName().toString().compareTo(segment) < 0) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new StorageException("Cannot delete WAL segment " + p, e);
                }
            }
        }
    }

    @Override
    public WalReader openReader() { return new Reader(listSegments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, cut any torn tail
     *    and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> segments = listSegments(dir);
        current = segments.isEmpty() ? dir.resolve(segmentName(1)) : segments.get(segments.size() - 1);
        try {
            ch = opener.open(current);
            long valid = validPrefixLength(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "Truncating torn WAL tail of {0}: {1} -> {2} bytes",
                        new Object[]{current.getFileName(), ch.size(), valid});
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StorageException("Cannot open WAL segment " + current, e);
        }
    }

    /** Byte length of the longest prefix made of complete, CRC-valid records. */
    private static long validPrefixLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecordAt(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record starting at 'pos', or null if absent/truncated/corrupt. */
    private static byte[] readRecordAt(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
        return bytes;
    }

    private static List<Path> listSegments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new StorageException("Cannot list WAL segments in " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /**
     * Sequential reader over every segment, oldest first.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        return null;
                    }
                    byte[] payload = readRecordAt(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        log.log(Level.WARNING, "Skipping corrupt tail of WAL segment {0} at offset {1}",
                                new Object[]{segments.get(segIdx).getFileName(), pos});
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            if (segIdx + 1 >= segments.size()) return false;
            segIdx++;
            ch = FileChannel.open(segments.get(segIdx), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
