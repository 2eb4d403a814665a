package io.expbin.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * FileChannel wrapper that can be told to fail the next write halfway
 * through, or the next force().
 */
final class FaultyChannel extends FileChannel {
    private final FileChannel delegate;
    private int partialWriteBytes = -1;
    private boolean failNextForce;

    FaultyChannel(FileChannel delegate) {
        this.delegate = delegate;
    }

    /** Next write() stores only 'bytes' bytes and then throws. */
    void failNextWriteAfter(int bytes) {
        this.partialWriteBytes = bytes;
    }

    void failNextForce() {
        this.failNextForce = true;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        if (partialWriteBytes < 0) {
            return delegate.write(src);
        }
        int n = Math.min(partialWriteBytes, src.remaining());
        partialWriteBytes = -1;
        ByteBuffer head = src.duplicate();
        head.limit(head.position() + n);
        while (head.hasRemaining()) {
            delegate.write(head);
        }
        src.position(src.position() + n);
        throw new IOException("disk full");
    }

    @Override
    public void force(boolean metaData) throws IOException {
        if (failNextForce) {
            failNextForce = false;
            throw new IOException("fsync failed");
        }
        delegate.force(metaData);
    }

    @Override
    public int read(ByteBuffer dst) throws IOException { return delegate.read(dst); }

    @Override
    public long read(ByteBuffer[] dsts, int offset, int length) throws IOException {
        return delegate.read(dsts, offset, length);
    }

    @Override
    public long write(ByteBuffer[] srcs, int offset, int length) throws IOException {
        return delegate.write(srcs, offset, length);
    }

    @Override
    public long position() throws IOException { return delegate.position(); }

    @Override
    public FileChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        return this;
    }

    @Override
    public long size() throws IOException { return delegate.size(); }

    @Override
    public FileChannel truncate(long size) throws IOException {
        delegate.truncate(size);
        return this;
    }

    @Override
    public long transferTo(long position, long count, WritableByteChannel target) throws IOException {
        return delegate.transferTo(position, count, target);
    }

    @Override
    public long transferFrom(ReadableByteChannel src, long position, long count) throws IOException {
        return delegate.transferFrom(src, position, count);
    }

    @Override
    public int read(ByteBuffer dst, long position) throws IOException { return delegate.read(dst, position); }

    @Override
    public int write(ByteBuffer src, long position) throws IOException { return delegate.write(src, position); }

    @Override
    public MappedByteBuffer map(MapMode mode, long position, long size) throws IOException {
        return delegate.map(mode, position, size);
    }

    @Override
    public FileLock lock(long position, long size, boolean shared) throws IOException {
        return delegate.lock(position, size, shared);
    }

    @Override
    public FileLock tryLock(long position, long size, boolean shared) throws IOException {
        return delegate.tryLock(position, size, shared);
    }

    @Override
    protected void implCloseChannel() throws IOException {
        delegate.close();
    }
}
