package com.libragraph.vfs.util.channel;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * {@link PositionedReader} over a single {@link SeekableByteChannel} that was
 * not built for concurrent positioned access.
 *
 * <p>Each {@link #readAt} performs exactly one {@code position(offset)} and one
 * {@code read(dst)} while holding the reader's monitor, so no two seek+read pairs
 * ever overlap on the underlying channel. Failures from either step propagate
 * unchanged; nothing is retried or cached.
 *
 * <p>The reader owns the channel: {@link #close()} closes it.
 */
public final class SerializedReader implements PositionedReader, Closeable {

    private final SeekableByteChannel channel;
    private final Object lock = new Object();

    private SerializedReader(SeekableByteChannel channel) {
        this.channel = channel;
    }

    public static SerializedReader wrap(SeekableByteChannel channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        return new SerializedReader(channel);
    }

    @Override
    public int readAt(ByteBuffer dst, long offset) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset: " + offset);
        }
        synchronized (lock) {
            channel.position(offset);
            return channel.read(dst);
        }
    }

    @Override
    public long size() throws IOException {
        synchronized (lock) {
            return channel.size();
        }
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
