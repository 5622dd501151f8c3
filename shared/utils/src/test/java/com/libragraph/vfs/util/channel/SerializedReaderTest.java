package com.libragraph.vfs.util.channel;

import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SerializedReaderTest {

    @Test
    void shouldReadAtAbsoluteOffset() throws Exception {
        SerializedReader reader = SerializedReader.wrap(channelOf("0123456789"));

        ByteBuffer dst = ByteBuffer.allocate(3);
        assertThat(reader.readAt(dst, 4)).isEqualTo(3);
        assertThat(new String(dst.array())).isEqualTo("456");
        assertThat(reader.size()).isEqualTo(10);
    }

    @Test
    void shouldReturnEofPastEnd() throws Exception {
        SerializedReader reader = SerializedReader.wrap(channelOf("abc"));

        assertThat(reader.readAt(ByteBuffer.allocate(4), 3)).isEqualTo(-1);
    }

    @Test
    void shouldRejectNegativeOffset() {
        SerializedReader reader = SerializedReader.wrap(channelOf("abc"));

        assertThatThrownBy(() -> reader.readAt(ByteBuffer.allocate(1), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPropagateSeekFailureAndStayUsable() throws Exception {
        FailingChannel channel = new FailingChannel(channelOf("abcdef"));
        SerializedReader reader = SerializedReader.wrap(channel);

        channel.failNextSeek = true;
        assertThatThrownBy(() -> reader.readAt(ByteBuffer.allocate(2), 0))
                .isInstanceOf(IOException.class)
                .hasMessage("seek failed");

        // the lock must have been released by the failed call
        ByteBuffer dst = ByteBuffer.allocate(2);
        assertThat(reader.readAt(dst, 2)).isEqualTo(2);
        assertThat(new String(dst.array())).isEqualTo("cd");
    }

    @Test
    void shouldPropagateReadFailure() {
        FailingChannel channel = new FailingChannel(channelOf("abcdef"));
        SerializedReader reader = SerializedReader.wrap(channel);

        channel.failNextRead = true;
        assertThatThrownBy(() -> reader.readAt(ByteBuffer.allocate(2), 0))
                .isInstanceOf(IOException.class)
                .hasMessage("read failed");
    }

    @Test
    void concurrentReadsShouldNeverInterleave() throws Exception {
        byte[] data = new byte[64 * 1024];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31 + 7);
        }
        OverlapDetectingChannel channel = new OverlapDetectingChannel(new SeekableInMemoryByteChannel(data));
        SerializedReader reader = SerializedReader.wrap(channel);

        int threads = 8;
        int readsPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int seed = t;
                results.add(pool.submit(() -> {
                    start.await();
                    for (int r = 0; r < readsPerThread; r++) {
                        int offset = (seed * 7919 + r * 104729) % (data.length - 512);
                        int length = 1 + (r % 512);
                        ByteBuffer dst = ByteBuffer.allocate(length);
                        int n = reader.readAt(dst, offset);
                        if (n != length) return false;
                        for (int i = 0; i < length; i++) {
                            if (dst.get(i) != data[offset + i]) return false;
                        }
                    }
                    return true;
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(channel.overlaps.get()).isZero();
    }

    @Test
    void closeShouldCloseUnderlyingChannel() throws Exception {
        SeekableInMemoryByteChannel channel = channelOf("abc");
        SerializedReader reader = SerializedReader.wrap(channel);

        reader.close();

        assertThat(channel.isOpen()).isFalse();
        assertThat(reader.isOpen()).isFalse();
    }

    // --- helpers ---

    private static SeekableInMemoryByteChannel channelOf(String content) {
        return new SeekableInMemoryByteChannel(content.getBytes());
    }

    /** Counts calls that start while another seek+read pair is still in flight. */
    private static final class OverlapDetectingChannel extends DelegatingChannel {
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger overlaps = new AtomicInteger();

        OverlapDetectingChannel(SeekableByteChannel delegate) {
            super(delegate);
        }

        @Override
        public SeekableByteChannel position(long newPosition) throws IOException {
            if (inFlight.incrementAndGet() > 1) {
                overlaps.incrementAndGet();
            }
            Thread.yield();
            return super.position(newPosition);
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            try {
                Thread.yield();
                return super.read(dst);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    private static final class FailingChannel extends DelegatingChannel {
        boolean failNextSeek;
        boolean failNextRead;

        FailingChannel(SeekableByteChannel delegate) {
            super(delegate);
        }

        @Override
        public SeekableByteChannel position(long newPosition) throws IOException {
            if (failNextSeek) {
                failNextSeek = false;
                throw new IOException("seek failed");
            }
            return super.position(newPosition);
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            if (failNextRead) {
                failNextRead = false;
                throw new IOException("read failed");
            }
            return super.read(dst);
        }
    }
}
