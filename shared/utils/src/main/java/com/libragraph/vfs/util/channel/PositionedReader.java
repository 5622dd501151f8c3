package com.libragraph.vfs.util.channel;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Random-access read primitive: every call names its own absolute offset,
 * so callers never share a cursor.
 *
 * Implementations must be safe to call from multiple threads.
 */
public interface PositionedReader {

    /**
     * Reads bytes into {@code dst} starting at the given absolute offset.
     *
     * @param dst    destination buffer, filled from its current position
     * @param offset absolute offset into the stream (non-negative)
     * @return number of bytes read, or -1 if {@code offset} is at or past the end
     * @throws IOException if positioning or reading fails
     */
    int readAt(ByteBuffer dst, long offset) throws IOException;

    /**
     * Total length of the stream in bytes.
     */
    long size() throws IOException;

    /**
     * Opens a read-only channel view over this reader with its own position.
     * Closing the view does not close the reader.
     */
    default SeekableByteChannel channel() {
        return new PositionedReadChannel(this);
    }
}
