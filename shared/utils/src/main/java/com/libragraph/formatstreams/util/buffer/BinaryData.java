package com.libragraph.formatstreams.util.buffer;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Binary data backed by RAM or a disk file.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides convenience methods for stream-based access and positioned reads.
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Total size in bytes.
     */
    @Override
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * The stream shares this channel's position; reading from it advances the channel.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Fills {@code dst} completely with the bytes starting at {@code pos}.
     * Leaves the channel positioned right after the bytes read.
     *
     * @throws EOFException if fewer than {@code dst.remaining()} bytes exist at {@code pos}
     */
    public void readFully(long pos, ByteBuffer dst) throws IOException {
        position(pos);
        while (dst.hasRemaining()) {
            if (read(dst) == -1) {
                throw new EOFException("Unexpected end of data at position " + position()
                        + ", " + dst.remaining() + " bytes missing");
            }
        }
    }
}
