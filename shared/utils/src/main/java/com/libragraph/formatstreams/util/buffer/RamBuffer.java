package com.libragraph.formatstreams.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Buffer implementation using in-memory byte array.
 * Suitable for small data (< 4MB).
 *
 * Supports simultaneous read/write operations with automatic growth.
 */
public class RamBuffer extends Buffer {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity) {
        this.data = new byte[Math.max(initialCapacity, 16)];
        this.position = 0;
        this.size = 0;
    }

    /**
     * Creates buffer over existing data. The array is used directly, not copied.
     */
    public RamBuffer(byte[] data) {
        this.data = data;
        this.position = 0;
        this.size = data.length;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= size) {
            return -1;  // EOF
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int toWrite = src.remaining();
        long endPosition = position + toWrite;

        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, (int) position, toWrite);
        position += toWrite;

        if (position > size) {
            size = position;
        }

        return toWrite;
    }

    @Override
    public RamBuffer truncate(long newSize) throws IOException {
        if (newSize < 0) {
            throw new IllegalArgumentException("Negative size: " + newSize);
        }
        if (newSize < size) {
            size = newSize;
            if (position > size) {
                position = size;
            }
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public RamBuffer position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() throws IOException {
        // No resources to close for RAM buffer
    }

    /**
     * Grows the internal array to accommodate the requested size.
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        if (minCapacity > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("RamBuffer cannot hold " + minCapacity + " bytes");
        }
        long newCapacity = Math.min(
                Math.max(data.length * 2L, minCapacity),
                Integer.MAX_VALUE - 8
        );
        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
