package com.libragraph.formatstreams.handlers;

import com.libragraph.formatstreams.api.AbstractFormattedStream;
import com.libragraph.formatstreams.api.BufferedValueReader;
import com.libragraph.formatstreams.api.EndSeekableStream;
import com.libragraph.formatstreams.api.SeekableStream;
import com.libragraph.formatstreams.api.SizedStream;
import com.libragraph.formatstreams.api.TruncatableStream;
import com.libragraph.formatstreams.api.ValueReader;
import com.libragraph.formatstreams.api.ValueWriter;
import com.libragraph.formatstreams.types.FormatId;
import com.libragraph.formatstreams.util.buffer.Buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.OptionalInt;

/**
 * Random-access stream over uniform fvec records held in a {@link Buffer}.
 *
 * Supports every capability. Writes and truncation change the buffer only; use
 * {@link #transferTo(OutputStream)} to persist the result.
 */
public class FvecStream extends AbstractFormattedStream<float[]>
        implements ValueReader<float[]>, BufferedValueReader<float[]>, SeekableStream, EndSeekableStream,
        SizedStream, ValueWriter<float[]>, TruncatableStream {

    private static final int DIMENSION_BYTES = Integer.BYTES;

    private final Buffer buffer;
    private int dimension;  // -1 until known
    private long index;

    FvecStream(FormatId format, Buffer buffer, Integer expectedDimension) throws IOException {
        super(format, float[].class);
        this.buffer = buffer;
        this.dimension = validateLayout(expectedDimension);
    }

    /**
     * Component count of every vector, empty while the stream holds no data and no
     * dimension was given.
     */
    public OptionalInt dimension() {
        return dimension < 0 ? OptionalInt.empty() : OptionalInt.of(dimension);
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return index;
    }

    @Override
    public boolean isEof() throws IOException {
        ensureOpen();
        return index >= length();
    }

    @Override
    public void rewind() throws IOException {
        ensureOpen();
        index = 0;
    }

    @Override
    public float[] read() throws IOException {
        ensureOpen();
        ensureNotEof();
        return readInto(new float[dimension]);
    }

    @Override
    public float[] readInto(float[] output) throws IOException {
        ensureOpen();
        ensureNotEof();
        checkDimension(output);

        ByteBuffer record = newRecord();
        buffer.readFully(index * recordSize(), record);
        record.flip();
        int stored = record.getInt();
        if (stored != dimension) {
            throw new IOException("Record " + index + " has dimension " + stored + ", expected " + dimension);
        }
        record.asFloatBuffer().get(output);
        index++;
        return output;
    }

    @Override
    public void seek(long target) throws IOException {
        ensureOpen();
        long length = length();
        if (target < 0 || target > length) {
            throw new IllegalArgumentException("Seek index " + target + " outside [0, " + length + "]");
        }
        index = target;
    }

    @Override
    public void seekEnd() throws IOException {
        ensureOpen();
        index = length();
    }

    @Override
    public long length() throws IOException {
        ensureOpen();
        return dimension < 0 ? 0 : buffer.size() / recordSize();
    }

    @Override
    public void write(float[] value) throws IOException {
        ensureOpen();
        if (dimension < 0) {
            if (value.length == 0) {
                throw new IllegalArgumentException("Cannot write a zero-length vector");
            }
            dimension = value.length;
        }
        checkDimension(value);

        ByteBuffer record = newRecord();
        record.putInt(dimension);
        record.asFloatBuffer().put(value);
        record.position(record.limit());
        record.flip();
        buffer.writeFully(index * recordSize(), record);
        index++;
    }

    @Override
    public void truncate(long length) throws IOException {
        ensureOpen();
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        if (length < length()) {
            buffer.truncate(length * recordSize());
        }
        if (index > length) {
            index = length;
        }
    }

    /**
     * Copies the encoded records to {@code out}.
     *
     * @return number of bytes written
     */
    public long transferTo(OutputStream out) throws IOException {
        ensureOpen();
        return buffer.inputStream(0).transferTo(out);
    }

    @Override
    protected void doClose() throws IOException {
        buffer.close();
    }

    private int validateLayout(Integer expectedDimension) throws IOException {
        if (expectedDimension != null && expectedDimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + expectedDimension);
        }
        long size = buffer.size();
        if (size == 0) {
            return expectedDimension == null ? -1 : expectedDimension;
        }
        if (size < DIMENSION_BYTES) {
            throw new IOException("fvec data too short for a dimension header: " + size + " bytes");
        }

        int first = readDimension(0);
        if (first <= 0) {
            throw new IOException("Invalid fvec dimension: " + first);
        }
        if (expectedDimension != null && expectedDimension != first) {
            throw new IOException("Expected dimension " + expectedDimension + " but data has " + first);
        }
        long recordSize = recordSize(first);
        if (size % recordSize != 0) {
            throw new IOException("fvec data size " + size + " is not a multiple of record size " + recordSize);
        }
        for (long offset = recordSize; offset < size; offset += recordSize) {
            int dim = readDimension(offset);
            if (dim != first) {
                throw new IOException("Non-uniform fvec data: record " + (offset / recordSize)
                        + " has dimension " + dim + ", expected " + first);
            }
        }
        return first;
    }

    private int readDimension(long offset) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(DIMENSION_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.readFully(offset, header);
        header.flip();
        return header.getInt();
    }

    private void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                    "Vector has " + vector.length + " components, stream dimension is " + dimension);
        }
    }

    private ByteBuffer newRecord() {
        return ByteBuffer.allocate((int) recordSize()).order(ByteOrder.LITTLE_ENDIAN);
    }

    private long recordSize() {
        return recordSize(dimension);
    }

    private static long recordSize(int dimension) {
        return DIMENSION_BYTES + (long) Float.BYTES * dimension;
    }
}
