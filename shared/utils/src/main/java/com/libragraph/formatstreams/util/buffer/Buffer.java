package com.libragraph.formatstreams.util.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 *
 * {@link #readFully(InputStream)} picks the backend (RAM or temp file) by size.
 */
public abstract class Buffer extends BinaryData {

    /** Size at which readFully() spills from RAM to a temp file. */
    public static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    private static final int CHUNK_SIZE = 8192;

    /**
     * Drains {@code in} into a new buffer positioned at 0.
     * Starts in RAM and spills to a temp file once {@link #FILE_THRESHOLD} is reached.
     * Does not close {@code in}.
     */
    public static Buffer readFully(InputStream in) throws IOException {
        return readFully(in, FILE_THRESHOLD);
    }

    /**
     * Drains {@code in} into a new buffer, spilling to a temp file at {@code fileThreshold} bytes.
     */
    public static Buffer readFully(InputStream in, long fileThreshold) throws IOException {
        Buffer buffer = new RamBuffer(CHUNK_SIZE);
        byte[] chunk = new byte[CHUNK_SIZE];
        int n;
        while ((n = in.read(chunk)) != -1) {
            if (buffer instanceof RamBuffer ram && ram.size() + n >= fileThreshold) {
                buffer = spill(ram);
            }
            buffer.write(ByteBuffer.wrap(chunk, 0, n));
        }
        buffer.position(0);
        return buffer;
    }

    private static Buffer spill(RamBuffer ram) throws IOException {
        FileBuffer file = new FileBuffer();
        try {
            ram.inputStream(0).transferTo(Channels.newOutputStream(file));
        } catch (IOException e) {
            file.close();
            throw e;
        }
        return file;
    }

    /**
     * Writes all of {@code src} starting at {@code pos}, growing the buffer as needed.
     */
    public void writeFully(long pos, ByteBuffer src) throws IOException {
        position(pos);
        while (src.hasRemaining()) {
            write(src);
        }
    }

    @Override
    public abstract Buffer truncate(long newSize) throws IOException;
}
