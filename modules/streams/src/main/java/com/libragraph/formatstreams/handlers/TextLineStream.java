package com.libragraph.formatstreams.handlers;

import com.libragraph.formatstreams.api.AbstractFormattedStream;
import com.libragraph.formatstreams.api.SeekableStream;
import com.libragraph.formatstreams.api.ValueReader;
import com.libragraph.formatstreams.types.FormatId;
import com.libragraph.formatstreams.util.buffer.Buffer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;

/**
 * Stream of the lines of a text, without line terminators.
 *
 * The line count is not known without scanning, so this stream has no length; seeking
 * re-reads from the start when moving backwards.
 */
public class TextLineStream extends AbstractFormattedStream<String> implements ValueReader<String>, SeekableStream {

    private final Buffer buffer;
    private final Charset charset;

    private BufferedReader reader;
    private String pending;
    private boolean pendingLoaded;
    private long index;

    TextLineStream(FormatId format, Buffer buffer, Charset charset) {
        super(format, String.class);
        this.buffer = buffer;
        this.charset = charset;
        this.reader = newReader();
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return index;
    }

    @Override
    public boolean isEof() throws IOException {
        ensureOpen();
        fill();
        return pending == null;
    }

    @Override
    public void rewind() throws IOException {
        ensureOpen();
        // Not closed: closing the reader would close the buffer.
        reader = newReader();
        pending = null;
        pendingLoaded = false;
        index = 0;
    }

    @Override
    public String read() throws IOException {
        ensureOpen();
        ensureNotEof();
        String line = pending;
        pending = null;
        pendingLoaded = false;
        index++;
        return line;
    }

    @Override
    public void seek(long target) throws IOException {
        ensureOpen();
        if (target < 0) {
            throw new IllegalArgumentException("Negative seek index: " + target);
        }
        long previous = index;
        if (target < index) {
            rewind();
        }
        while (index < target) {
            if (isEof()) {
                long lineCount = index;
                seek(previous);
                throw new IllegalArgumentException("Seek index " + target + " beyond last line " + lineCount);
            }
            read();
        }
    }

    @Override
    protected void doClose() throws IOException {
        buffer.close();
    }

    private void fill() throws IOException {
        if (!pendingLoaded) {
            pending = reader.readLine();
            pendingLoaded = true;
        }
    }

    private BufferedReader newReader() {
        return new BufferedReader(new InputStreamReader(buffer.inputStream(0), charset));
    }
}
