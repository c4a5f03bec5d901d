package com.libragraph.formatstreams.api;

import com.libragraph.formatstreams.types.FormatId;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;

/**
 * Base class for concrete streams: holds format and value type, makes {@link #close()}
 * idempotent and guards operations on a closed stream.
 */
public abstract class AbstractFormattedStream<T> implements FormattedStream<T> {

    private final FormatId format;
    private final Class<T> valueType;
    private boolean closed;

    protected AbstractFormattedStream(FormatId format, Class<T> valueType) {
        this.format = Objects.requireNonNull(format, "format");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public FormatId format() {
        return format;
    }

    @Override
    public Class<T> valueType() {
        return valueType;
    }

    public final boolean isClosed() {
        return closed;
    }

    @Override
    public final void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        doClose();
    }

    /**
     * Releases resources. Runs at most once.
     */
    protected abstract void doClose() throws IOException;

    /**
     * @throws ClosedChannelException if {@link #close()} was called
     */
    protected final void ensureOpen() throws IOException {
        if (closed) {
            throw new ClosedChannelException();
        }
    }

    /**
     * @throws EndOfStreamException if the cursor is at the end
     */
    protected final void ensureNotEof() throws IOException {
        if (isEof()) {
            throw new EndOfStreamException(this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + format + "]";
    }
}
