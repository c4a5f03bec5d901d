package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#READ}.
 */
public interface ValueReader<T> {

    /**
     * Decodes the next value and advances the cursor by one.
     *
     * @throws EndOfStreamException if the stream is at its end
     */
    T read() throws IOException;
}
