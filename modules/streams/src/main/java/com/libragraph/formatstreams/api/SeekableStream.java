package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#SEEK}.
 */
public interface SeekableStream {

    /**
     * Moves the cursor to the value at {@code index} (0-based).
     * Seeking to the end position is allowed; seeking beyond it is not.
     */
    void seek(long index) throws IOException;
}
