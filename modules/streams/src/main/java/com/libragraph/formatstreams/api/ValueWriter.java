package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#WRITE}.
 */
public interface ValueWriter<T> {

    /**
     * Writes {@code value} at the cursor, overwriting the value there or appending when
     * the cursor is at the end, and advances the cursor by one.
     */
    void write(T value) throws IOException;
}
