package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#TRUNCATE}.
 */
public interface TruncatableStream {

    /**
     * Drops every value at index {@code length} and beyond.
     * A cursor past the new end moves to the new end.
     */
    void truncate(long length) throws IOException;
}
