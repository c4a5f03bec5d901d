package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#SEEK_END}.
 */
public interface EndSeekableStream {

    /**
     * Moves the cursor past the last value, so that {@link FormattedStream#isEof()} holds.
     */
    void seekEnd() throws IOException;
}
