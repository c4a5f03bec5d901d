package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#LENGTH}. Only for layouts where the value count is derivable
 * without scanning the data.
 */
public interface SizedStream {

    /**
     * Number of values in the stream.
     */
    long length() throws IOException;
}
