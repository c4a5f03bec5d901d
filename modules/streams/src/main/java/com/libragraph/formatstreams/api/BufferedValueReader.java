package com.libragraph.formatstreams.api;

import java.io.IOException;

/**
 * Declares {@link Capability#READ_INTO}: decoding into a reusable value.
 */
public interface BufferedValueReader<T> {

    /**
     * Decodes the next value into {@code output} and advances the cursor by one.
     *
     * @param output mutable value to populate; its previous contents are overwritten
     * @return {@code output} itself
     * @throws EndOfStreamException if the stream is at its end
     */
    T readInto(T output) throws IOException;
}
