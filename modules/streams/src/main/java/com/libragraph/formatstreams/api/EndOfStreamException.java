package com.libragraph.formatstreams.api;

import java.io.EOFException;

/**
 * Thrown by a read when the cursor is past the last value.
 */
public class EndOfStreamException extends EOFException {

    public EndOfStreamException(FormattedStream<?> stream) {
        super("End of stream reached: " + stream);
    }
}
