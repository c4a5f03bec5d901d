package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

/**
 * Thrown when the chosen handler defines no constructor for the format being opened.
 */
public class NoStreamConstructorException extends StreamRegistryException {

    private final FormatId format;
    private final StreamHandler handler;

    public NoStreamConstructorException(StreamHandler handler, FormatId format) {
        super("Streamer " + handler.name() + " defines no stream constructor for " + format);
        this.format = format;
        this.handler = handler;
    }

    public FormatId format() {
        return format;
    }

    public StreamHandler handler() {
        return handler;
    }
}
