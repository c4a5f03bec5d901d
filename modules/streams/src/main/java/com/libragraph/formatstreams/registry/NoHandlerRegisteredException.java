package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.types.FormatId;

/**
 * Thrown when no handler is registered for a format.
 */
public class NoHandlerRegisteredException extends StreamRegistryException {

    private final FormatId format;

    public NoHandlerRegisteredException(FormatId format) {
        super("No streamer registered for " + format);
        this.format = format;
    }

    public FormatId format() {
        return format;
    }
}
