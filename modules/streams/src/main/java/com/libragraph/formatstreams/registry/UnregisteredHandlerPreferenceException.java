package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

/**
 * Thrown when a handler is preferred for a format it is not registered for.
 */
public class UnregisteredHandlerPreferenceException extends StreamRegistryException {

    private final FormatId format;
    private final StreamHandler handler;

    public UnregisteredHandlerPreferenceException(FormatId format, StreamHandler handler) {
        super("Streamer " + handler.name() + " is not registered for " + format);
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
