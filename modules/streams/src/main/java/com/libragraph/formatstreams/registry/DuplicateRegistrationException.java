package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

/**
 * Thrown when a handler is registered twice for the same format.
 */
public class DuplicateRegistrationException extends StreamRegistryException {

    private final FormatId format;
    private final StreamHandler handler;

    public DuplicateRegistrationException(FormatId format, StreamHandler handler) {
        super("Streamer " + handler.name() + " already registered for " + format);
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
