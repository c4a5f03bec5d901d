package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;

/**
 * Thrown when a handler is marked globally preferred twice.
 */
public class AlreadyGlobalFavoriteException extends StreamRegistryException {

    private final StreamHandler handler;

    public AlreadyGlobalFavoriteException(StreamHandler handler) {
        super("Streamer " + handler.name() + " is already globally preferred");
        this.handler = handler;
    }

    public StreamHandler handler() {
        return handler;
    }
}
