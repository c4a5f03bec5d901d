package com.libragraph.formatstreams.registry;

/**
 * Base type of every registry contract violation.
 */
public abstract class StreamRegistryException extends RuntimeException {

    protected StreamRegistryException(String message) {
        super(message);
    }
}
