package com.libragraph.formatstreams.api;

/**
 * Thrown when an optional operation is invoked on a stream that does not declare it.
 */
public class UnsupportedCapabilityException extends UnsupportedOperationException {

    private final Capability capability;
    private final Class<?> streamType;

    public UnsupportedCapabilityException(FormattedStream<?> stream, Capability capability) {
        super(stream.getClass().getName() + " does not support " + capability
                + " (supports " + stream.capabilities() + ")");
        this.capability = capability;
        this.streamType = stream.getClass();
    }

    public Capability capability() {
        return capability;
    }

    public Class<?> streamType() {
        return streamType;
    }
}
