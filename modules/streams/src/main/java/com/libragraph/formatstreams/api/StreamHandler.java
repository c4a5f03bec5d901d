package com.libragraph.formatstreams.api;

/**
 * Identity token for one streaming backend.
 *
 * A handler can serve several formats; the registry keys on the handler itself, so
 * implementations must be immutable with stable {@code equals}/{@code hashCode}
 * (singletons or records). Handlers are ordered by {@link #name()}.
 */
public interface StreamHandler extends Comparable<StreamHandler> {

    /**
     * Stable name used in logs, error messages and configuration.
     */
    String name();

    @Override
    default int compareTo(StreamHandler other) {
        return name().compareTo(other.name());
    }

    /**
     * Creates a handler identified by name alone.
     * Two named handlers with the same name are equal.
     */
    static StreamHandler named(String name) {
        return new NamedStreamHandler(name);
    }

    /**
     * Handler identified by name; for integrators that need no dedicated type.
     */
    record NamedStreamHandler(String name) implements StreamHandler {
        public NamedStreamHandler {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Handler name must not be blank");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
