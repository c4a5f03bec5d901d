package com.libragraph.formatstreams.api;

/**
 * Thrown when a stream is opened for a value type its handler does not produce.
 */
public class StreamTypeMismatchException extends RuntimeException {

    private final Class<?> expected;
    private final Class<?> actual;

    public StreamTypeMismatchException(Class<?> expected, Class<?> actual) {
        super("Expected a stream of " + expected.getName() + " but handler produces " + actual.getName());
        this.expected = expected;
        this.actual = actual;
    }

    public Class<?> expected() {
        return expected;
    }

    public Class<?> actual() {
        return actual;
    }
}
