package com.libragraph.formatstreams.types;

/**
 * Identifies a transfer coding layered on top of a format, e.g. {@code "application/gzip"}.
 */
public record CodingId(String value) implements Comparable<CodingId> {

    public CodingId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Coding id must not be blank");
        }
    }

    public static CodingId of(String value) {
        return new CodingId(value);
    }

    @Override
    public int compareTo(CodingId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
