package com.libragraph.formatstreams.types;

/**
 * Identifies a data format, e.g. {@code "application/x-fvec"} or {@code "text/plain"}.
 *
 * Used as a map key and in messages only; the value is never parsed.
 */
public record FormatId(String value) implements Comparable<FormatId> {

    public FormatId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Format id must not be blank");
        }
    }

    public static FormatId of(String value) {
        return new FormatId(value);
    }

    @Override
    public int compareTo(FormatId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
