package com.libragraph.formatstreams.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optional operations a {@link FormattedStream} may support.
 *
 * Each capability is declared by implementing its marker interface, so the capability
 * set of a stream type is fixed at compile time.
 */
public enum Capability {
    /** Sequential {@link ValueReader#read()}. */
    READ(ValueReader.class),
    /** {@link BufferedValueReader#readInto(Object)} into a caller-supplied value. */
    READ_INTO(BufferedValueReader.class),
    /** {@link SeekableStream#seek(long)} to a value index. */
    SEEK(SeekableStream.class),
    /** {@link EndSeekableStream#seekEnd()}. */
    SEEK_END(EndSeekableStream.class),
    /** {@link SizedStream#length()} known without scanning. */
    LENGTH(SizedStream.class),
    /** {@link ValueWriter#write(Object)} at the cursor. */
    WRITE(ValueWriter.class),
    /** {@link TruncatableStream#truncate(long)}. */
    TRUNCATE(TruncatableStream.class);

    private static final ClassValue<Set<Capability>> DECLARED = new ClassValue<>() {
        @Override
        protected Set<Capability> computeValue(Class<?> type) {
            EnumSet<Capability> declared = EnumSet.noneOf(Capability.class);
            for (Capability capability : values()) {
                if (capability.marker.isAssignableFrom(type)) {
                    declared.add(capability);
                }
            }
            return Collections.unmodifiableSet(declared);
        }
    };

    private final Class<?> marker;

    Capability(Class<?> marker) {
        this.marker = marker;
    }

    /**
     * Interface a stream type implements to declare this capability.
     */
    public Class<?> marker() {
        return marker;
    }

    /**
     * Capabilities declared by the given stream type. Cached per class.
     */
    public static Set<Capability> declaredBy(Class<?> streamType) {
        return DECLARED.get(streamType);
    }
}
