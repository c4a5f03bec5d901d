package com.libragraph.formatstreams.api;

import com.libragraph.formatstreams.types.FormatId;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;

/**
 * A typed stream of decoded values with a single value-index cursor.
 *
 * <p>Every stream supports the core operations: {@link #position()}, {@link #isEof()},
 * {@link #rewind()} and an idempotent {@link #close()}. Optional operations are declared
 * by implementing the matching narrow interface ({@link ValueReader}, {@link SeekableStream},
 * ...); {@link #capabilities()} reports them. The default implementations of the optional
 * operations here throw {@link UnsupportedCapabilityException}.
 *
 * <p>Streams are not thread-safe and have exactly one owner until closed.
 *
 * @param <T> type of the decoded values
 */
public interface FormattedStream<T> extends Closeable {

    /**
     * Format this stream decodes.
     */
    FormatId format();

    /**
     * Type of the values this stream yields.
     */
    Class<T> valueType();

    /**
     * Index of the value the cursor is on (0-based).
     */
    long position() throws IOException;

    /**
     * True when no value remains at the cursor.
     */
    boolean isEof() throws IOException;

    /**
     * Moves the cursor back to the first value.
     */
    void rewind() throws IOException;

    /**
     * Releases the stream's resources. Calling it again has no effect.
     */
    @Override
    void close() throws IOException;

    /**
     * Optional operations this stream's type declares.
     */
    default Set<Capability> capabilities() {
        return Capability.declaredBy(getClass());
    }

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Fails unless this stream declares {@code capability}.
     *
     * @throws UnsupportedCapabilityException if it does not
     */
    default void require(Capability capability) {
        if (!supports(capability)) {
            throw new UnsupportedCapabilityException(this, capability);
        }
    }

    /**
     * Typed view of this stream through one of its capability interfaces.
     *
     * @throws UnsupportedCapabilityException if the stream does not implement it
     */
    default <C> C as(Class<C> capabilityType) {
        if (!capabilityType.isInstance(this)) {
            for (Capability capability : Capability.values()) {
                if (capability.marker().equals(capabilityType)) {
                    throw new UnsupportedCapabilityException(this, capability);
                }
            }
            throw new IllegalArgumentException(capabilityType.getName() + " is not a capability interface");
        }
        return capabilityType.cast(this);
    }

    /** See {@link ValueReader#read()}. */
    default T read() throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.READ);
    }

    /** See {@link BufferedValueReader#readInto(Object)}. */
    default T readInto(T output) throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.READ_INTO);
    }

    /** See {@link SeekableStream#seek(long)}. */
    default void seek(long index) throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.SEEK);
    }

    /** See {@link EndSeekableStream#seekEnd()}. */
    default void seekEnd() throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.SEEK_END);
    }

    /** See {@link SizedStream#length()}. */
    default long length() throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.LENGTH);
    }

    /** See {@link ValueWriter#write(Object)}. */
    default void write(T value) throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.WRITE);
    }

    /** See {@link TruncatableStream#truncate(long)}. */
    default void truncate(long length) throws IOException {
        throw new UnsupportedCapabilityException(this, Capability.TRUNCATE);
    }
}
