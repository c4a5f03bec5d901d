package com.libragraph.formatstreams.iterate;

import com.libragraph.formatstreams.api.Capability;
import com.libragraph.formatstreams.api.FormattedStream;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Iterates every value of a stream, from the first.
 *
 * <p>Each iterator rewinds the stream on its first step, so iterating twice yields the
 * same sequence. Iterators share the stream's cursor: only one may be in use at a time.
 * The iterable owns nothing and must not outlive the stream.
 *
 * @param <T> value type
 */
public class ValueIterable<T> implements Iterable<T> {

    private final FormattedStream<T> source;

    /**
     * @throws com.libragraph.formatstreams.api.UnsupportedCapabilityException if the stream cannot read
     */
    public ValueIterable(FormattedStream<T> source) {
        this.source = Objects.requireNonNull(source, "source");
        source.require(Capability.READ);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private boolean rewound;

            @Override
            public boolean hasNext() {
                try {
                    if (!rewound) {
                        source.rewind();
                        rewound = true;
                    }
                    return !source.isEof();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                try {
                    return source.read();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    /**
     * Sequential stream over the values, with the same rewind behaviour as {@link #iterator()}.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }
}
