package com.libragraph.formatstreams.iterate;

import com.libragraph.formatstreams.api.Capability;
import com.libragraph.formatstreams.api.FormattedStream;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Like {@link ValueIterable}, but reads each value into one caller-supplied object.
 *
 * Every element yielded is that same object, overwritten by the next step; copy it to keep it.
 *
 * @param <T> value type
 */
public class BufferedValueIterable<T> implements Iterable<T> {

    private final FormattedStream<T> source;
    private final T output;

    public BufferedValueIterable(FormattedStream<T> source, T output) {
        this.source = Objects.requireNonNull(source, "source");
        this.output = Objects.requireNonNull(output, "output");
        source.require(Capability.READ_INTO);
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
                    return source.readInto(output);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }
}
