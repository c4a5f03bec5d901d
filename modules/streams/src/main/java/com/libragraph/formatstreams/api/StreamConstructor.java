package com.libragraph.formatstreams.api;

import com.libragraph.formatstreams.types.FormatId;

import java.io.IOException;
import java.io.InputStream;

/**
 * Builds a stream for one (handler, format) pair. This is the extension point integrators
 * register at initialization time.
 *
 * The constructor validates the format's layout and reports layout errors as
 * {@link IOException}s. It takes ownership of {@code input}: the input is closed when the
 * returned stream is closed, or earlier.
 */
@FunctionalInterface
public interface StreamConstructor {

    /**
     * @param handler the handler that was chosen
     * @param format  the format being opened
     * @param input   decoded byte stream (codings already removed)
     * @param args    caller-supplied extra arguments, handler specific
     */
    FormattedStream<?> construct(StreamHandler handler, FormatId format, InputStream input, Object... args)
            throws IOException;
}
