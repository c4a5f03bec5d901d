package com.libragraph.formatstreams;

import java.io.IOException;

/**
 * Work done with an open stream inside {@link FormatStreams#withStream}.
 *
 * @param <S> stream type handed to the callback
 * @param <R> result type
 */
@FunctionalInterface
public interface StreamCallback<S, R> {

    R apply(S stream) throws IOException;
}
