package com.libragraph.formatstreams.dispatch;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

import java.io.InputStream;
import java.util.Objects;

/**
 * A resolved handler together with the decoded byte stream it will read.
 *
 * @param handler the handler chosen for {@code format}
 * @param format  the format being opened
 * @param input   byte stream with every coding removed
 */
public record PreparedStream(StreamHandler handler, FormatId format, InputStream input) {

    public PreparedStream {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(input, "input");
    }
}
