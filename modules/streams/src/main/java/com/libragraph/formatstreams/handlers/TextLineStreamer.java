package com.libragraph.formatstreams.handlers;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;
import com.libragraph.formatstreams.util.buffer.Buffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Handler streaming plain text line by line.
 */
public final class TextLineStreamer implements StreamHandler {

    public static final TextLineStreamer INSTANCE = new TextLineStreamer();

    public static final FormatId FORMAT = FormatId.of("text/plain");

    private TextLineStreamer() {
    }

    @Override
    public String name() {
        return "text-lines";
    }

    static DetectionCriteria detectionCriteria() {
        return new DetectionCriteria(
                Set.of("text/plain"),
                Set.of("txt", "text", "log"),
                null,
                0,
                100
        );
    }

    /**
     * Stream constructor. Accepts an optional {@link Charset} argument (UTF-8 by default).
     * Reads {@code input} fully and closes it.
     */
    public static TextLineStream open(StreamHandler handler, FormatId format, InputStream input, Object... args)
            throws IOException {
        Charset charset = HandlerArguments.find(args, Charset.class).orElse(StandardCharsets.UTF_8);
        Buffer buffer;
        try (input) {
            buffer = Buffer.readFully(input);
        }
        return new TextLineStream(format, buffer, charset);
    }

    @Override
    public String toString() {
        return name();
    }
}
