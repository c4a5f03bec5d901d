package com.libragraph.formatstreams.handlers;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;
import com.libragraph.formatstreams.util.buffer.Buffer;
import com.libragraph.formatstreams.util.buffer.RamBuffer;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Handler for uniform float vector files ({@code .fvec}).
 *
 * Each record is a little-endian {@code int32} dimension followed by that many
 * little-endian {@code float32} components; every record has the same dimension.
 */
public final class FvecStreamer implements StreamHandler {

    public static final FvecStreamer INSTANCE = new FvecStreamer();

    public static final FormatId FORMAT = FormatId.of("application/x-fvec");

    private FvecStreamer() {
    }

    @Override
    public String name() {
        return "fvec";
    }

    static DetectionCriteria detectionCriteria() {
        return new DetectionCriteria(Set.of(FORMAT.value()), Set.of("fvec", "fvecs"), null, 0, 100);
    }

    /**
     * Stream constructor. Accepts an optional {@link Integer} argument: the expected dimension.
     * Reads {@code input} fully and closes it.
     */
    public static FvecStream open(StreamHandler handler, FormatId format, InputStream input, Object... args)
            throws IOException {
        Integer expectedDimension = HandlerArguments.find(args, Integer.class).orElse(null);
        Buffer buffer;
        try (input) {
            buffer = Buffer.readFully(input);
        }
        try {
            return new FvecStream(format, buffer, expectedDimension);
        } catch (IOException | RuntimeException e) {
            try {
                buffer.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Empty in-memory stream for vectors of {@code dimension} components, ready for writing.
     */
    public static FvecStream create(int dimension) throws IOException {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + dimension);
        }
        return new FvecStream(FORMAT, new RamBuffer(4096), dimension);
    }

    @Override
    public String toString() {
        return name();
    }
}
