package com.libragraph.formatstreams.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Classifies a raw resource into a {@link FormattedResource}.
 */
public interface FormatDetector {

    /**
     * @throws FormatDetectionException if the format cannot be determined
     */
    FormattedResource.FormattedFile classify(Path path) throws IOException;

    /**
     * Classifies an open stream. The returned resource wraps a stream that still yields
     * every byte of {@code input}; callers must use it instead of {@code input}.
     *
     * @throws FormatDetectionException if the format cannot be determined
     */
    FormattedResource.FormattedInput classify(InputStream input) throws IOException;
}
