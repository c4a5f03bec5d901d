package com.libragraph.formatstreams.api;

import com.libragraph.formatstreams.types.CodingId;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Set;

/**
 * Interface for codec plugins that handle transport-level transformations.
 * Examples: gzip, bzip2, xz.
 *
 * Codecs wrap byte streams and are bidirectional. Implementations are discovered through
 * {@link java.util.ServiceLoader} and are also {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {

    /**
     * Coding this codec removes on decode, e.g. {@code application/gzip}.
     */
    CodingId codingId();

    /**
     * File extensions (without dot) that mark this coding, e.g. {@code gz}.
     */
    Set<String> extensions();

    /**
     * Checks if this codec can handle the given data.
     *
     * @param header   First N bytes of the data (typically 8-16 bytes)
     * @param filename Original filename, may be null (may contain hints like .gz extension)
     * @return true if this codec should handle the data
     */
    boolean matches(byte[] header, String filename);

    /**
     * Wraps {@code encoded} so that reading yields the decoded bytes.
     * Closing the returned stream closes {@code encoded}.
     */
    InputStream decode(InputStream encoded) throws IOException;

    /**
     * Wraps {@code plain} so that bytes written to the result reach it encoded.
     *
     * @param parameters Encoding parameters (compression level, block size, etc.)
     */
    OutputStream encode(OutputStream plain, Map<String, Object> parameters) throws IOException;

    /**
     * Returns the default encoding parameters for this codec.
     */
    Map<String, Object> getEncodingParameters();

    /**
     * Removes this codec's extension from {@code filename}, e.g. {@code data.fvec.gz -> data.fvec}.
     * Returns the name unchanged when no extension matches.
     */
    default String stripExtension(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase();
        for (String extension : extensions()) {
            if (lower.endsWith("." + extension)) {
                return filename.substring(0, filename.length() - extension.length() - 1);
            }
        }
        return filename;
    }
}
