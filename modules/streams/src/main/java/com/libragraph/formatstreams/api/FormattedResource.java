package com.libragraph.formatstreams.api;

import com.libragraph.formatstreams.types.CodingId;
import com.libragraph.formatstreams.types.FormatId;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A resource whose format (and optional coding) is known.
 */
public sealed interface FormattedResource permits FormattedResource.FormattedFile, FormattedResource.FormattedInput {

    FormatId format();

    Optional<CodingId> coding();

    /**
     * Tags a file with an explicit format.
     */
    static FormattedFile specify(Path path, String format) {
        return new FormattedFile(path, FormatId.of(format), Optional.empty());
    }

    /**
     * Tags a file with an explicit format and coding.
     */
    static FormattedFile specify(Path path, String format, String coding) {
        return new FormattedFile(path, FormatId.of(format), Optional.of(CodingId.of(coding)));
    }

    /**
     * Tags an open byte stream with an explicit format.
     */
    static FormattedInput specify(InputStream input, String format) {
        return new FormattedInput(input, FormatId.of(format), Optional.empty());
    }

    /**
     * Tags an open byte stream with an explicit format and coding.
     */
    static FormattedInput specify(InputStream input, String format, String coding) {
        return new FormattedInput(input, FormatId.of(format), Optional.of(CodingId.of(coding)));
    }

    /**
     * A file on disk; opened when the stream is resolved.
     */
    record FormattedFile(Path path, FormatId format, Optional<CodingId> coding) implements FormattedResource {
        public FormattedFile {
            if (path == null || format == null || coding == null) {
                throw new IllegalArgumentException("path, format and coding must not be null");
            }
        }
    }

    /**
     * An already open byte stream, owned by the caller until a stream is constructed from it.
     */
    record FormattedInput(InputStream input, FormatId format, Optional<CodingId> coding) implements FormattedResource {
        public FormattedInput {
            if (input == null || format == null || coding == null) {
                throw new IllegalArgumentException("input, format and coding must not be null");
            }
        }
    }
}
