package com.libragraph.formatstreams.dispatch;

import com.libragraph.formatstreams.api.Codec;
import com.libragraph.formatstreams.api.FormattedResource;
import com.libragraph.formatstreams.api.FormattedResource.FormattedFile;
import com.libragraph.formatstreams.api.FormattedResource.FormattedInput;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.registry.CodecRegistry;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.types.CodingId;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Turns a classified resource into a handler and a decoded byte stream.
 *
 * The handler is resolved before anything is opened, so ambiguity and missing handlers
 * never leave a file handle behind.
 */
public class StreamResolver {

    private static final Logger log = Logger.getLogger(StreamResolver.class);

    private final StreamerRegistry registry;
    private final CodecRegistry codecs;

    public StreamResolver(StreamerRegistry registry, CodecRegistry codecs) {
        this.registry = registry;
        this.codecs = codecs;
    }

    /**
     * Resolves the handler for the resource's format and opens its decoded content.
     *
     * <p>A file is opened here and closed again if removing its coding fails. An input
     * stream supplied by the caller is never closed by this method.
     */
    public PreparedStream prepare(FormattedResource resource) throws IOException {
        StreamHandler handler = registry.resolve(resource.format());
        log.debugf("Resolved streamer %s for %s", handler.name(), resource.format());

        InputStream raw;
        boolean opened;
        if (resource instanceof FormattedFile file) {
            raw = Files.newInputStream(file.path());
            opened = true;
        } else {
            raw = ((FormattedInput) resource).input();
            opened = false;
        }

        try {
            return new PreparedStream(handler, resource.format(), decode(raw, resource.coding()));
        } catch (IOException | RuntimeException e) {
            if (opened) {
                closeQuietly(raw, e);
            }
            throw e;
        }
    }

    private InputStream decode(InputStream raw, Optional<CodingId> coding) throws IOException {
        if (coding.isEmpty()) {
            return raw;
        }
        Codec codec = codecs.transformFor(coding.get());
        log.debugf("Decoding %s with %s", coding.get(), codec.getClass().getSimpleName());
        return codec.decode(raw);
    }

    private static void closeQuietly(InputStream input, Exception primary) {
        try {
            input.close();
        } catch (IOException closeFailure) {
            primary.addSuppressed(closeFailure);
        }
    }
}
