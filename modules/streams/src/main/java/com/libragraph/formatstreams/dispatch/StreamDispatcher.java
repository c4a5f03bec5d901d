package com.libragraph.formatstreams.dispatch;

import com.libragraph.formatstreams.api.FormattedStream;
import com.libragraph.formatstreams.api.StreamConstructor;
import com.libragraph.formatstreams.registry.NoStreamConstructorException;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Invokes the constructor registered for a prepared (handler, format) pair.
 *
 * Dispatching takes ownership of the prepared input: on failure it is closed before the
 * error propagates; on success it belongs to the returned stream.
 */
public class StreamDispatcher {

    private static final Logger log = Logger.getLogger(StreamDispatcher.class);

    private final StreamerRegistry registry;

    public StreamDispatcher(StreamerRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws NoStreamConstructorException if the handler defines no constructor for the format
     */
    public FormattedStream<?> dispatch(PreparedStream prepared, Object... args) throws IOException {
        try {
            StreamConstructor constructor = registry.constructorFor(prepared.handler(), prepared.format())
                    .orElseThrow(() -> new NoStreamConstructorException(prepared.handler(), prepared.format()));
            FormattedStream<?> stream = constructor.construct(
                    prepared.handler(), prepared.format(), prepared.input(), args);
            if (stream == null) {
                throw new IllegalStateException("Streamer " + prepared.handler().name()
                        + " returned no stream for " + prepared.format());
            }
            log.debugf("Opened %s with %s", prepared.format(), prepared.handler().name());
            return stream;
        } catch (IOException | RuntimeException e) {
            try {
                prepared.input().close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }
}
