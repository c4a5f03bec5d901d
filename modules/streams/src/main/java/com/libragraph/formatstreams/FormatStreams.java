package com.libragraph.formatstreams;

import com.libragraph.formatstreams.api.FormatDetector;
import com.libragraph.formatstreams.api.FormattedResource;
import com.libragraph.formatstreams.api.FormattedStream;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.api.StreamTypeMismatchException;
import com.libragraph.formatstreams.config.RegistryBootstrap;
import com.libragraph.formatstreams.config.StreamsConfig;
import com.libragraph.formatstreams.dispatch.PreparedStream;
import com.libragraph.formatstreams.dispatch.StreamDispatcher;
import com.libragraph.formatstreams.dispatch.StreamResolver;
import com.libragraph.formatstreams.iterate.BufferedValueIterable;
import com.libragraph.formatstreams.iterate.ValueIterable;
import com.libragraph.formatstreams.registry.CodecRegistry;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.tika.TikaFormatDetector;
import com.libragraph.formatstreams.types.FormatId;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Opens typed value streams over paths, byte streams and classified resources.
 *
 * <p>Raw paths and byte streams are classified by the {@link FormatDetector}; the handler is
 * then resolved from the {@link StreamerRegistry}, codings are removed with the
 * {@link CodecRegistry} and the handler's constructor builds the stream.
 *
 * <p>Streams returned by {@code open} belong to the caller. {@link #withStream} closes them.
 */
public class FormatStreams {

    private static final Logger log = Logger.getLogger(FormatStreams.class);

    private final FormatDetector detector;
    private final StreamResolver resolver;
    private final StreamDispatcher dispatcher;

    public FormatStreams(StreamerRegistry registry, CodecRegistry codecs, FormatDetector detector) {
        this.detector = detector;
        this.resolver = new StreamResolver(registry, codecs);
        this.dispatcher = new StreamDispatcher(registry);
    }

    /**
     * Chain over the global registry, the installed codecs and the Tika detector.
     */
    public static FormatStreams defaults() {
        return DefaultsHolder.INSTANCE;
    }

    public FormattedStream<?> open(Path path, Object... args) throws IOException {
        return open(detector.classify(path), args);
    }

    /**
     * Classifies and opens {@code input}, taking ownership of it.
     *
     * <p>Classification may buffer bytes read from {@code input}, so it cannot be handed back
     * intact: it is closed whenever no stream is returned.
     */
    public FormattedStream<?> open(InputStream input, Object... args) throws IOException {
        try {
            return open(detector.classify(input), args);
        } catch (Throwable t) {
            closeAfterFailure(input, t);
            throw t;
        }
    }

    public FormattedStream<?> open(FormattedResource resource, Object... args) throws IOException {
        return dispatcher.dispatch(resolver.prepare(resource), args);
    }

    /**
     * Opens {@code input} with an explicit handler, bypassing resolution. {@code input} must
     * already be decoded.
     */
    public FormattedStream<?> open(StreamHandler handler, FormatId format, InputStream input, Object... args)
            throws IOException {
        return dispatcher.dispatch(new PreparedStream(handler, format, input), args);
    }

    public <T> FormattedStream<T> open(Path path, Class<T> valueType, Object... args) throws IOException {
        return checkValueType(open(path, args), valueType);
    }

    public <T> FormattedStream<T> open(InputStream input, Class<T> valueType, Object... args) throws IOException {
        return checkValueType(open(input, args), valueType);
    }

    /**
     * Opens {@code resource} and checks that its handler yields {@code valueType} values.
     *
     * @throws StreamTypeMismatchException if it does not; the stream is closed first
     */
    public <T> FormattedStream<T> open(FormattedResource resource, Class<T> valueType, Object... args)
            throws IOException {
        return checkValueType(open(resource, args), valueType);
    }

    /**
     * Opens {@code path}, applies {@code callback} and closes the stream exactly once,
     * whatever the outcome.
     */
    public <R> R withStream(Path path, StreamCallback<FormattedStream<?>, R> callback, Object... args)
            throws IOException {
        return withOpened(open(path, args), callback);
    }

    public <R> R withStream(InputStream input, StreamCallback<FormattedStream<?>, R> callback, Object... args)
            throws IOException {
        return withOpened(open(input, args), callback);
    }

    public <R> R withStream(FormattedResource resource, StreamCallback<FormattedStream<?>, R> callback,
                            Object... args) throws IOException {
        return withOpened(open(resource, args), callback);
    }

    public <T, R> R withStream(FormattedResource resource, Class<T> valueType,
                               StreamCallback<FormattedStream<T>, R> callback, Object... args) throws IOException {
        return withOpened(open(resource, valueType, args), callback);
    }

    public <T, R> R withStream(Path path, Class<T> valueType,
                               StreamCallback<FormattedStream<T>, R> callback, Object... args) throws IOException {
        return withOpened(open(path, valueType, args), callback);
    }

    /**
     * Runs {@code callback} on an already open stream and closes it afterwards.
     *
     * <p>A callback failure is rethrown as is; a failure to close is then logged and
     * attached to it as suppressed. When the callback succeeds, a close failure propagates.
     */
    public static <S extends FormattedStream<?>, R> R withOpened(S stream, StreamCallback<? super S, R> callback)
            throws IOException {
        R result;
        try {
            result = callback.apply(stream);
        } catch (Throwable t) {
            closeAfterFailure(stream, t);
            throw t;
        }
        stream.close();
        return result;
    }

    /**
     * Values of {@code stream}, from the first, as an {@link Iterable}.
     */
    public static <T> ValueIterable<T> eachValue(FormattedStream<T> stream) {
        return new ValueIterable<>(stream);
    }

    /**
     * Values of {@code stream}, each read into {@code output}.
     */
    public static <T> BufferedValueIterable<T> eachValueInto(FormattedStream<T> stream, T output) {
        return new BufferedValueIterable<>(stream, output);
    }

    private static void closeAfterFailure(Closeable resource, Throwable primary) {
        try {
            resource.close();
        } catch (IOException | RuntimeException closeFailure) {
            log.warnf(closeFailure, "Failed to close %s after an error", resource);
            primary.addSuppressed(closeFailure);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> FormattedStream<T> checkValueType(FormattedStream<?> stream, Class<T> valueType)
            throws IOException {
        if (!valueType.isAssignableFrom(stream.valueType())) {
            StreamTypeMismatchException mismatch = new StreamTypeMismatchException(valueType, stream.valueType());
            try {
                stream.close();
            } catch (IOException closeFailure) {
                mismatch.addSuppressed(closeFailure);
            }
            throw mismatch;
        }
        return (FormattedStream<T>) stream;
    }

    private static final class DefaultsHolder {
        static final FormatStreams INSTANCE = create();

        private static FormatStreams create() {
            StreamsConfig config = StreamsConfig.load();
            CodecRegistry codecs = CodecRegistry.loadInstalled();
            TikaFormatDetector detector = new TikaFormatDetector(codecs, config.headerSize(), config.peekLimit())
                    .addCriteria(RegistryBootstrap.installedDetectionCriteria());
            return new FormatStreams(StreamerRegistry.global(), codecs, detector);
        }
    }
}
