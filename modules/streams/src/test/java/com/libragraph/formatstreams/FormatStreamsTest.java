package com.libragraph.formatstreams;

import com.libragraph.formatstreams.api.FormatDetectionException;
import com.libragraph.formatstreams.api.FormattedResource;
import com.libragraph.formatstreams.api.FormattedStream;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.api.StreamTypeMismatchException;
import com.libragraph.formatstreams.codecs.Bzip2Codec;
import com.libragraph.formatstreams.codecs.GzipCodec;
import com.libragraph.formatstreams.handlers.BuiltinStreamHandlers;
import com.libragraph.formatstreams.handlers.FvecStream;
import com.libragraph.formatstreams.handlers.FvecStreamer;
import com.libragraph.formatstreams.handlers.TextLineStreamer;
import com.libragraph.formatstreams.registry.AmbiguousHandlerException;
import com.libragraph.formatstreams.registry.CodecRegistry;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.test.CloseTrackingInputStream;
import com.libragraph.formatstreams.test.ListStream;
import com.libragraph.formatstreams.tika.TikaFormatDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class FormatStreamsTest {

    private static final StreamHandler LIST_HANDLER = StreamHandler.named("list");

    @TempDir
    Path tempDir;

    private final StreamerRegistry registry = new StreamerRegistry();
    private final AtomicReference<ListStream<String>> opened = new AtomicReference<>();
    private FormatStreams streams;

    @BeforeEach
    void setUp() {
        BuiltinStreamHandlers builtins = new BuiltinStreamHandlers();
        builtins.register(registry);
        registry.register(ListStream.FORMAT, LIST_HANDLER, (handler, format, input, args) -> {
            try (input) {
                String text = new String(input.readAllBytes(), StandardCharsets.UTF_8);
                ListStream<String> stream = new ListStream<>(String.class, List.of(text.split("\n")));
                opened.set(stream);
                return stream;
            }
        });

        CodecRegistry codecs = CodecRegistry.of(new GzipCodec(), new Bzip2Codec());
        TikaFormatDetector detector = new TikaFormatDetector(codecs, 512, 64 * 1024)
                .addCriteria(builtins.detectionCriteria());
        streams = new FormatStreams(registry, codecs, detector);
    }

    @Test
    void shouldOpenGzippedVectorFile() throws Exception {
        Path file = Files.write(tempDir.resolve("base.fvec.gz"),
                gzip(fvec(new float[]{1, 2}, new float[]{3, 4})));

        try (FormattedStream<?> stream = streams.open(file)) {
            assertThat(stream).isInstanceOf(FvecStream.class);
            assertThat(stream.format()).isEqualTo(FvecStreamer.FORMAT);
            assertThat(stream.length()).isEqualTo(2);
            assertThat((float[]) stream.read()).containsExactly(1f, 2f);
        }
    }

    @Test
    void shouldOpenBzippedTextTyped() throws Exception {
        Path file = Files.write(tempDir.resolve("notes.txt.bz2"),
                bzip2("one\ntwo\nthree\n".getBytes(StandardCharsets.UTF_8)));

        try (FormattedStream<String> stream = streams.open(file, String.class)) {
            assertThat(FormatStreams.eachValue(stream)).containsExactly("one", "two", "three");
        }
    }

    @Test
    void shouldOpenCodedInputStream() throws Exception {
        InputStream input = new ByteArrayInputStream(gzip("alpha\nbeta\n".getBytes(StandardCharsets.UTF_8)));

        try (FormattedStream<?> stream = streams.open(input)) {
            assertThat(stream.format()).isEqualTo(TextLineStreamer.FORMAT);
            assertThat(stream.read()).isEqualTo("alpha");
        }
    }

    @Test
    void shouldPassExtraArgumentsToConstructor() throws Exception {
        Path file = Files.write(tempDir.resolve("base.fvec"), fvec(new float[]{1, 2, 3}));

        try (FormattedStream<?> stream = streams.open(file, 3)) {
            assertThat(((FvecStream) stream).dimension()).hasValue(3);
        }
        assertThatThrownBy(() -> streams.open(file, 4))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Expected dimension 4");
    }

    @Test
    void shouldRejectWrongValueType() throws Exception {
        Path file = Files.write(tempDir.resolve("base.fvec"), fvec(new float[]{1}));

        assertThatThrownBy(() -> streams.open(file, String.class))
                .isInstanceOf(StreamTypeMismatchException.class)
                .satisfies(e -> {
                    var mismatch = (StreamTypeMismatchException) e;
                    assertThat(mismatch.expected()).isEqualTo(String.class);
                    assertThat(mismatch.actual()).isEqualTo(float[].class);
                });
    }

    @Test
    void shouldPropagateAmbiguity() throws Exception {
        registry.register(TextLineStreamer.FORMAT, StreamHandler.named("other-text"));
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "a\n");

        assertThatThrownBy(() -> streams.open(file))
                .isInstanceOf(AmbiguousHandlerException.class)
                .satisfies(e -> assertThat(((AmbiguousHandlerException) e).candidates())
                        .containsExactly(TextLineStreamer.INSTANCE, StreamHandler.named("other-text")));
    }

    @Test
    void shouldCloseUnmarkableInputWhenResolutionFails() throws Exception {
        registry.register(TextLineStreamer.FORMAT, StreamHandler.named("other-text"));
        CloseTrackingInputStream input = new CloseTrackingInputStream("hello\nworld".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public boolean markSupported() {
                return false;
            }
        };

        assertThatThrownBy(() -> streams.open(input))
                .isInstanceOf(AmbiguousHandlerException.class);
        assertThat(input.isClosed()).isTrue();
    }

    @Test
    void shouldCloseInputWhenClassificationFails() {
        CloseTrackingInputStream input = new CloseTrackingInputStream(new byte[]{0x00, 0x13, 0x37, 0x00, (byte) 0xfe});

        assertThatThrownBy(() -> streams.open(input))
                .isInstanceOf(FormatDetectionException.class);
        assertThat(input.isClosed()).isTrue();
    }

    @Test
    void shouldOpenWithExplicitHandler() throws Exception {
        registry.register(TextLineStreamer.FORMAT, StreamHandler.named("other-text"));
        InputStream input = new ByteArrayInputStream("x\ny\n".getBytes(StandardCharsets.UTF_8));

        try (FormattedStream<?> stream = streams.open(TextLineStreamer.INSTANCE, TextLineStreamer.FORMAT, input)) {
            assertThat(stream.read()).isEqualTo("x");
        }
    }

    @Test
    void shouldCloseOnceWhenCallbackSucceeds() throws Exception {
        List<String> values = streams.withStream(listResource("a\nb\nc"), String.class, stream -> {
            List<String> collected = new ArrayList<>();
            FormatStreams.eachValue(stream).forEach(collected::add);
            return collected;
        });

        assertThat(values).containsExactly("a", "b", "c");
        assertThat(opened.get().closeCount()).isEqualTo(1);
    }

    @Test
    void shouldCloseOnceWhenCallbackFails() {
        IllegalStateException failure = new IllegalStateException("callback failed");

        assertThatThrownBy(() -> streams.withStream(listResource("a"), stream -> {
            stream.read();
            throw failure;
        })).isSameAs(failure);

        assertThat(opened.get().closeCount()).isEqualTo(1);
    }

    @Test
    void shouldAttachCloseFailureToCallbackFailure() throws Exception {
        IOException closeFailure = new IOException("close failed");
        ListStream<String> stream = ListStream.of(String.class, "a").failingOnClose(closeFailure);

        assertThatThrownBy(() -> FormatStreams.withOpened(stream, s -> {
            throw new IOException("read failed");
        }))
                .isInstanceOf(IOException.class)
                .hasMessage("read failed")
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(closeFailure));
        assertThat(stream.closeCount()).isEqualTo(1);
    }

    @Test
    void shouldPropagateCloseFailureAfterSuccess() {
        IOException closeFailure = new IOException("close failed");
        ListStream<String> stream = ListStream.of(String.class, "a").failingOnClose(closeFailure);

        assertThatThrownBy(() -> FormatStreams.withOpened(stream, s -> s.read())).isSameAs(closeFailure);
        assertThat(stream.closeCount()).isEqualTo(1);
    }

    @Test
    void shouldNotOpenWhenTypedSessionMismatches() throws Exception {
        Path file = Files.write(tempDir.resolve("base.fvec"), fvec(new float[]{1}));
        List<Object> calls = new ArrayList<>();

        assertThatThrownBy(() -> streams.withStream(file, String.class, stream -> calls.add(stream)))
                .isInstanceOf(StreamTypeMismatchException.class);
        assertThat(calls).isEmpty();
    }

    private static FormattedResource listResource(String content) {
        return FormattedResource.specify(
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), ListStream.FORMAT.value());
    }

    private static byte[] fvec(float[]... vectors) {
        int size = 0;
        for (float[] v : vectors) {
            size += 4 + 4 * v.length;
        }
        ByteBuffer bytes = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        for (float[] v : vectors) {
            bytes.putInt(v.length);
            for (float f : v) {
                bytes.putFloat(f);
            }
        }
        return bytes.array();
    }

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = new GzipCodec().encode(bytes, Map.of())) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    private static byte[] bzip2(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = new Bzip2Codec().encode(bytes, Map.of())) {
            out.write(data);
        }
        return bytes.toByteArray();
    }
}
