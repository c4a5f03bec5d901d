package com.libragraph.formatstreams.tika;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.api.FormatDetectionException;
import com.libragraph.formatstreams.api.FormattedResource.FormattedFile;
import com.libragraph.formatstreams.api.FormattedResource.FormattedInput;
import com.libragraph.formatstreams.codecs.Bzip2Codec;
import com.libragraph.formatstreams.codecs.GzipCodec;
import com.libragraph.formatstreams.handlers.BuiltinStreamHandlers;
import com.libragraph.formatstreams.handlers.FvecStreamer;
import com.libragraph.formatstreams.handlers.TextLineStreamer;
import com.libragraph.formatstreams.registry.CodecRegistry;
import com.libragraph.formatstreams.types.FormatId;
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
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TikaFormatDetectorTest {

    @TempDir
    Path tempDir;

    private TikaFormatDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TikaFormatDetector(CodecRegistry.of(new GzipCodec(), new Bzip2Codec()), 512, 64 * 1024)
                .addCriteria(new BuiltinStreamHandlers().detectionCriteria());
    }

    @Test
    void shouldClassifyByExtension() throws Exception {
        Path file = write("base.fvec", fvecBytes());

        FormattedFile classified = detector.classify(file);

        assertThat(classified.path()).isEqualTo(file);
        assertThat(classified.format()).isEqualTo(FvecStreamer.FORMAT);
        assertThat(classified.coding()).isEmpty();
    }

    @Test
    void shouldClassifyGzippedFileByInnerName() throws Exception {
        Path file = write("base.fvec.gz", gzip(fvecBytes()));

        FormattedFile classified = detector.classify(file);

        assertThat(classified.format()).isEqualTo(FvecStreamer.FORMAT);
        assertThat(classified.coding()).contains(GzipCodec.CODING);
    }

    @Test
    void shouldClassifyBzippedText() throws Exception {
        Path file = write("notes.txt.bz2", bzip2("first line\nsecond line\n".getBytes(StandardCharsets.UTF_8)));

        FormattedFile classified = detector.classify(file);

        assertThat(classified.format()).isEqualTo(TextLineStreamer.FORMAT);
        assertThat(classified.coding()).contains(Bzip2Codec.CODING);
    }

    @Test
    void shouldClassifyInputStreamWithoutLosingBytes() throws Exception {
        byte[] compressed = gzip("hello\nworld\n".getBytes(StandardCharsets.UTF_8));

        FormattedInput classified = detector.classify(new ByteArrayInputStream(compressed));

        assertThat(classified.format()).isEqualTo(TextLineStreamer.FORMAT);
        assertThat(classified.coding()).contains(GzipCodec.CODING);
        assertThat(classified.input().readAllBytes()).isEqualTo(compressed);
    }

    @Test
    void shouldPreferHigherPriorityCriteria() throws Exception {
        FormatId custom = FormatId.of("text/x-fv01");
        detector.addCriteria(custom, new DetectionCriteria(
                Set.of(), Set.of(), "FV01".getBytes(StandardCharsets.US_ASCII), 0, 300));
        Path file = write("records.txt", "FV01 plain looking text\n".getBytes(StandardCharsets.US_ASCII));

        assertThat(detector.classify(file).format()).isEqualTo(custom);
    }

    @Test
    void shouldFallBackToTikaMediaType() throws Exception {
        TikaFormatDetector bare = new TikaFormatDetector(CodecRegistry.of(), 512, 512);
        Path file = write("page.html", "<html><head><title>t</title></head><body>x</body></html>"
                .getBytes(StandardCharsets.UTF_8));

        assertThat(bare.classify(file).format()).isEqualTo(FormatId.of("text/html"));
    }

    @Test
    void shouldFailOnUnrecognizedContent() throws Exception {
        Path file = write("blob", new byte[]{0x00, 0x13, 0x37, 0x00, (byte) 0xfe, 0x01, 0x02, 0x00, 0x7f, 0x00});

        assertThatThrownBy(() -> detector.classify(file))
                .isInstanceOf(FormatDetectionException.class)
                .satisfies(e -> assertThat(((FormatDetectionException) e).resource()).isEqualTo(file.toString()));
    }

    @Test
    void shouldRejectMisnamedCompressedFile() throws Exception {
        Path file = write("notes.txt.gz", "not gzip at all".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> detector.classify(file))
                .isInstanceOf(FormatDetectionException.class)
                .hasCauseInstanceOf(IOException.class)
                .satisfies(e -> assertThat(((FormatDetectionException) e).resource()).isEqualTo(file.toString()));
    }

    @Test
    void shouldCloseFileWhenDecoderRejectsIt() throws Exception {
        List<InputStream> encodedStreams = new ArrayList<>();
        TikaFormatDetector recording = new TikaFormatDetector(CodecRegistry.of(new GzipCodec() {
            @Override
            public InputStream decode(InputStream encoded) throws IOException {
                encodedStreams.add(encoded);
                return super.decode(encoded);
            }
        }), 512, 512);
        Path file = write("notes.txt.gz", "not gzip at all".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> recording.classify(file)).isInstanceOf(FormatDetectionException.class);

        assertThat(encodedStreams).hasSize(1);
        assertThatThrownBy(() -> encodedStreams.get(0).read()).isInstanceOf(IOException.class);
    }

    @Test
    void shouldRejectPeekLimitBelowHeaderSize() {
        assertThatThrownBy(() -> new TikaFormatDetector(CodecRegistry.of(), 512, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAcceptCriteriaMap() throws Exception {
        FormatId custom = FormatId.of("application/x-custom");
        TikaFormatDetector bare = new TikaFormatDetector(CodecRegistry.of(), 512, 512)
                .addCriteria(Map.of(custom, DetectionCriteria.byExtension(10, "cst")));

        assertThat(bare.classify(write("a.cst", new byte[]{1, 2, 3})).format()).isEqualTo(custom);
    }

    private Path write(String name, byte[] content) throws IOException {
        return Files.write(tempDir.resolve(name), content);
    }

    private static byte[] fvecBytes() {
        ByteBuffer bytes = ByteBuffer.allocate(24).order(ByteOrder.LITTLE_ENDIAN);
        bytes.putInt(2).putFloat(1f).putFloat(2f);
        bytes.putInt(2).putFloat(3f).putFloat(4f);
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
