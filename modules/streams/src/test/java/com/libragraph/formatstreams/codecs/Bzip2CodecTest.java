package com.libragraph.formatstreams.codecs;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Bzip2CodecTest {

    private final Bzip2Codec codec = new Bzip2Codec();

    @Test
    void shouldMatchBzip2MagicBytes() {
        byte[] header = {'B', 'Z', 'h', '9', 0x31, 0x41};
        assertThat(codec.matches(header, null)).isTrue();
    }

    @Test
    void shouldMatchBzip2Extension() {
        assertThat(codec.matches(new byte[0], "data.bz2")).isTrue();
        assertThat(codec.matches(new byte[0], "data.bzip2")).isTrue();
        assertThat(codec.matches(new byte[0], "data.gz")).isFalse();
    }

    @Test
    void shouldCompressAndDecompress() throws Exception {
        String original = "line of text\n".repeat(200);

        byte[] compressed = encode(original, Map.of("blockSize", 1));
        assertThat(codec.matches(compressed, null)).isTrue();

        try (InputStream decoded = codec.decode(new ByteArrayInputStream(compressed))) {
            assertThat(new String(decoded.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(original);
        }
    }

    @Test
    void shouldDecodeConcatenatedStreams() throws Exception {
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        joined.write(encode("first\n", codec.getEncodingParameters()));
        joined.write(encode("second\n", codec.getEncodingParameters()));

        try (InputStream decoded = codec.decode(new ByteArrayInputStream(joined.toByteArray()))) {
            assertThat(new String(decoded.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("first\nsecond\n");
        }
    }

    @Test
    void shouldRejectInvalidBlockSize() {
        assertThatThrownBy(() -> codec.encode(new ByteArrayOutputStream(), Map.of("blockSize", 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1-9");
    }

    private byte[] encode(String content, Map<String, Object> parameters) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = codec.encode(bytes, parameters)) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return bytes.toByteArray();
    }
}
