package com.libragraph.formatstreams.codecs;

import com.libragraph.formatstreams.api.Codec;
import com.libragraph.formatstreams.types.CodingId;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Codec for GZIP compression (.gz files).
 */
@ApplicationScoped
public class GzipCodec implements Codec {
    public static final CodingId CODING = CodingId.of("application/gzip");

    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};

    @Override
    public CodingId codingId() {
        return CODING;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("gz", "gzip");
    }

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header != null && header.length >= 2) {
            if (header[0] == GZIP_MAGIC[0] && header[1] == GZIP_MAGIC[1]) {
                return true;
            }
        }

        if (filename != null) {
            String lower = filename.toLowerCase();
            return lower.endsWith(".gz") || lower.endsWith(".gzip");
        }

        return false;
    }

    @Override
    public InputStream decode(InputStream encoded) throws IOException {
        return new GZIPInputStream(encoded);
    }

    @Override
    public OutputStream encode(OutputStream plain, Map<String, Object> parameters) throws IOException {
        int level = (Integer) parameters.getOrDefault("level", Deflater.DEFAULT_COMPRESSION);
        if (level != Deflater.DEFAULT_COMPRESSION && (level < 0 || level > 9)) {
            throw new IllegalArgumentException("GZIP level must be 0-9, got: " + level);
        }
        return new GZIPOutputStream(plain) {
            {
                def.setLevel(level);
            }
        };
    }

    @Override
    public Map<String, Object> getEncodingParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("level", Deflater.DEFAULT_COMPRESSION);
        return params;
    }
}
