package com.libragraph.formatstreams.codecs;

import com.libragraph.formatstreams.api.Codec;
import com.libragraph.formatstreams.types.CodingId;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Codec for BZIP2 compression (.bz2 files).
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements Codec {
    public static final CodingId CODING = CodingId.of("application/x-bzip2");

    private static final byte[] BZIP2_MAGIC = new byte[]{'B', 'Z', 'h'};

    @Override
    public CodingId codingId() {
        return CODING;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("bz2", "bzip2");
    }

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header != null && header.length >= 3) {
            if (header[0] == BZIP2_MAGIC[0] &&
                header[1] == BZIP2_MAGIC[1] &&
                header[2] == BZIP2_MAGIC[2]) {
                return true;
            }
        }

        if (filename != null) {
            String lower = filename.toLowerCase();
            return lower.endsWith(".bz2") || lower.endsWith(".bzip2");
        }

        return false;
    }

    @Override
    public InputStream decode(InputStream encoded) throws IOException {
        return new BZip2CompressorInputStream(encoded, true);
    }

    @Override
    public OutputStream encode(OutputStream plain, Map<String, Object> parameters) throws IOException {
        int blockSize = 9;
        if (parameters.containsKey("blockSize")) {
            blockSize = (Integer) parameters.get("blockSize");
            if (blockSize < 1 || blockSize > 9) {
                throw new IllegalArgumentException("BZIP2 block size must be 1-9, got: " + blockSize);
            }
        }
        return new BZip2CompressorOutputStream(plain, blockSize);
    }

    @Override
    public Map<String, Object> getEncodingParameters() {
        Map<String, Object> params = new HashMap<>();
        params.put("blockSize", 9);
        return params;
    }
}
