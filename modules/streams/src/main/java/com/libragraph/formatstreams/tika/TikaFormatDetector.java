package com.libragraph.formatstreams.tika;

import com.libragraph.formatstreams.api.Codec;
import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.api.FormatDetectionException;
import com.libragraph.formatstreams.api.FormatDetector;
import com.libragraph.formatstreams.api.FormattedResource.FormattedFile;
import com.libragraph.formatstreams.api.FormattedResource.FormattedInput;
import com.libragraph.formatstreams.registry.CodecRegistry;
import com.libragraph.formatstreams.types.CodingId;
import com.libragraph.formatstreams.types.FormatId;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Infers format and coding from a resource's name and leading bytes.
 *
 * <ol>
 *   <li>A codec matching the raw header (or the file extension) gives the coding; the
 *       header is then re-read through its decoder and the codec extension dropped from
 *       the name.</li>
 *   <li>Tika's {@link DefaultDetector} proposes a media type from magic bytes and name globs.</li>
 *   <li>Registered {@link DetectionCriteria} are matched against that media type, the name
 *       and the header; the highest priority match decides the format.</li>
 *   <li>Otherwise Tika's media type is used, unless it is {@code application/octet-stream}.</li>
 * </ol>
 */
public class TikaFormatDetector implements FormatDetector {

    private static final Logger log = Logger.getLogger(TikaFormatDetector.class);

    private static final Detector DETECTOR = new DefaultDetector();

    private final CodecRegistry codecs;
    private final Map<FormatId, DetectionCriteria> criteria = new LinkedHashMap<>();
    private final int headerSize;
    private final int peekLimit;

    public TikaFormatDetector(CodecRegistry codecs, int headerSize, int peekLimit) {
        if (peekLimit < headerSize) {
            throw new IllegalArgumentException("Peek limit " + peekLimit + " below header size " + headerSize);
        }
        this.codecs = codecs;
        this.headerSize = headerSize;
        this.peekLimit = peekLimit;
    }

    /**
     * Adds or replaces the detection hint for {@code format}.
     */
    public TikaFormatDetector addCriteria(FormatId format, DetectionCriteria detectionCriteria) {
        criteria.put(format, detectionCriteria);
        return this;
    }

    public TikaFormatDetector addCriteria(Map<FormatId, DetectionCriteria> detectionCriteria) {
        criteria.putAll(detectionCriteria);
        return this;
    }

    @Override
    public FormattedFile classify(Path path) throws IOException {
        String filename = path.getFileName() == null ? null : path.getFileName().toString();

        byte[] header;
        try (InputStream in = Files.newInputStream(path)) {
            header = in.readNBytes(headerSize);
        }

        Optional<Codec> codec = codecs.findCodec(header, filename);
        if (codec.isPresent()) {
            try (InputStream raw = Files.newInputStream(path);
                 InputStream in = decode(codec.get(), raw, path.toString())) {
                header = readDecodedHeader(in, path.toString());
            }
            filename = codec.get().stripExtension(filename);
        }

        FormatId format = detectFormat(header, filename, path.toString());
        Optional<CodingId> coding = codec.map(Codec::codingId);
        log.debugf("Classified %s as %s%s", path, format, coding.map(c -> " coded " + c).orElse(""));
        return new FormattedFile(path, format, coding);
    }

    @Override
    public FormattedInput classify(InputStream input) throws IOException {
        InputStream peekable = input.markSupported() ? input : new BufferedInputStream(input, headerSize);

        peekable.mark(headerSize);
        byte[] header = peekable.readNBytes(headerSize);
        peekable.reset();

        Optional<Codec> codec = codecs.findCodec(header, null);
        if (codec.isPresent()) {
            peekable.mark(peekLimit);
            // Left open: closing the decoder would close the caller's stream.
            InputStream decoder = decode(codec.get(), new PeekLimitInputStream(peekable, peekLimit), "input stream");
            header = readDecodedHeader(decoder, "input stream");
            peekable.reset();
        }

        FormatId format = detectFormat(header, null, "input stream");
        return new FormattedInput(peekable, format, codec.map(Codec::codingId));
    }

    private static InputStream decode(Codec codec, InputStream encoded, String resource) {
        try {
            return codec.decode(encoded);
        } catch (IOException e) {
            throw new FormatDetectionException(resource, "not " + codec.codingId() + " coded", e);
        }
    }

    private byte[] readDecodedHeader(InputStream decoded, String resource) {
        try {
            return decoded.readNBytes(headerSize);
        } catch (IOException e) {
            throw new FormatDetectionException(resource, "cannot decode header", e);
        }
    }

    private FormatId detectFormat(byte[] header, String filename, String resource) throws IOException {
        MediaType mediaType = detectMediaType(header, filename);
        String mimeType = MediaType.OCTET_STREAM.equals(mediaType) ? null : mediaType.getBaseType().toString();

        Optional<FormatId> matched = criteria.entrySet().stream()
                .filter(e -> e.getValue().matches(mimeType, filename, header))
                .max(Comparator.comparingInt(e -> e.getValue().priority()))
                .map(Map.Entry::getKey);
        if (matched.isPresent()) {
            return matched.get();
        }
        if (mimeType != null) {
            return FormatId.of(mimeType);
        }
        throw new FormatDetectionException(resource, "unrecognized content");
    }

    private static MediaType detectMediaType(byte[] header, String filename) throws IOException {
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        return DETECTOR.detect(new ByteArrayInputStream(header), metadata);
    }

    /**
     * Stops reading at {@code limit} bytes so that a decoder never invalidates the mark.
     */
    private static final class PeekLimitInputStream extends InputStream {
        private final InputStream in;
        private int remaining;

        PeekLimitInputStream(InputStream in, int limit) {
            this.in = in;
            this.remaining = limit;
        }

        @Override
        public int read() throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int b = in.read();
            if (b >= 0) {
                remaining--;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (remaining <= 0) {
                return -1;
            }
            int n = in.read(b, off, Math.min(len, remaining));
            if (n > 0) {
                remaining -= n;
            }
            return n;
        }
    }
}
