package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.Codec;
import com.libragraph.formatstreams.types.CodingId;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Codecs by coding id. Matches raw data to a codec and hands out decoders.
 */
public class CodecRegistry {

    private static final Logger log = Logger.getLogger(CodecRegistry.class);

    private final Map<CodingId, Codec> codecs = new LinkedHashMap<>();

    /**
     * Registry holding every codec listed in {@code META-INF/services}.
     */
    public static CodecRegistry loadInstalled() {
        CodecRegistry registry = new CodecRegistry();
        for (Codec codec : ServiceLoader.load(Codec.class)) {
            registry.register(codec);
        }
        log.debugf("CodecRegistry loaded %d installed codecs", registry.codecs.size());
        return registry;
    }

    public static CodecRegistry of(Codec... codecs) {
        CodecRegistry registry = new CodecRegistry();
        for (Codec codec : codecs) {
            registry.register(codec);
        }
        return registry;
    }

    public void register(Codec codec) {
        CodingId coding = codec.codingId();
        Codec existing = codecs.putIfAbsent(coding, codec);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate codec for '" + coding + "': " +
                            existing.getClass().getName() + " and " + codec.getClass().getName());
        }
    }

    /**
     * Codec that removes {@code coding}.
     *
     * @throws UnknownCodingException if none is registered
     */
    public Codec transformFor(CodingId coding) {
        Codec codec = codecs.get(coding);
        if (codec == null) {
            throw new UnknownCodingException(coding);
        }
        return codec;
    }

    /**
     * Finds a codec matching the given header and filename.
     */
    public Optional<Codec> findCodec(byte[] header, String filename) {
        return codecs.values().stream()
                .filter(c -> c.matches(header, filename))
                .findFirst();
    }

    public Collection<Codec> codecs() {
        return List.copyOf(codecs.values());
    }
}
