package com.libragraph.formatstreams.handlers;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.registry.StreamHandlerProvider;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.types.FormatId;

import java.util.Map;

/**
 * Registers the handlers shipped with the library.
 */
public class BuiltinStreamHandlers implements StreamHandlerProvider {

    @Override
    public void register(StreamerRegistry registry) {
        registry.register(FvecStreamer.FORMAT, FvecStreamer.INSTANCE, FvecStreamer::open);
        registry.register(TextLineStreamer.FORMAT, TextLineStreamer.INSTANCE, TextLineStreamer::open);
    }

    @Override
    public Map<FormatId, DetectionCriteria> detectionCriteria() {
        return Map.of(
                FvecStreamer.FORMAT, FvecStreamer.detectionCriteria(),
                TextLineStreamer.FORMAT, TextLineStreamer.detectionCriteria()
        );
    }
}
