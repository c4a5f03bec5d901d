package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.types.FormatId;

import java.util.Map;

/**
 * Service provider that contributes handlers to a registry.
 *
 * Implementations are listed in {@code META-INF/services} and picked up when the global
 * registry is bootstrapped.
 */
public interface StreamHandlerProvider {

    /**
     * Registers this provider's handlers and their constructors.
     */
    void register(StreamerRegistry registry);

    /**
     * Detection hints for the formats this provider streams, used by the default detector.
     */
    default Map<FormatId, DetectionCriteria> detectionCriteria() {
        return Map.of();
    }
}
