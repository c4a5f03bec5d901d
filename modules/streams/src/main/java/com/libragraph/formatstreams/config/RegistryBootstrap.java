package com.libragraph.formatstreams.config;

import com.libragraph.formatstreams.api.DetectionCriteria;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.registry.StreamHandlerProvider;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.types.FormatId;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Populates a registry from installed {@link StreamHandlerProvider}s and applies the
 * configured preferences.
 */
public final class RegistryBootstrap {

    private static final Logger log = Logger.getLogger(RegistryBootstrap.class);

    private RegistryBootstrap() {
    }

    public static StreamerRegistry initialize(StreamerRegistry registry, StreamsConfig config) {
        return initialize(registry, config, config.loadProviders() ? installedProviders() : List.of());
    }

    /**
     * Registers every provider's handlers, then applies the favorites named in {@code config}.
     *
     * @throws IllegalStateException if a configured favorite names an unknown handler
     */
    public static StreamerRegistry initialize(StreamerRegistry registry, StreamsConfig config,
                                              List<StreamHandlerProvider> providers) {
        for (StreamHandlerProvider provider : providers) {
            provider.register(registry);
            log.debugf("Registered streamers from %s", provider.getClass().getName());
        }

        for (String name : config.globalFavorites()) {
            registry.setGlobalFavorite(handlerNamed(registry, name));
        }
        config.formatFavorites().forEach((format, name) ->
                registry.setFormatFavorite(handlerNamed(registry, name), format));

        log.infof("StreamerRegistry initialized with %d formats and %d streamers",
                registry.formats().size(), registry.handlers().size());
        return registry;
    }

    public static List<StreamHandlerProvider> installedProviders() {
        List<StreamHandlerProvider> providers = new ArrayList<>();
        ServiceLoader.load(StreamHandlerProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * Detection hints of every installed provider. Later providers override earlier ones per format.
     */
    public static Map<FormatId, DetectionCriteria> installedDetectionCriteria() {
        Map<FormatId, DetectionCriteria> criteria = new LinkedHashMap<>();
        for (StreamHandlerProvider provider : installedProviders()) {
            criteria.putAll(provider.detectionCriteria());
        }
        return criteria;
    }

    private static StreamHandler handlerNamed(StreamerRegistry registry, String name) {
        return registry.handlers().stream()
                .filter(h -> h.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Configured favorite streamer '" + name + "' is not registered"));
    }
}
