package com.libragraph.formatstreams.config;

import com.libragraph.formatstreams.types.FormatId;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Library settings read from MicroProfile Config.
 *
 * @param loadProviders   discover {@code StreamHandlerProvider}s when bootstrapping the global registry
 * @param globalFavorites names of handlers to mark globally preferred
 * @param formatFavorites handler name to prefer, per format
 * @param headerSize      bytes read to detect a format or coding
 * @param peekLimit       bytes an input stream may buffer while its format is detected
 */
public record StreamsConfig(
        boolean loadProviders,
        List<String> globalFavorites,
        Map<FormatId, String> formatFavorites,
        int headerSize,
        int peekLimit
) {
    public static final String LOAD_PROVIDERS = "formatstreams.registry.load-providers";
    public static final String GLOBAL_FAVORITES = "formatstreams.registry.global-favorites";
    public static final String FORMAT_FAVORITES = "formatstreams.registry.format-favorites";
    public static final String HEADER_SIZE = "formatstreams.detect.header-size";
    public static final String PEEK_LIMIT = "formatstreams.detect.peek-limit";

    static final int DEFAULT_HEADER_SIZE = 512;
    static final int DEFAULT_PEEK_LIMIT = 1024 * 1024;

    public StreamsConfig {
        globalFavorites = List.copyOf(globalFavorites);
        formatFavorites = Map.copyOf(formatFavorites);
        if (headerSize <= 0) {
            throw new IllegalArgumentException(HEADER_SIZE + " must be positive, got: " + headerSize);
        }
        if (peekLimit < headerSize) {
            throw new IllegalArgumentException(PEEK_LIMIT + " must be at least " + HEADER_SIZE + ", got: " + peekLimit);
        }
    }

    /**
     * Settings from the application's configuration.
     */
    public static StreamsConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static StreamsConfig defaults() {
        return new StreamsConfig(true, List.of(), Map.of(), DEFAULT_HEADER_SIZE, DEFAULT_PEEK_LIMIT);
    }

    public static StreamsConfig from(Config config) {
        boolean loadProviders = config.getOptionalValue(LOAD_PROVIDERS, Boolean.class).orElse(true);
        List<String> globalFavorites = config.getOptionalValues(GLOBAL_FAVORITES, String.class)
                .orElse(List.of());
        Map<FormatId, String> formatFavorites = parseFormatFavorites(
                config.getOptionalValues(FORMAT_FAVORITES, String.class).orElse(List.of()));
        int headerSize = config.getOptionalValue(HEADER_SIZE, Integer.class).orElse(DEFAULT_HEADER_SIZE);
        int peekLimit = config.getOptionalValue(PEEK_LIMIT, Integer.class).orElse(DEFAULT_PEEK_LIMIT);
        return new StreamsConfig(loadProviders, globalFavorites, formatFavorites, headerSize, peekLimit);
    }

    private static Map<FormatId, String> parseFormatFavorites(List<String> entries) {
        Map<FormatId, String> favorites = new LinkedHashMap<>();
        for (String entry : entries) {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new IllegalArgumentException(
                        FORMAT_FAVORITES + " entries must look like format=handler, got: " + entry);
            }
            favorites.put(FormatId.of(entry.substring(0, eq).trim()), entry.substring(eq + 1).trim());
        }
        return favorites;
    }
}
