package com.libragraph.formatstreams.config;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.handlers.BuiltinStreamHandlers;
import com.libragraph.formatstreams.handlers.FvecStreamer;
import com.libragraph.formatstreams.handlers.TextLineStreamer;
import com.libragraph.formatstreams.registry.AmbiguousHandlerException;
import com.libragraph.formatstreams.registry.StreamHandlerProvider;
import com.libragraph.formatstreams.registry.StreamerRegistry;
import com.libragraph.formatstreams.types.FormatId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RegistryBootstrapTest {

    private static final StreamHandler ALT_TEXT = StreamHandler.named("alt-text");

    private final List<StreamHandlerProvider> providers = List.of(
            new BuiltinStreamHandlers(),
            registry -> registry.register(TextLineStreamer.FORMAT, ALT_TEXT));

    private static StreamsConfig config(List<String> globalFavorites, Map<FormatId, String> formatFavorites) {
        return new StreamsConfig(true, globalFavorites, formatFavorites, 512, 4096);
    }

    @Test
    void shouldRegisterProviderHandlers() {
        StreamerRegistry registry = RegistryBootstrap.initialize(
                new StreamerRegistry(), config(List.of(), Map.of()), providers);

        assertThat(registry.resolve(FvecStreamer.FORMAT)).isEqualTo(FvecStreamer.INSTANCE);
        assertThat(registry.handlersFor(TextLineStreamer.FORMAT)).containsExactly(TextLineStreamer.INSTANCE, ALT_TEXT);
        assertThat(registry.constructorFor(FvecStreamer.INSTANCE, FvecStreamer.FORMAT)).isPresent();
        assertThatThrownBy(() -> registry.resolve(TextLineStreamer.FORMAT))
                .isInstanceOf(AmbiguousHandlerException.class);
    }

    @Test
    void shouldApplyGlobalFavorites() {
        StreamerRegistry registry = RegistryBootstrap.initialize(
                new StreamerRegistry(), config(List.of("alt-text"), Map.of()), providers);

        assertThat(registry.resolve(TextLineStreamer.FORMAT)).isEqualTo(ALT_TEXT);
    }

    @Test
    void shouldApplyFormatFavoritesOverGlobal() {
        StreamerRegistry registry = RegistryBootstrap.initialize(new StreamerRegistry(),
                config(List.of("alt-text"), Map.of(TextLineStreamer.FORMAT, "text-lines")), providers);

        assertThat(registry.resolve(TextLineStreamer.FORMAT)).isEqualTo(TextLineStreamer.INSTANCE);
    }

    @Test
    void shouldFailOnUnknownFavorite() {
        assertThatThrownBy(() -> RegistryBootstrap.initialize(
                new StreamerRegistry(), config(List.of("missing"), Map.of()), providers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldSkipProvidersWhenDisabled() {
        StreamsConfig disabled = new StreamsConfig(false, List.of(), Map.of(), 512, 4096);

        StreamerRegistry registry = RegistryBootstrap.initialize(new StreamerRegistry(), disabled);

        assertThat(registry.formats()).isEmpty();
    }

    @Test
    void shouldDiscoverInstalledProviders() {
        assertThat(RegistryBootstrap.installedProviders())
                .hasAtLeastOneElementOfType(BuiltinStreamHandlers.class);
        assertThat(RegistryBootstrap.installedDetectionCriteria())
                .containsKeys(FvecStreamer.FORMAT, TextLineStreamer.FORMAT);
    }

    @Test
    void shouldBootstrapGlobalRegistry() {
        assertThat(StreamerRegistry.global().resolve(FvecStreamer.FORMAT)).isEqualTo(FvecStreamer.INSTANCE);
    }
}
