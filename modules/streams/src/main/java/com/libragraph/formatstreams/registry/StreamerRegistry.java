package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamConstructor;
import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.config.RegistryBootstrap;
import com.libragraph.formatstreams.config.StreamsConfig;
import com.libragraph.formatstreams.types.FormatId;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Catalog of stream handlers per format, with per-format and global preferences.
 *
 * <p>Resolution order for a format: the per-format favorite; otherwise the single
 * registered handler; otherwise the single registered handler that is also a global
 * favorite. Anything else is ambiguous.
 *
 * <p>Registrations are expected during initialization, before concurrent lookups start.
 * The registry does no locking: concurrent mutation needs external synchronization.
 */
public class StreamerRegistry {

    private static final Logger log = Logger.getLogger(StreamerRegistry.class);

    private final Map<FormatId, List<StreamHandler>> handlersByFormat = new LinkedHashMap<>();
    private final Map<FormatId, StreamHandler> favoriteByFormat = new HashMap<>();
    private final Set<StreamHandler> globalFavorites = new LinkedHashSet<>();
    private final Map<ConstructorKey, StreamConstructor> constructors = new HashMap<>();

    /**
     * Process-wide registry, bootstrapped from installed providers and configuration on
     * first access.
     */
    public static StreamerRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Registers {@code handler} for {@code format}, after any handler already registered.
     *
     * @throws DuplicateRegistrationException if it is already registered for the format
     */
    public void register(FormatId format, StreamHandler handler) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(handler, "handler");
        List<StreamHandler> handlers = handlersByFormat.computeIfAbsent(format, f -> new ArrayList<>());
        if (handlers.contains(handler)) {
            throw new DuplicateRegistrationException(format, handler);
        }
        handlers.add(handler);
        log.debugf("Registered streamer %s for %s", handler.name(), format);
        if (handlers.size() > 1) {
            log.infof("%s has multiple registered streamers: %s", format, names(handlers));
        }
    }

    public void register(String format, StreamHandler handler) {
        register(FormatId.of(format), handler);
    }

    /**
     * Registers {@code handler} for {@code format} together with the constructor used
     * when it is chosen.
     */
    public void register(FormatId format, StreamHandler handler, StreamConstructor constructor) {
        register(format, handler);
        defineConstructor(handler, format, constructor);
    }

    /**
     * Sets the constructor invoked when {@code handler} is chosen for {@code format}.
     */
    public void defineConstructor(StreamHandler handler, FormatId format, StreamConstructor constructor) {
        Objects.requireNonNull(constructor, "constructor");
        StreamConstructor previous = constructors.put(new ConstructorKey(handler, format), constructor);
        if (previous != null) {
            log.warnf("Replacing stream constructor of %s for %s", handler.name(), format);
        }
    }

    /**
     * Makes {@code handler} the default whenever a format it serves is otherwise ambiguous.
     *
     * @throws AlreadyGlobalFavoriteException if it is already globally preferred
     */
    public void setGlobalFavorite(StreamHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (!globalFavorites.add(handler)) {
            throw new AlreadyGlobalFavoriteException(handler);
        }
        log.debugf("Streamer %s is now globally preferred", handler.name());
    }

    /**
     * Makes {@code handler} the choice for {@code format}, above any global favorite.
     * Replacing an existing favorite is allowed and logged.
     *
     * @throws UnregisteredHandlerPreferenceException if it is not registered for the format
     */
    public void setFormatFavorite(StreamHandler handler, FormatId format) {
        Objects.requireNonNull(handler, "handler");
        if (!handlersFor(format).contains(handler)) {
            throw new UnregisteredHandlerPreferenceException(format, handler);
        }
        StreamHandler previous = favoriteByFormat.put(format, handler);
        if (previous != null) {
            log.warnf("Replacing preferred streamer for %s: %s -> %s", format, previous.name(), handler.name());
        }
    }

    public void setFormatFavorite(StreamHandler handler, String format) {
        setFormatFavorite(handler, FormatId.of(format));
    }

    /**
     * Chooses the handler for {@code format}.
     *
     * @throws NoHandlerRegisteredException if nothing is registered for it
     * @throws AmbiguousHandlerException    if no preference singles out one candidate
     */
    public StreamHandler resolve(FormatId format) {
        return tryResolve(format).orElseThrow();
    }

    public StreamHandler resolve(String format) {
        return resolve(FormatId.of(format));
    }

    /**
     * Same algorithm as {@link #resolve(FormatId)}, reporting failures as values.
     */
    public HandlerResolution tryResolve(FormatId format) {
        Objects.requireNonNull(format, "format");
        StreamHandler favorite = favoriteByFormat.get(format);
        if (favorite != null) {
            return new HandlerResolution.Resolved(format, favorite, HandlerResolution.Reason.FORMAT_FAVORITE);
        }

        List<StreamHandler> candidates = handlersFor(format);
        if (candidates.isEmpty()) {
            return new HandlerResolution.Unregistered(format);
        }
        if (candidates.size() == 1) {
            return new HandlerResolution.Resolved(format, candidates.get(0), HandlerResolution.Reason.ONLY_CANDIDATE);
        }

        List<StreamHandler> favored = candidates.stream()
                .filter(globalFavorites::contains)
                .collect(Collectors.toList());
        if (favored.size() == 1) {
            return new HandlerResolution.Resolved(format, favored.get(0), HandlerResolution.Reason.GLOBAL_FAVORITE);
        }
        return new HandlerResolution.Ambiguous(format, candidates);
    }

    /**
     * Handlers registered for {@code format}, in registration order.
     */
    public List<StreamHandler> handlersFor(FormatId format) {
        return List.copyOf(handlersByFormat.getOrDefault(format, List.of()));
    }

    /**
     * Formats with at least one registered handler, in first-registration order.
     */
    public Set<FormatId> formats() {
        return handlersByFormat.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Every registered handler, whatever the format.
     */
    public Set<StreamHandler> handlers() {
        return handlersByFormat.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Optional<StreamHandler> formatFavorite(FormatId format) {
        return Optional.ofNullable(favoriteByFormat.get(format));
    }

    public Set<StreamHandler> globalFavorites() {
        return Set.copyOf(globalFavorites);
    }

    public Optional<StreamConstructor> constructorFor(StreamHandler handler, FormatId format) {
        return Optional.ofNullable(constructors.get(new ConstructorKey(handler, format)));
    }

    /**
     * Runs {@code action} against a registry holding only what {@code setup} registers.
     * The previous state is restored afterwards, also when {@code setup} or {@code action} throws.
     */
    public <R> R withTemporaryRegistrations(Consumer<StreamerRegistry> setup, Supplier<R> action) {
        State saved = snapshot();
        clear();
        try {
            setup.accept(this);
            return action.get();
        } finally {
            restore(saved);
        }
    }

    public void withTemporaryRegistrations(Consumer<StreamerRegistry> setup, Runnable action) {
        withTemporaryRegistrations(setup, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Removes every registration, preference and constructor.
     */
    public void clear() {
        handlersByFormat.clear();
        favoriteByFormat.clear();
        globalFavorites.clear();
        constructors.clear();
    }

    private State snapshot() {
        Map<FormatId, List<StreamHandler>> handlers = new LinkedHashMap<>();
        handlersByFormat.forEach((format, list) -> handlers.put(format, new ArrayList<>(list)));
        return new State(handlers, new HashMap<>(favoriteByFormat),
                new LinkedHashSet<>(globalFavorites), new HashMap<>(constructors));
    }

    private void restore(State state) {
        clear();
        handlersByFormat.putAll(state.handlersByFormat());
        favoriteByFormat.putAll(state.favoriteByFormat());
        globalFavorites.addAll(state.globalFavorites());
        constructors.putAll(state.constructors());
    }

    private static String names(List<StreamHandler> handlers) {
        return handlers.stream().map(StreamHandler::name).collect(Collectors.joining(", "));
    }

    private record ConstructorKey(StreamHandler handler, FormatId format) {
    }

    private record State(
            Map<FormatId, List<StreamHandler>> handlersByFormat,
            Map<FormatId, StreamHandler> favoriteByFormat,
            Set<StreamHandler> globalFavorites,
            Map<ConstructorKey, StreamConstructor> constructors
    ) {
    }

    private static final class GlobalHolder {
        static final StreamerRegistry INSTANCE =
                RegistryBootstrap.initialize(new StreamerRegistry(), StreamsConfig.load());
    }
}
