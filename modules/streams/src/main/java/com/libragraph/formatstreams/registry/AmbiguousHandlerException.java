package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when several handlers serve a format and no favorite singles one out.
 */
public class AmbiguousHandlerException extends StreamRegistryException {

    private final FormatId format;
    private final List<StreamHandler> candidates;

    public AmbiguousHandlerException(FormatId format, List<StreamHandler> candidates) {
        super("Ambiguous streamer for " + format + ", candidates: "
                + candidates.stream().map(StreamHandler::name).collect(Collectors.joining(", "))
                + ". Prefer one with setFormatFavorite or setGlobalFavorite");
        this.format = format;
        this.candidates = List.copyOf(candidates);
    }

    public FormatId format() {
        return format;
    }

    /**
     * Every handler that was considered, in registration order.
     */
    public List<StreamHandler> candidates() {
        return candidates;
    }
}
