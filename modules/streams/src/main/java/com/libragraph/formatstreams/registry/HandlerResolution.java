package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.api.StreamHandler;
import com.libragraph.formatstreams.types.FormatId;

import java.util.List;

/**
 * Outcome of resolving a format to a handler.
 *
 * Lets callers branch on ambiguity or absence (e.g. prompt for a choice) without catching
 * exceptions; {@link #orElseThrow()} converts the failures into the matching exception.
 */
public sealed interface HandlerResolution
        permits HandlerResolution.Resolved, HandlerResolution.Ambiguous, HandlerResolution.Unregistered {

    FormatId format();

    /**
     * The chosen handler.
     *
     * @throws AmbiguousHandlerException    if several candidates remain
     * @throws NoHandlerRegisteredException if nothing is registered for the format
     */
    StreamHandler orElseThrow();

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    /**
     * How a handler was chosen.
     */
    enum Reason {
        FORMAT_FAVORITE,
        ONLY_CANDIDATE,
        GLOBAL_FAVORITE
    }

    record Resolved(FormatId format, StreamHandler handler, Reason reason) implements HandlerResolution {
        @Override
        public StreamHandler orElseThrow() {
            return handler;
        }
    }

    record Ambiguous(FormatId format, List<StreamHandler> candidates) implements HandlerResolution {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }

        @Override
        public StreamHandler orElseThrow() {
            throw new AmbiguousHandlerException(format, candidates);
        }
    }

    record Unregistered(FormatId format) implements HandlerResolution {
        @Override
        public StreamHandler orElseThrow() {
            throw new NoHandlerRegisteredException(format);
        }
    }
}
