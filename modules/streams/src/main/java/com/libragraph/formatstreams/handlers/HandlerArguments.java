package com.libragraph.formatstreams.handlers;

import java.util.Optional;

/**
 * Picks typed values out of the extra arguments passed to a stream constructor.
 */
final class HandlerArguments {

    private HandlerArguments() {
    }

    /**
     * First argument of the given type, if any.
     *
     * @throws IllegalArgumentException if an argument is of none of the accepted types
     */
    static <T> Optional<T> find(Object[] args, Class<T> type, Class<?>... accepted) {
        if (args == null) {
            return Optional.empty();
        }
        T found = null;
        for (Object arg : args) {
            if (type.isInstance(arg)) {
                if (found == null) {
                    found = type.cast(arg);
                }
            } else if (!isAccepted(arg, accepted)) {
                throw new IllegalArgumentException("Unexpected stream argument: " + arg);
            }
        }
        return Optional.ofNullable(found);
    }

    private static boolean isAccepted(Object arg, Class<?>[] accepted) {
        for (Class<?> type : accepted) {
            if (type.isInstance(arg)) {
                return true;
            }
        }
        return false;
    }
}
