package com.libragraph.formatstreams.api;

/**
 * Thrown when a resource's format cannot be inferred.
 */
public class FormatDetectionException extends RuntimeException {

    private final String resource;

    public FormatDetectionException(String resource, String message) {
        super("Cannot classify " + resource + ": " + message);
        this.resource = resource;
    }

    public FormatDetectionException(String resource, String message, Throwable cause) {
        super("Cannot classify " + resource + ": " + message, cause);
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
