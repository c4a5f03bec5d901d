package com.libragraph.formatstreams.registry;

import com.libragraph.formatstreams.types.CodingId;

/**
 * Thrown when no codec is installed for a coding.
 */
public class UnknownCodingException extends RuntimeException {

    private final CodingId coding;

    public UnknownCodingException(CodingId coding) {
        super("No codec installed for coding " + coding);
        this.coding = coding;
    }

    public CodingId coding() {
        return coding;
    }
}
