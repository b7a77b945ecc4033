package com.resona.exception;

/**
 * Raised on a full cache miss while synthesis is degraded to cache-only mode.
 */
public class GenerationUnavailableException extends ResonaException {

    public GenerationUnavailableException(String message) {
        super(message);
    }
}
