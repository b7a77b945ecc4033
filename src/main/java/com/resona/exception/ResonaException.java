package com.resona.exception;

/**
 * Base type for all errors raised by the audio cache and its collaborators.
 */
public class ResonaException extends RuntimeException {

    public ResonaException(String message) {
        super(message);
    }

    public ResonaException(String message, Throwable cause) {
        super(message, cause);
    }
}
