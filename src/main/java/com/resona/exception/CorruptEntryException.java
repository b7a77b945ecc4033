package com.resona.exception;

/**
 * A persisted cache record could not be read back. Never leaves the tier that detected it.
 */
public class CorruptEntryException extends ResonaException {

    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
