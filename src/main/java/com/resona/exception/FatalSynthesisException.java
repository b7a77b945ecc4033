package com.resona.exception;

/**
 * The synthesis provider rejected the request itself (unknown voice, invalid text, ...).
 */
public class FatalSynthesisException extends ResonaException {

    public FatalSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
