package com.resona.exception;

/**
 * Invalid cache or health configuration detected at startup.
 */
public class CacheConfigurationException extends ResonaException {

    public CacheConfigurationException(String message) {
        super(message);
    }
}
