package com.resona.exception;

/**
 * Audio generation for a cache key failed. Every caller coalesced onto the same
 * generation receives the same instance.
 */
public class AudioGenerationException extends ResonaException {

    private final String cacheKey;

    public AudioGenerationException(String cacheKey, Throwable cause) {
        super("Audio generation failed for key " + cacheKey + ": " + describe(cause), cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
