package com.resona.exception;

import java.time.Duration;

/**
 * A caller waited longer than its timeout for audio generation to finish.
 */
public class GenerationTimeoutException extends ResonaException {

    public GenerationTimeoutException(String cacheKey, Duration timeout) {
        super("Audio generation for key " + cacheKey + " did not complete within " + timeout.toMillis() + "ms");
    }
}
