package com.resona.cache;

/**
 * Produces the audio for a key on a full cache miss.
 */
@FunctionalInterface
public interface AudioGenerator {

    /**
     * @param key key being generated
     * @return audio bytes, never null
     */
    byte[] generate(CacheKey key);
}
