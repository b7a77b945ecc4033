package com.resona.model;

import com.resona.cache.CacheKey;
import com.resona.cache.CacheSource;
import lombok.Builder;
import lombok.Value;

/**
 * Synthesized (or cached) audio together with its provenance.
 */
@Value
@Builder
public class AudioResult {
    CacheKey cacheKey;
    byte[] payload;
    CacheSource source;
    String contentType;
    String deliveryUrl;
}
