package com.resona.model;

/**
 * HTTP headers carrying cache provenance for synthesized audio.
 */
public class CacheHeaders {

    /**
     * Where the payload came from.
     * Values: "memory", "disk", "remote", "generated"
     */
    public static final String CACHE_SOURCE = "x-cache-source";

    /**
     * Content-addressed key of the payload (64 hex chars).
     */
    public static final String CACHE_KEY = "x-cache-key";

    /**
     * URL the audio can be fetched from afterwards (edge or direct).
     */
    public static final String DELIVERY_URL = "x-delivery-url";

    private CacheHeaders() {
    }
}
