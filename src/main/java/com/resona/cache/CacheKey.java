package com.resona.cache;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content-addressed cache key: the lowercase hex SHA-256 of a canonical synthesis request.
 */
public record CacheKey(String value) {

    private static final Pattern HEX_64 = Pattern.compile("[0-9a-f]{64}");

    public CacheKey {
        Objects.requireNonNull(value, "value");
        if (!HEX_64.matcher(value).matches()) {
            throw new IllegalArgumentException("Cache key must be 64 lowercase hex characters: " + value);
        }
    }

    /**
     * Parse an externally supplied key (URL path segment, file name).
     *
     * @return the key, or {@code null} when the text is not a well-formed key
     */
    public static CacheKey parse(String text) {
        if (text == null || !HEX_64.matcher(text).matches()) {
            return null;
        }
        return new CacheKey(text);
    }

    @Override
    public String toString() {
        return value;
    }
}
