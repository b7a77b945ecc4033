package com.resona.edge;

import java.util.Optional;

/**
 * Content delivery network in front of the durable store.
 */
public interface EdgeDeliveryProvider {

    /**
     * Invalidate a cached path at the edge. Callers treat failure as non-fatal.
     *
     * @param path absolute path, e.g. {@code /audio-cache/<key>}
     */
    void invalidate(String path);

    /**
     * @return edge URL for an object key, empty when no edge domain is configured
     */
    Optional<String> urlFor(String objectKey);
}
