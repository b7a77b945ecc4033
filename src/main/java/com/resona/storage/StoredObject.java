package com.resona.storage;

import java.time.Instant;

/**
 * Object bytes as read from durable storage.
 */
public record StoredObject(byte[] payload, Instant lastModified) {
}
