package com.resona.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resona.model.SynthesisRequest;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Canonicalizes synthesis requests for stable cache keys.
 *
 * Steps:
 * 1. Trim and lowercase the text
 * 2. Replace missing voice/format/engine with ""
 * 3. Serialize as JSON with a fixed field order
 * 4. Generate SHA-256 hash
 *
 * Target: Same logical request → same canonical form → same key, across restarts (no salt)
 */
@Component
public class CacheKeyDeriver {

    private final ObjectMapper objectMapper;

    public CacheKeyDeriver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Derive the key for a request.
     *
     * @param request synthesis request
     * @return SHA-256 based key (64 hex chars)
     */
    public CacheKey derive(SynthesisRequest request) {
        return derive(request.getText(), request.getVoiceId(), request.getOutputFormat(), request.getEngine());
    }

    /**
     * Derive the key for the given request parameters. Empty text is valid and yields its own key.
     */
    public CacheKey derive(String text, String voiceId, String format, String engine) {
        return new CacheKey(DigestUtils.sha256Hex(canonicalize(text, voiceId, format, engine)));
    }

    /**
     * Canonical JSON form hashed by {@link #derive}. Field order is fixed alphabetically.
     */
    public String canonicalize(String text, String voiceId, String format, String engine) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("engine", nullToEmpty(engine));
        node.put("format", nullToEmpty(format));
        node.put("text", normalizeText(text));
        node.put("voice", nullToEmpty(voiceId));

        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // ObjectNode of plain strings always serializes
            throw new IllegalStateException("Failed to serialize canonical request", e);
        }
    }

    static String normalizeText(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
