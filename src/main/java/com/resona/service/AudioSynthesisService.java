package com.resona.service;

import com.resona.cache.CacheKey;
import com.resona.cache.CacheKeyDeriver;
import com.resona.cache.CacheResult;
import com.resona.cache.CacheStats;
import com.resona.cache.TieredCacheManager;
import com.resona.config.ResonaProperties;
import com.resona.edge.EdgeDeliveryProvider;
import com.resona.failover.DegradedModeFlags;
import com.resona.model.AudioResult;
import com.resona.model.SynthesisRequest;
import com.resona.synthesis.SynthesisProviderRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Main synthesis service that orchestrates key derivation, tiered cache lookup and provider
 * routing, and builds the delivery URL for the result.
 */
@Slf4j
@Service
public class AudioSynthesisService {

    static final String DIRECT_PATH = "/v1/speech/";

    private final TieredCacheManager cacheManager;
    private final CacheKeyDeriver keyDeriver;
    private final SynthesisProviderRouter router;
    private final EdgeDeliveryProvider edgeDelivery;
    private final DegradedModeFlags flags;
    private final ResonaProperties properties;

    public AudioSynthesisService(
            TieredCacheManager cacheManager,
            CacheKeyDeriver keyDeriver,
            SynthesisProviderRouter router,
            EdgeDeliveryProvider edgeDelivery,
            DegradedModeFlags flags,
            ResonaProperties properties) {
        this.cacheManager = cacheManager;
        this.keyDeriver = keyDeriver;
        this.router = router;
        this.edgeDelivery = edgeDelivery;
        this.flags = flags;
        this.properties = properties;
    }

    /**
     * Return audio for the request, from cache when possible.
     */
    public AudioResult synthesize(SynthesisRequest request) {
        SynthesisRequest resolved = withDefaults(request);
        CacheKey key = keyDeriver.derive(resolved);

        log.debug("Synthesis request: key={}, voice={}, format={}, engine={}",
                key, resolved.getVoiceId(), resolved.getOutputFormat(), resolved.getEngine());

        CacheResult result = cacheManager.getOrCreate(key,
                k -> router.synthesize(resolved.getText().trim(), resolved.getVoiceId(),
                        resolved.getOutputFormat(), resolved.getEngine()),
                properties.getCache().getGenerationTimeout());

        log.info("Serving audio for {} from {}", key, result.source().label());
        return toAudioResult(result, resolved.getOutputFormat());
    }

    /**
     * Cache-only lookup; never synthesizes. The key does not reveal the requested format,
     * so the content type comes from the payload itself.
     */
    public Optional<AudioResult> lookup(CacheKey key) {
        return cacheManager.lookup(key)
                .map(result -> toAudioResult(result, detectFormat(result.payload())));
    }

    /**
     * Remove the key from every tier and from the edge. Edge failure is logged only.
     */
    public void invalidate(CacheKey key) {
        cacheManager.invalidate(key);
        try {
            edgeDelivery.invalidate("/" + properties.getCache().getRemote().getPrefix() + key.value());
        } catch (RuntimeException e) {
            log.warn("Edge invalidation failed for {}: {}", key, e.getMessage());
        }
    }

    public CacheStats getStats() {
        return cacheManager.getStats();
    }

    public String deliveryUrl(CacheKey key) {
        if (flags.isEdgeBypassed()) {
            return DIRECT_PATH + key.value();
        }
        return edgeDelivery.urlFor(properties.getCache().getRemote().getPrefix() + key.value())
                .orElse(DIRECT_PATH + key.value());
    }

    static String contentType(String format) {
        if (format == null) {
            return "application/octet-stream";
        }
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "mp3" -> "audio/mpeg";
            case "ogg_vorbis" -> "audio/ogg";
            case "pcm" -> "audio/pcm";
            default -> "application/octet-stream";
        };
    }

    /**
     * Output format of a synthesized payload: MP3 starts with an ID3 tag or a frame sync,
     * Ogg with its capture pattern. Anything else is headerless PCM.
     */
    static String detectFormat(byte[] payload) {
        if (payload.length >= 3 && payload[0] == 'I' && payload[1] == 'D' && payload[2] == '3') {
            return "mp3";
        }
        if (payload.length >= 2 && (payload[0] & 0xFF) == 0xFF && (payload[1] & 0xE0) == 0xE0) {
            return "mp3";
        }
        if (payload.length >= 4 && payload[0] == 'O' && payload[1] == 'g' && payload[2] == 'g' && payload[3] == 'S') {
            return "ogg_vorbis";
        }
        return "pcm";
    }

    private SynthesisRequest withDefaults(SynthesisRequest request) {
        if (request == null || request.getText() == null) {
            throw new IllegalArgumentException("text is required");
        }
        if (request.getVoiceId() != null && request.getVoiceId().isBlank()) {
            throw new IllegalArgumentException("voice_id must not be blank");
        }
        ResonaProperties.SynthesisConfig defaults = properties.getSynthesis();
        return request.toBuilder()
                .voiceId(request.getVoiceId() != null ? request.getVoiceId() : defaults.getDefaultVoice())
                .outputFormat(isBlank(request.getOutputFormat()) ? defaults.getDefaultFormat() : request.getOutputFormat())
                .engine(isBlank(request.getEngine()) ? defaults.getDefaultEngine() : request.getEngine())
                .build();
    }

    private AudioResult toAudioResult(CacheResult result, String format) {
        return AudioResult.builder()
                .cacheKey(result.key())
                .payload(result.payload())
                .source(result.source())
                .contentType(contentType(format))
                .deliveryUrl(deliveryUrl(result.key()))
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
