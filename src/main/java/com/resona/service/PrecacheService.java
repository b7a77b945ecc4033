package com.resona.service;

import com.resona.config.ResonaProperties;
import com.resona.model.AudioResult;
import com.resona.model.SynthesisRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Warms the cache with common alert phrases in every configured voice.
 */
@Slf4j
@Service
public class PrecacheService {

    private final AudioSynthesisService synthesisService;
    private final ResonaProperties properties;

    public PrecacheService(AudioSynthesisService synthesisService, ResonaProperties properties) {
        this.synthesisService = synthesisService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getPrecache().isEnabled()) {
            precacheCommonAlerts();
        }
    }

    /**
     * @return number of alert/voice pairs now cached
     */
    public int precacheCommonAlerts() {
        ResonaProperties.PrecacheConfig config = properties.getPrecache();
        log.info("Pre-caching {} alerts x {} voices", config.getAlerts().size(), config.getVoices().size());

        int cached = 0;
        int generated = 0;
        for (String text : config.getAlerts()) {
            for (String voice : config.getVoices()) {
                try {
                    AudioResult result = synthesisService.synthesize(SynthesisRequest.builder()
                            .text(text)
                            .voiceId(voice)
                            .build());
                    cached++;
                    if (!result.getSource().fromCache()) {
                        generated++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to pre-cache '{}' with voice {}: {}", text, voice, e.getMessage());
                }
            }
        }
        log.info("Pre-cached {} alert audio entries ({} newly generated)", cached, generated);
        return cached;
    }
}
