package com.resona.controller;

import com.resona.cache.CacheKey;
import com.resona.model.AudioResult;
import com.resona.model.CacheHeaders;
import com.resona.model.SynthesisRequest;
import com.resona.service.AudioSynthesisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Speech synthesis endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/v1/speech")
public class SpeechController {

    private final AudioSynthesisService synthesisService;

    public SpeechController(AudioSynthesisService synthesisService) {
        this.synthesisService = synthesisService;
    }

    /**
     * Synthesize an alert message, serving cached audio when available.
     */
    @PostMapping
    public ResponseEntity<byte[]> synthesize(@RequestBody SynthesisRequest request) {
        log.debug("Received synthesis request: voice={}, format={}", request.getVoiceId(), request.getOutputFormat());
        return toResponse(synthesisService.synthesize(request));
    }

    /**
     * Serve cached audio by key. Never synthesizes.
     */
    @GetMapping("/{key}")
    public ResponseEntity<byte[]> get(@PathVariable String key) {
        CacheKey cacheKey = CacheKey.parse(key);
        if (cacheKey == null) {
            return ResponseEntity.badRequest().build();
        }
        return synthesisService.lookup(cacheKey)
                .map(this::toResponse)
                .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<byte[]> toResponse(AudioResult result) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(result.getContentType()))
                .header(CacheHeaders.CACHE_SOURCE, result.getSource().label())
                .header(CacheHeaders.CACHE_KEY, result.getCacheKey().value())
                .header(CacheHeaders.DELIVERY_URL, result.getDeliveryUrl())
                .body(result.getPayload());
    }
}
