package com.resona.service;

import com.resona.cache.CacheSource;
import com.resona.config.ResonaProperties;
import com.resona.exception.GenerationUnavailableException;
import com.resona.model.AudioResult;
import com.resona.model.SynthesisRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Tests for PrecacheService.
 */
class PrecacheServiceTest {

    private AudioSynthesisService synthesisService;
    private ResonaProperties properties;
    private PrecacheService precacheService;

    @BeforeEach
    void setUp() {
        synthesisService = mock(AudioSynthesisService.class);
        properties = new ResonaProperties();
        properties.getPrecache().setAlerts(List.of("Fire alarm", "All clear"));
        properties.getPrecache().setVoices(List.of("Joanna", "Amy"));
        precacheService = new PrecacheService(synthesisService, properties);
        when(synthesisService.synthesize(any())).thenReturn(AudioResult.builder()
                .source(CacheSource.GENERATED)
                .build());
    }

    @Test
    void testEveryAlertAndVoicePairIsSynthesized() {
        assertEquals(4, precacheService.precacheCommonAlerts());

        verify(synthesisService, times(4)).synthesize(any());
        verify(synthesisService).synthesize(SynthesisRequest.builder().text("All clear").voiceId("Amy").build());
    }

    @Test
    void testFailuresAreSkipped() {
        when(synthesisService.synthesize(argThat(r -> r != null && "Amy".equals(r.getVoiceId()))))
                .thenThrow(new GenerationUnavailableException("cache-only"));

        assertEquals(2, precacheService.precacheCommonAlerts());
    }

    @Test
    void testDisabledPrecacheDoesNothingOnStartup() {
        properties.getPrecache().setEnabled(false);

        precacheService.onApplicationReady();

        verifyNoInteractions(synthesisService);
    }

    @Test
    void testEnabledPrecacheRunsOnStartup() {
        properties.getPrecache().setEnabled(true);

        precacheService.onApplicationReady();

        verify(synthesisService, times(4)).synthesize(any());
    }
}
