package com.resona.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resona.cache.AudioGenerator;
import com.resona.cache.CacheKey;
import com.resona.cache.CacheKeyDeriver;
import com.resona.cache.CacheResult;
import com.resona.cache.CacheSource;
import com.resona.cache.TieredCacheManager;
import com.resona.config.ResonaProperties;
import com.resona.edge.EdgeDeliveryProvider;
import com.resona.exception.TransientDependencyException;
import com.resona.failover.DegradedModeFlags;
import com.resona.model.AudioResult;
import com.resona.model.SynthesisRequest;
import com.resona.synthesis.SynthesisProviderRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for AudioSynthesisService.
 */
class AudioSynthesisServiceTest {

    private static final byte[] AUDIO = {1, 2, 3};

    private TieredCacheManager cacheManager;
    private CacheKeyDeriver keyDeriver;
    private SynthesisProviderRouter router;
    private EdgeDeliveryProvider edge;
    private DegradedModeFlags flags;
    private ResonaProperties properties;
    private AudioSynthesisService service;

    @BeforeEach
    void setUp() {
        cacheManager = mock(TieredCacheManager.class);
        keyDeriver = new CacheKeyDeriver(new ObjectMapper());
        router = mock(SynthesisProviderRouter.class);
        edge = mock(EdgeDeliveryProvider.class);
        when(edge.urlFor(anyString())).thenAnswer(inv -> Optional.of("https://d123.cloudfront.net/" + inv.getArgument(0)));
        flags = mock(DegradedModeFlags.class);
        properties = new ResonaProperties();
        service = new AudioSynthesisService(cacheManager, keyDeriver, router, edge, flags, properties);

        when(cacheManager.getOrCreate(any(), any(), any())).thenAnswer(inv -> {
            CacheKey key = inv.getArgument(0);
            AudioGenerator generator = inv.getArgument(1);
            return new CacheResult(key, generator.generate(key), CacheSource.GENERATED);
        });
        when(router.synthesize(anyString(), anyString(), anyString(), anyString())).thenReturn(AUDIO);
    }

    @Test
    void testDefaultsAreAppliedBeforeKeyDerivation() {
        AudioResult result = service.synthesize(SynthesisRequest.builder().text("Tornado warning").build());

        CacheKey expected = keyDeriver.derive("Tornado warning", "Joanna", "mp3", "neural");
        assertEquals(expected, result.getCacheKey());
        assertEquals("audio/mpeg", result.getContentType());
        assertEquals(CacheSource.GENERATED, result.getSource());
        verify(router).synthesize("Tornado warning", "Joanna", "mp3", "neural");
    }

    @Test
    void testGeneratorSynthesizesTrimmedText() {
        service.synthesize(SynthesisRequest.builder()
                .text("  Evacuate now  ")
                .voiceId("Matthew")
                .outputFormat("ogg_vorbis")
                .engine("standard")
                .build());

        verify(router).synthesize("Evacuate now", "Matthew", "ogg_vorbis", "standard");
    }

    @Test
    void testUsesConfiguredGenerationTimeout() {
        properties.getCache().setGenerationTimeout(Duration.ofSeconds(12));

        service.synthesize(SynthesisRequest.builder().text("Flood alert").build());

        ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);
        verify(cacheManager).getOrCreate(any(), any(), timeout.capture());
        assertEquals(Duration.ofSeconds(12), timeout.getValue());
    }

    @Test
    void testMissingTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.synthesize(new SynthesisRequest()));
        assertThrows(IllegalArgumentException.class, () -> service.synthesize(null));
    }

    @Test
    void testBlankVoiceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.synthesize(
                SynthesisRequest.builder().text("Alert").voiceId("  ").build()));
    }

    @Test
    void testEmptyTextIsAllowed() {
        AudioResult result = service.synthesize(SynthesisRequest.builder().text("").build());

        assertArrayEquals(AUDIO, result.getPayload());
    }

    @Test
    void testDeliveryUrlUsesEdgeDomain() {
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "mp3", "neural");

        assertEquals("https://d123.cloudfront.net/audio-cache/" + key.value(), service.deliveryUrl(key));
    }

    @Test
    void testDeliveryUrlIsDirectWhileEdgeBypassed() {
        when(flags.isEdgeBypassed()).thenReturn(true);
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "mp3", "neural");

        assertEquals("/v1/speech/" + key.value(), service.deliveryUrl(key));
    }

    @Test
    void testDeliveryUrlIsDirectWithoutEdgeDomain() {
        when(edge.urlFor(anyString())).thenReturn(Optional.empty());
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "mp3", "neural");

        assertEquals("/v1/speech/" + key.value(), service.deliveryUrl(key));
    }

    @Test
    void testInvalidateToleratesEdgeFailure() {
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "mp3", "neural");
        doThrow(new TransientDependencyException("cloudfront", "throttled")).when(edge).invalidate(anyString());

        assertDoesNotThrow(() -> service.invalidate(key));

        verify(cacheManager).invalidate(key);
        verify(edge).invalidate("/audio-cache/" + key.value());
    }

    @Test
    void testLookupNeverGenerates() {
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "mp3", "neural");
        when(cacheManager.lookup(key)).thenReturn(Optional.empty());

        assertTrue(service.lookup(key).isEmpty());
        verify(cacheManager, never()).getOrCreate(any(), any(), any());
    }

    @Test
    void testContentTypes() {
        assertEquals("audio/mpeg", AudioSynthesisService.contentType("mp3"));
        assertEquals("audio/ogg", AudioSynthesisService.contentType("ogg_vorbis"));
        assertEquals("audio/pcm", AudioSynthesisService.contentType("PCM"));
        assertEquals("application/octet-stream", AudioSynthesisService.contentType("flac"));
    }

    @Test
    void testLookupServesContentTypeOfStoredPayload() {
        CacheKey key = keyDeriver.derive("Alert", "Joanna", "ogg_vorbis", "neural");
        byte[] ogg = {'O', 'g', 'g', 'S', 0, 2};
        when(cacheManager.lookup(key)).thenReturn(Optional.of(new CacheResult(key, ogg, CacheSource.DISK)));

        AudioResult result = service.lookup(key).orElseThrow();

        assertEquals("audio/ogg", result.getContentType());
        assertEquals(CacheSource.DISK, result.getSource());
    }

    @Test
    void testDetectFormat() {
        assertEquals("mp3", AudioSynthesisService.detectFormat(new byte[]{'I', 'D', '3', 4, 0}));
        assertEquals("mp3", AudioSynthesisService.detectFormat(new byte[]{(byte) 0xFF, (byte) 0xFB, (byte) 0x90}));
        assertEquals("ogg_vorbis", AudioSynthesisService.detectFormat(new byte[]{'O', 'g', 'g', 'S'}));
        assertEquals("pcm", AudioSynthesisService.detectFormat(new byte[]{12, -3, 40, 7}));
        assertEquals("pcm", AudioSynthesisService.detectFormat(new byte[0]));
    }
}
