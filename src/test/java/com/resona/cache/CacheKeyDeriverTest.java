package com.resona.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resona.model.SynthesisRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKeyDeriver.
 */
class CacheKeyDeriverTest {

    private CacheKeyDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new CacheKeyDeriver(new ObjectMapper());
    }

    @Test
    void testDeriveIsDeterministic() {
        CacheKey first = deriver.derive("Emergency alert", "Joanna", "mp3", "neural");
        CacheKey second = deriver.derive("Emergency alert", "Joanna", "mp3", "neural");

        assertEquals(first, second);
        assertEquals(64, first.value().length());
    }

    @Test
    void testDeriveIsStableAcrossInstances() {
        CacheKeyDeriver other = new CacheKeyDeriver(new ObjectMapper());

        assertEquals(deriver.derive("Weather warning issued", "Amy", "mp3", "neural"),
                other.derive("Weather warning issued", "Amy", "mp3", "neural"));
    }

    @Test
    void testTextIsTrimmedAndLowercased() {
        CacheKey plain = deriver.derive("emergency alert", "Joanna", "mp3", "neural");
        CacheKey padded = deriver.derive("  EMERGENCY Alert \n", "Joanna", "mp3", "neural");

        assertEquals(plain, padded);
    }

    @Test
    void testEachFieldChangesTheKey() {
        CacheKey base = deriver.derive("Emergency alert", "Joanna", "mp3", "neural");

        assertNotEquals(base, deriver.derive("Emergency alerts", "Joanna", "mp3", "neural"));
        assertNotEquals(base, deriver.derive("Emergency alert", "Matthew", "mp3", "neural"));
        assertNotEquals(base, deriver.derive("Emergency alert", "Joanna", "ogg_vorbis", "neural"));
        assertNotEquals(base, deriver.derive("Emergency alert", "Joanna", "mp3", "standard"));
    }

    @Test
    void testFieldsDoNotBleedIntoEachOther() {
        // Concatenation without structure would make these collide
        assertNotEquals(deriver.derive("ab", "c", "mp3", "neural"),
                deriver.derive("a", "bc", "mp3", "neural"));
    }

    @Test
    void testEmptyTextYieldsValidDistinctKey() {
        CacheKey empty = deriver.derive("", "Joanna", "mp3", "neural");
        CacheKey whitespace = deriver.derive("   ", "Joanna", "mp3", "neural");

        assertNotNull(empty);
        assertEquals(empty, whitespace);
        assertNotEquals(empty, deriver.derive("a", "Joanna", "mp3", "neural"));
    }

    @Test
    void testDeriveFromRequestMatchesFields() {
        SynthesisRequest request = SynthesisRequest.builder()
                .text("Alert acknowledged")
                .voiceId("Matthew")
                .outputFormat("mp3")
                .engine("neural")
                .build();

        assertEquals(deriver.derive("Alert acknowledged", "Matthew", "mp3", "neural"), deriver.derive(request));
    }

    @Test
    void testCanonicalFormIsFixedOrderJson() {
        String canonical = deriver.canonicalize(" Hello ", "Joanna", "mp3", null);

        assertEquals("{\"engine\":\"\",\"format\":\"mp3\",\"text\":\"hello\",\"voice\":\"Joanna\"}", canonical);
    }

    @Test
    void testParseRejectsMalformedKeys() {
        assertNull(CacheKey.parse("not-a-key"));
        assertNull(CacheKey.parse(null));
        assertNull(CacheKey.parse("A".repeat(64)));
        assertNotNull(CacheKey.parse("a".repeat(64)));
    }
}
