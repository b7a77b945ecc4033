package com.resona.synthesis;

import com.resona.exception.GenerationUnavailableException;
import com.resona.failover.DegradedModeFlags;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes synthesis to the provider selected by the current synthesis mode:
 * primary when NORMAL, alternate when ALTERNATE, none when CACHE_ONLY.
 */
@Slf4j
public class SynthesisProviderRouter {

    private final SpeechSynthesisProvider primary;
    private final SpeechSynthesisProvider alternate;
    private final DegradedModeFlags flags;

    /**
     * @param alternate may be null when no alternate region is configured
     */
    public SynthesisProviderRouter(SpeechSynthesisProvider primary, SpeechSynthesisProvider alternate,
                                   DegradedModeFlags flags) {
        this.primary = primary;
        this.alternate = alternate;
        this.flags = flags;
        log.info("Initialized SynthesisProviderRouter: primary={}, alternate={}",
                primary.getName(), alternate != null ? alternate.getName() : "none");
    }

    public byte[] synthesize(String text, String voiceId, String format, String engine) {
        SpeechSynthesisProvider provider = activeProvider();
        log.debug("Routing synthesis to provider '{}'", provider.getName());
        return provider.synthesize(text, voiceId, format, engine);
    }

    /**
     * @throws GenerationUnavailableException in cache-only mode
     */
    public SpeechSynthesisProvider activeProvider() {
        return switch (flags.synthesis()) {
            case NORMAL -> primary;
            case ALTERNATE -> alternate != null ? alternate : primary;
            case CACHE_ONLY -> throw new GenerationUnavailableException(
                    "Speech synthesis is disabled (cache-only mode)");
        };
    }
}
