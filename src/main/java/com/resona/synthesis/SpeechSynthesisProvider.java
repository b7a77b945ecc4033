package com.resona.synthesis;

/**
 * Interface for speech synthesis providers.
 * Implementations handle provider-specific request mapping and API communication.
 */
public interface SpeechSynthesisProvider {

    /**
     * Get provider name (e.g., "polly-ap-south-1").
     *
     * @return provider name
     */
    String getName();

    /**
     * Synthesize speech.
     *
     * @param text    text to speak
     * @param voiceId provider voice identifier
     * @param format  output format (mp3, ogg_vorbis, pcm)
     * @param engine  synthesis engine (standard, neural)
     * @return audio bytes
     * @throws com.resona.exception.TransientDependencyException provider unreachable or throttled
     * @throws com.resona.exception.FatalSynthesisException      provider rejected the request
     */
    byte[] synthesize(String text, String voiceId, String format, String engine);

    /**
     * Verify the provider answers at all. Throws when it does not.
     */
    void checkAvailable();
}
