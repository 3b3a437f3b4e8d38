package com.critfumble.fumblebot.service.tts;

/**
 * Text-to-speech provider.
 *
 * <p>Implementations must be thread-safe; the playback coordinator calls them from its own pool.
 */
public interface SpeechSynthesizer {

    /**
     * @return provider name used in configuration and logs
     */
    String name();

    /**
     * @return true if the provider is configured (e.g., has an API key)
     */
    boolean isAvailable();

    /**
     * Synthesizes speech.
     *
     * @param text plain text to speak
     * @param params voice parameters; {@link VoiceParams#defaults()} uses the provider's configured voice
     * @return encoded audio bytes
     * @throws com.critfumble.fumblebot.exception.ProviderException if synthesis fails
     */
    byte[] synthesize(String text, VoiceParams params);
}
