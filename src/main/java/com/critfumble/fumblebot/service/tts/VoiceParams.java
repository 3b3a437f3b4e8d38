package com.critfumble.fumblebot.service.tts;

/**
 * Per-call voice overrides. {@code null} fields fall back to provider configuration.
 *
 * @param voiceId provider voice identifier
 * @param speed playback speed multiplier
 */
public record VoiceParams(String voiceId, Double speed) {

    private static final VoiceParams DEFAULTS = new VoiceParams(null, null);

    public static VoiceParams defaults() {
        return DEFAULTS;
    }
}
