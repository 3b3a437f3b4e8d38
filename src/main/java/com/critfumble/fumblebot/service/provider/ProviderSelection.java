package com.critfumble.fumblebot.service.provider;

import com.critfumble.fumblebot.service.stt.TranscriptionProvider;
import com.critfumble.fumblebot.service.tts.SpeechSynthesizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Providers chosen for one session. Fixed for the lifetime of the session.
 *
 * @param transcription transcription provider, never null
 * @param speech speech synthesizer, or {@code null} for text-only responses
 */
public record ProviderSelection(TranscriptionProvider transcription, SpeechSynthesizer speech) {

    public ProviderSelection {
        Objects.requireNonNull(transcription, "transcription must not be null");
    }

    public Optional<SpeechSynthesizer> speechSynthesizer() {
        return Optional.ofNullable(speech);
    }

    public String speechName() {
        return speech != null ? speech.name() : "none";
    }
}
