package com.critfumble.fumblebot.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for transcription and speech provider selection.
 *
 * <p>{@code transcription} and {@code speech} are either {@value #AUTO} or a provider name. In auto
 * mode the first available provider in the preference list wins.
 */
@Validated
@ConfigurationProperties(prefix = "fumblebot.voice.providers")
public class ProviderProperties {

    public static final String AUTO = "auto";

    @NotBlank
    private final String transcription;

    @NotBlank
    private final String speech;

    private final List<String> transcriptionPreference;

    private final List<String> speechPreference;

    @ConstructorBinding
    public ProviderProperties(String transcription,
                              String speech,
                              List<String> transcriptionPreference,
                              List<String> speechPreference) {
        this.transcription = (transcription == null || transcription.isBlank()) ? AUTO : transcription;
        this.speech = (speech == null || speech.isBlank()) ? AUTO : speech;
        this.transcriptionPreference = transcriptionPreference == null
                ? List.of("deepgram", "whisper") : List.copyOf(transcriptionPreference);
        this.speechPreference = speechPreference == null
                ? List.of("deepgram", "openai") : List.copyOf(speechPreference);
    }

    public String getTranscription() {
        return transcription;
    }

    public String getSpeech() {
        return speech;
    }

    public List<String> getTranscriptionPreference() {
        return transcriptionPreference;
    }

    public List<String> getSpeechPreference() {
        return speechPreference;
    }
}
