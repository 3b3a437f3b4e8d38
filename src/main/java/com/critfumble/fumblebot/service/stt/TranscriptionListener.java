package com.critfumble.fumblebot.service.stt;

/**
 * Receives events from a {@link TranscriptionStream}.
 */
public interface TranscriptionListener {

    void onTranscription(TranscriptionEvent event);

    /**
     * Provider-level wake word detection. Only some providers support it.
     *
     * @param speakerId who spoke
     * @param command text following the wake word
     */
    default void onWakeWord(String speakerId, String command) {
    }

    /**
     * Non-fatal stream error. The stream may keep running afterwards.
     */
    default void onError(Throwable error) {
    }
}
