package com.critfumble.fumblebot.service.stt;

import java.util.Objects;

/**
 * One recognition result from a streaming provider.
 *
 * @param speakerId platform user id of the speaker
 * @param text recognized text
 * @param isFinal false for interim hypotheses that may still change
 */
public record TranscriptionEvent(String speakerId, String text, boolean isFinal) {

    public TranscriptionEvent {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        text = text == null ? "" : text;
    }
}
