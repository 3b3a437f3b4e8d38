package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted for every transcription event, interim or final, for real-time observers.
 */
public record TranscriptionReceivedEvent(
        String guildId,
        String speakerId,
        String text,
        boolean isFinal,
        Instant at
) {
    public TranscriptionReceivedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
