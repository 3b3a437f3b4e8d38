package com.critfumble.fumblebot.service.orchestration.event;

import com.critfumble.fumblebot.domain.Intent;

import java.time.Instant;

/**
 * Emitted after the bot answered an addressed utterance.
 *
 * @param intent resolved intent
 * @param stage which resolver stage produced the intent ("fast", "model" or "fallback")
 * @param displayText text sent to the channel
 * @param spoken true if the answer was also spoken
 * @param latencyMs time from utterance to answer
 */
public record VoiceResponseEvent(
        String guildId,
        String speakerId,
        Intent intent,
        String stage,
        String displayText,
        boolean spoken,
        long latencyMs,
        Instant at
) {
    public VoiceResponseEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
