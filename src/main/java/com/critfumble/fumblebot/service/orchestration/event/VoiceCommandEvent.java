package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted for every addressed utterance, whether or not it is dispatched.
 *
 * <p>PII note: carries the spoken command; listeners must not log it in full.
 *
 * @param dispatched false in transcribe mode or when the command was too short
 */
public record VoiceCommandEvent(
        String guildId,
        String speakerId,
        String command,
        boolean dispatched,
        Instant at
) {
    public VoiceCommandEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
