package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Instant;

/**
 * Published when a failure occurs inside a voice session. All kinds but "disconnect" leave the session
 * running.
 *
 * <p>PII note: do not put transcript text in {@code message}. Restrict to technical diagnostics.
 *
 * @param kind failure category, e.g. "transcription", "speech", "llm", "export", "listen", "disconnect"
 * @param provider provider involved, or null
 */
public record VoiceSessionErrorEvent(
        String guildId,
        String kind,
        String provider,
        String message,
        Throwable cause,
        Instant at
) {
    public VoiceSessionErrorEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
