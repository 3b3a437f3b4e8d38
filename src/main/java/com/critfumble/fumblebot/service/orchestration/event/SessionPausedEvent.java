package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when the last human left the session's voice channel and listening stopped.
 */
public record SessionPausedEvent(String guildId, String channelId, Instant at) {
    public SessionPausedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
