package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when humans returned to a paused session's channel and listening restarted.
 *
 * @param humanCount non-bot members present at resume
 */
public record SessionResumedEvent(String guildId, String channelId, int humanCount, Instant at) {
    public SessionResumedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
