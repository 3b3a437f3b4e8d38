package com.critfumble.fumblebot.service.orchestration.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted after a session was finalized and removed.
 *
 * @param entryCount transcript entries at stop
 * @param duration time between start and stop
 * @param exported true if the transcript export was delivered
 */
public record SessionStoppedEvent(
        String guildId,
        String channelId,
        int entryCount,
        Duration duration,
        boolean exported,
        Instant at
) {
    public SessionStoppedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
