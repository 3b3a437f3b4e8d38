package com.critfumble.fumblebot.service.orchestration.event;

import com.critfumble.fumblebot.domain.SessionMode;

import java.time.Instant;

/**
 * Emitted after a voice session has been registered.
 *
 * @param guildId guild the session belongs to
 * @param channelId voice channel
 * @param mode initial mode
 * @param transcriptionProvider selected transcription provider
 * @param speechProvider selected speech provider, or "none"
 * @param startedBy user who started the session
 * @param paused true if the channel was empty at start
 * @param at when the session started
 */
public record SessionStartedEvent(
        String guildId,
        String channelId,
        SessionMode mode,
        String transcriptionProvider,
        String speechProvider,
        String startedBy,
        boolean paused,
        Instant at
) {
    public SessionStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
