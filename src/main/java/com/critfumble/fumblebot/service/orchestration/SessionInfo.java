package com.critfumble.fumblebot.service.orchestration;

import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.service.session.VoiceSession;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a session for command handlers and status displays.
 *
 * @param assistantEnabledBy user who upgraded the session to assistant mode, or {@code null}
 * @param speechProvider selected speech provider, or "none"
 */
public record SessionInfo(
        String guildId,
        UUID sessionId,
        String channelId,
        String channelName,
        SessionMode mode,
        boolean paused,
        String transcriptionProvider,
        String speechProvider,
        String startedBy,
        String assistantEnabledBy,
        int entryCount,
        Instant startedAt
) {

    static SessionInfo of(VoiceSession session) {
        return new SessionInfo(
                session.guildId(),
                session.sessionId(),
                session.channel().channelId(),
                session.channel().name(),
                session.mode(),
                session.isPaused(),
                session.providers().transcription().name(),
                session.providers().speechName(),
                session.startedBy(),
                session.assistantEnabledBy().orElse(null),
                session.entryCount(),
                session.startedAt());
    }
}
