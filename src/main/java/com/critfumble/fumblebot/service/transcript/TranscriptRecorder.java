package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.subtitle.LiveSubtitleRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Appends human and bot utterances to a session transcript and feeds the live subtitles.
 */
@Component
public class TranscriptRecorder {

    private static final Logger LOG = LogManager.getLogger(TranscriptRecorder.class);

    /** Speaker id of entries authored by the bot. */
    public static final String BOT_SPEAKER_ID = "bot";

    private final ChatPlatform chatPlatform;
    private final LiveSubtitleRenderer subtitles;
    private final VoiceProperties voiceProperties;

    public TranscriptRecorder(ChatPlatform chatPlatform,
                              LiveSubtitleRenderer subtitles,
                              VoiceProperties voiceProperties) {
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.subtitles = Objects.requireNonNull(subtitles, "subtitles must not be null");
        this.voiceProperties = Objects.requireNonNull(voiceProperties, "voiceProperties must not be null");
    }

    /**
     * Appends a human utterance. Nothing is recorded once the session is closing.
     *
     * @param command true for the addressed (wake-word) form of an utterance
     * @return the entry built for the utterance
     */
    public TranscriptEntry append(VoiceSession session, String speakerId, String text, boolean command) {
        TranscriptEntry entry = new TranscriptEntry(speakerId, displayName(session.guildId(), speakerId),
                text, System.currentTimeMillis(), command);
        record(session, entry);
        return entry;
    }

    /**
     * Appends something the bot said. Ignored once the session is closing.
     *
     * @return the appended entry, or empty if the session is closing
     */
    public Optional<TranscriptEntry> appendBotEntry(VoiceSession session, String text) {
        if (session.isClosing()) {
            return Optional.empty();
        }
        TranscriptEntry entry = new TranscriptEntry(BOT_SPEAKER_ID, voiceProperties.getBotDisplayName(),
                text, System.currentTimeMillis(), false);
        record(session, entry);
        return Optional.of(entry);
    }

    private void record(VoiceSession session, TranscriptEntry entry) {
        if (session.append(entry)) {
            subtitles.onEntry(session, entry);
        } else {
            LOG.debug("Session in guild {} is closing; entry not recorded", session.guildId());
        }
    }

    private String displayName(String guildId, String userId) {
        try {
            return chatPlatform.displayName(guildId, userId).orElse(userId);
        } catch (RuntimeException e) {
            LOG.debug("Display name lookup failed for {}: {}", userId, e.getMessage());
            return userId;
        }
    }
}
