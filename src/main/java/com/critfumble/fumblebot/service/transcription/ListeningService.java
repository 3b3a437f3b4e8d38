package com.critfumble.fumblebot.service.transcription;

import com.critfumble.fumblebot.platform.VoiceConnection;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.stt.TranscriptionProvider;
import com.critfumble.fumblebot.service.stt.TranscriptionStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Opens and closes a session's transcription stream.
 *
 * <p>A session has at most one stream: {@link #startListening} is a no-op while one is open, which makes
 * duplicate resume requests harmless.
 */
@Service
public class ListeningService {

    private static final Logger LOG = LogManager.getLogger(ListeningService.class);

    private final TranscriptionRouter router;

    public ListeningService(TranscriptionRouter router) {
        this.router = Objects.requireNonNull(router, "router must not be null");
    }

    /**
     * Starts the session's transcription stream with its stored recognition hint.
     *
     * @return true if a new stream was opened, false if one was already open
     * @throws com.critfumble.fumblebot.exception.ProviderException if the provider cannot open a stream
     */
    public boolean startListening(VoiceSession session, VoiceConnection connection) {
        if (session.hasStream()) {
            LOG.debug("Guild {} is already listening", session.guildId());
            return false;
        }
        TranscriptionProvider provider = session.providers().transcription();
        TranscriptionStream stream = provider.start(connection, session.guildId(), session.recognitionHint(),
                router.listenerFor(session.guildId(), session.sessionId(), provider.name()));
        if (!session.attachStream(stream)) {
            stream.close();
            return false;
        }
        LOG.info("Listening in guild {} with {}", session.guildId(), provider.name());
        return true;
    }

    /**
     * Closes the session's stream, if any.
     *
     * @return true if a stream was closed
     */
    public boolean stopListening(VoiceSession session) {
        Optional<TranscriptionStream> stream = session.detachStream();
        if (stream.isEmpty()) {
            return false;
        }
        try {
            stream.get().close();
        } catch (RuntimeException e) {
            LOG.warn("Closing transcription stream failed in guild {}: {}", session.guildId(), e.getMessage());
        }
        LOG.info("Stopped listening in guild {}", session.guildId());
        return true;
    }
}
