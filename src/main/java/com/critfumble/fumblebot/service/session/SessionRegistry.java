package com.critfumble.fumblebot.service.session;

import com.critfumble.fumblebot.config.properties.SubtitleProperties;
import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.exception.SessionAlreadyActiveException;
import com.critfumble.fumblebot.exception.SessionNotActiveException;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.platform.VoiceChannelRef;
import com.critfumble.fumblebot.service.provider.ProviderSelection;
import com.critfumble.fumblebot.service.subtitle.SubtitleState;
import com.critfumble.fumblebot.util.concurrent.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * In-memory map of guild id to its single voice session. The only source of truth for whether a guild
 * is listening.
 *
 * <p><b>Stop protocol:</b> a session is first marked closing (so {@link #get} stops returning it and its
 * queue stops accepting work), then finalized by the caller-supplied finalizer, then removed. The
 * finalizer runs exactly once, even when two stops race.
 *
 * <p><b>Thread Safety:</b> backed by a {@link ConcurrentHashMap}; start and stop for the same guild are
 * atomic with respect to each other.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, VoiceSession> sessions = new ConcurrentHashMap<>();
    private final Executor sessionExecutor;
    private final SubtitleProperties subtitleProperties;

    public SessionRegistry(@Qualifier("sessionExecutor") Executor sessionExecutor,
                           SubtitleProperties subtitleProperties) {
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
        this.subtitleProperties = Objects.requireNonNull(subtitleProperties, "subtitleProperties must not be null");
    }

    /**
     * Creates and registers a session.
     *
     * @param channel voice channel the bot has joined
     * @param textChannel companion text channel, or null
     * @param mode initial mode
     * @param startedBy user who started the session
     * @param providers providers chosen for the session
     * @param recognitionHint hint reused for every transcription stream of the session
     * @param paused true if the channel has no humans at start
     * @return the new session
     * @throws SessionAlreadyActiveException if the guild already has a session (including one being stopped)
     */
    public VoiceSession start(VoiceChannelRef channel,
                              TextChannelRef textChannel,
                              SessionMode mode,
                              String startedBy,
                              ProviderSelection providers,
                              String recognitionHint,
                              boolean paused) {
        String guildId = channel.guildId();
        VoiceSession session = new VoiceSession(channel, textChannel, mode, startedBy, providers, recognitionHint,
                paused, new SubtitleState(subtitleProperties.getCapacity()),
                new SerialExecutor(sessionExecutor, "session-" + guildId));

        VoiceSession existing = sessions.putIfAbsent(guildId, session);
        if (existing != null) {
            session.shutdownQueue();
            throw new SessionAlreadyActiveException(guildId);
        }
        LOG.info("Registered voice session {} for guild {} (mode={}, paused={})",
                session.sessionId(), guildId, mode, paused);
        return session;
    }

    /**
     * Finalizes and removes the guild's session.
     *
     * @param guildId guild identifier
     * @param finalizer teardown run while the session is closing but still registered; exceptions it
     *                  throws propagate after the session has been removed
     * @return the removed session
     * @throws SessionNotActiveException if the guild has no session or it is already being stopped
     */
    public VoiceSession stop(String guildId, Consumer<VoiceSession> finalizer) {
        VoiceSession session = sessions.get(guildId);
        if (session == null || !session.beginClosing()) {
            throw new SessionNotActiveException(guildId);
        }
        try {
            session.markEnded();
            finalizer.accept(session);
        } finally {
            sessions.remove(guildId, session);
            LOG.info("Removed voice session {} for guild {}", session.sessionId(), guildId);
        }
        return session;
    }

    /**
     * Non-mutating lookup. Sessions that are being stopped are not returned.
     */
    public Optional<VoiceSession> get(String guildId) {
        if (guildId == null) {
            return Optional.empty();
        }
        VoiceSession session = sessions.get(guildId);
        return session == null || session.isClosing() ? Optional.empty() : Optional.of(session);
    }

    /**
     * Lookup guarded by session id: empty if the guild's session was stopped or replaced.
     */
    public Optional<VoiceSession> get(String guildId, UUID sessionId) {
        return get(guildId).filter(s -> s.sessionId().equals(sessionId));
    }

    /**
     * Upgrades a transcribe-mode session to assistant mode in place.
     *
     * @return false if the session was already in assistant mode
     * @throws SessionNotActiveException if the guild has no session
     */
    public boolean enableAssistantMode(String guildId, String enabledBy) {
        VoiceSession session = get(guildId).orElseThrow(() -> new SessionNotActiveException(guildId));
        boolean changed = session.upgradeToAssistant(enabledBy);
        if (changed) {
            LOG.info("Guild {} session upgraded to assistant mode by {}", guildId, enabledBy);
        }
        return changed;
    }

    public boolean isActive(String guildId) {
        return get(guildId).isPresent();
    }

    public Set<String> activeGuildIds() {
        return Set.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }
}
