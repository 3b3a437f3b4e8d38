package com.critfumble.fumblebot.service.occupancy;

import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.MembershipChange;
import com.critfumble.fumblebot.platform.VoiceConnection;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.service.orchestration.event.SessionPausedEvent;
import com.critfumble.fumblebot.service.orchestration.event.SessionResumedEvent;
import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.session.SessionTerminator;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.transcription.ListeningService;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;

/**
 * Pauses a session while its voice channel has no humans and resumes it when one returns.
 *
 * <p>Membership events are only used as a trigger: the handler re-counts humans through the platform,
 * so duplicated or reordered events converge on the same state. Reconciliation runs on the session's
 * queue, ordered with transcription handling.
 *
 * <p>The bot's own departure from the session channel (kicked, or the connection lost) is fatal: the
 * session is stopped, which exports the transcript.
 */
@Component
public class OccupancyWatcher {

    private static final Logger LOG = LogManager.getLogger(OccupancyWatcher.class);

    private final ChatPlatform chatPlatform;
    private final SessionRegistry registry;
    private final ListeningService listening;
    private final ApplicationEventPublisher publisher;
    private final VoiceSessionMetrics metrics;
    private final SessionTerminator terminator;

    public OccupancyWatcher(ChatPlatform chatPlatform,
                            SessionRegistry registry,
                            ListeningService listening,
                            ApplicationEventPublisher publisher,
                            VoiceSessionMetrics metrics,
                            @Lazy SessionTerminator terminator) {
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.listening = Objects.requireNonNull(listening, "listening must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
    }

    /** Registers the membership listener once for the lifetime of the process. */
    @PostConstruct
    public void subscribe() {
        chatPlatform.onMembershipChange(this::onMembershipChange);
        LOG.debug("Subscribed to voice membership changes");
    }

    public void onMembershipChange(MembershipChange change) {
        if (change == null) {
            return;
        }
        if (change.bot()) {
            onBotMembershipChange(change);
            return;
        }
        registry.get(change.guildId())
                .filter(session -> change.touches(session.channel().channelId()))
                .ifPresent(session -> {
                    UUID sessionId = session.sessionId();
                    session.enqueue(() -> reconcile(change.guildId(), sessionId));
                });
    }

    private void onBotMembershipChange(MembershipChange change) {
        if (change.currentChannelId() != null || !isSelf(change.userId())) {
            return;
        }
        registry.get(change.guildId())
                .filter(session -> session.channel().channelId().equals(change.previousChannelId()))
                .ifPresent(session -> {
                    LOG.warn("Bot was disconnected from voice in guild {}; stopping the session", change.guildId());
                    publisher.publishEvent(new VoiceSessionErrorEvent(change.guildId(), "disconnect", null,
                            "bot left the voice channel", null, null));
                    terminator.stopIfActive(change.guildId());
                });
    }

    private boolean isSelf(String userId) {
        try {
            return userId != null && userId.equals(chatPlatform.selfUserId());
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve the bot's own user id: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Brings the guild's current session in line with the current human count.
     *
     * @return true if the session changed state
     */
    public boolean reconcile(String guildId) {
        return registry.get(guildId).map(s -> reconcile(guildId, s.sessionId())).orElse(false);
    }

    /**
     * Same as {@link #reconcile(String)}, but a no-op when the guild's session is no longer {@code sessionId}.
     */
    public boolean reconcile(String guildId, UUID sessionId) {
        VoiceSession session = registry.get(guildId, sessionId).orElse(null);
        if (session == null) {
            return false;
        }
        int humans;
        try {
            humans = chatPlatform.countHumanMembers(guildId, session.channel().channelId());
        } catch (RuntimeException e) {
            LOG.warn("Could not count members in guild {}: {}", guildId, e.getMessage());
            return false;
        }

        if (humans == 0 && !session.isPaused()) {
            listening.stopListening(session);
            session.markPaused(true);
            LOG.info("Voice channel empty in guild {}; pausing transcription", guildId);
            publisher.publishEvent(new SessionPausedEvent(guildId, session.channel().channelId(), null));
            return true;
        }
        if (humans > 0 && session.isPaused()) {
            return resume(session, humans);
        }
        return false;
    }

    private boolean resume(VoiceSession session, int humans) {
        String guildId = session.guildId();
        String provider = session.providers().transcription().name();
        try {
            VoiceConnection connection = chatPlatform.currentConnection(guildId)
                    .orElseGet(() -> chatPlatform.joinVoice(session.channel()));
            listening.startListening(session, connection);
        } catch (RuntimeException e) {
            LOG.error("Failed to resume transcription in guild {}; staying paused", guildId, e);
            metrics.incrementProviderFailure(provider, "transcription");
            publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "resume", provider, e.getMessage(), e,
                    null));
            return false;
        }
        session.markPaused(false);
        LOG.info("{} listener(s) back in guild {}; resuming transcription", humans, guildId);
        publisher.publishEvent(new SessionResumedEvent(guildId, session.channel().channelId(), humans, null));
        return true;
    }
}
