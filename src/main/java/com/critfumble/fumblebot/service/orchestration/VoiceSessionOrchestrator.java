package com.critfumble.fumblebot.service.orchestration;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.exception.GuildNotAllowedException;
import com.critfumble.fumblebot.exception.SessionAlreadyActiveException;
import com.critfumble.fumblebot.exception.SessionNotActiveException;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.platform.VoiceChannelRef;
import com.critfumble.fumblebot.platform.VoiceConnection;
import com.critfumble.fumblebot.service.orchestration.event.SessionStartedEvent;
import com.critfumble.fumblebot.service.orchestration.event.SessionStoppedEvent;
import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import com.critfumble.fumblebot.service.playback.PlaybackCoordinator;
import com.critfumble.fumblebot.service.provider.ProviderSelection;
import com.critfumble.fumblebot.service.provider.ProviderSelector;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.session.SessionTerminator;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.subtitle.LiveSubtitleRenderer;
import com.critfumble.fumblebot.service.transcript.TranscriptExporter;
import com.critfumble.fumblebot.service.transcription.ListeningService;
import com.critfumble.fumblebot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for starting and stopping voice sessions.
 *
 * <p><b>Start:</b> checks the guild allow-list, selects providers once, joins the voice channel and
 * registers the session. Everything that can fail before registration is reported to the caller with
 * nothing left registered. The first transcription stream is opened as the first task of the session's
 * queue, so membership changes arriving during start are handled after it.
 *
 * <p><b>Stop:</b> tears the session down in a fixed order (stream, subtitles, queue, export, playback)
 * and always releases the voice connection, even when a step fails. Export failures never fail the stop.
 */
@Service
public class VoiceSessionOrchestrator implements SessionTerminator {

    private static final Logger LOG = LogManager.getLogger(VoiceSessionOrchestrator.class);

    private final SessionRegistry registry;
    private final ProviderSelector providerSelector;
    private final ChatPlatform chatPlatform;
    private final ListeningService listening;
    private final PlaybackCoordinator playback;
    private final LiveSubtitleRenderer subtitles;
    private final TranscriptExporter exporter;
    private final CommandHistory commandHistory;
    private final ApplicationEventPublisher publisher;
    private final VoiceProperties properties;

    public VoiceSessionOrchestrator(SessionRegistry registry,
                                    ProviderSelector providerSelector,
                                    ChatPlatform chatPlatform,
                                    ListeningService listening,
                                    PlaybackCoordinator playback,
                                    LiveSubtitleRenderer subtitles,
                                    TranscriptExporter exporter,
                                    CommandHistory commandHistory,
                                    ApplicationEventPublisher publisher,
                                    VoiceProperties properties) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.providerSelector = Objects.requireNonNull(providerSelector, "providerSelector must not be null");
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.listening = Objects.requireNonNull(listening, "listening must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.subtitles = Objects.requireNonNull(subtitles, "subtitles must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.commandHistory = Objects.requireNonNull(commandHistory, "commandHistory must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Starts a voice session.
     *
     * @param channel voice channel to join
     * @param textChannel companion text channel for responses, subtitles and the export; may be null
     * @param mode initial mode
     * @param startedBy user starting the session
     * @return snapshot of the new session
     * @throws GuildNotAllowedException if an allow-list is configured and excludes the guild
     * @throws SessionAlreadyActiveException if the guild already has a session
     * @throws com.critfumble.fumblebot.exception.ProviderUnavailableException if no transcription provider
     *         is usable
     */
    public SessionInfo start(VoiceChannelRef channel, TextChannelRef textChannel, SessionMode mode, String startedBy) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        String guildId = channel.guildId();

        String allowed = properties.getAllowedGuildId();
        if (allowed != null && !allowed.isBlank() && !allowed.equals(guildId)) {
            throw new GuildNotAllowedException(guildId);
        }
        // includes sessions that are still being stopped
        if (registry.activeGuildIds().contains(guildId)) {
            throw new SessionAlreadyActiveException(guildId);
        }

        ProviderSelection providers = providerSelector.select();
        VoiceConnection connection = chatPlatform.joinVoice(channel);
        int humans = countHumans(channel);

        VoiceSession session = registry.start(channel, textChannel, mode, startedBy, providers,
                properties.getRecognitionHint(), humans == 0);
        UUID sessionId = session.sessionId();
        session.enqueue(() -> openInitialStream(guildId, sessionId, connection));

        chatPlatform.setPresence("Listening in " + channel.name());
        LOG.info("Voice session started in guild {} channel {} (mode={}, stt={}, tts={}, humans={})",
                guildId, channel.name(), mode, providers.transcription().name(), providers.speechName(), humans);
        publisher.publishEvent(new SessionStartedEvent(guildId, channel.channelId(), mode,
                providers.transcription().name(), providers.speechName(), startedBy, session.isPaused(), null));
        return SessionInfo.of(session);
    }

    /**
     * Stops the guild's session and delivers its transcript.
     *
     * @param deliverToUserId user to receive the export by direct message, or null for the text channel
     * @return true if the export was delivered
     * @throws SessionNotActiveException if the guild has no session
     */
    public boolean stop(String guildId, String deliverToUserId) {
        AtomicBoolean exported = new AtomicBoolean(false);
        VoiceSession session = registry.stop(guildId, s -> teardown(s, deliverToUserId, exported));

        Instant endedAt = session.endedAt().orElseGet(Instant::now);
        Duration duration = Duration.between(session.startedAt(), endedAt);
        LOG.info("Voice session stopped in guild {} after {} ({} entries, exported={})",
                guildId, TimeUtils.humanDuration(duration), session.entryCount(), exported.get());
        publisher.publishEvent(new SessionStoppedEvent(guildId, session.channel().channelId(), session.entryCount(),
                duration, exported.get(), null));
        return exported.get();
    }

    @Override
    public boolean stopIfActive(String guildId) {
        try {
            stop(guildId, null);
            return true;
        } catch (SessionNotActiveException e) {
            LOG.debug("No session to stop in guild {}", guildId);
            return false;
        }
    }

    /**
     * Upgrades a transcribe-mode session to assistant mode.
     *
     * @return false if it was already in assistant mode
     * @throws SessionNotActiveException if the guild has no session
     */
    public boolean enableAssistantMode(String guildId, String enabledBy) {
        return registry.enableAssistantMode(guildId, enabledBy);
    }

    public boolean isActive(String guildId) {
        return registry.isActive(guildId);
    }

    public boolean isPaused(String guildId) {
        return registry.get(guildId).map(VoiceSession::isPaused).orElse(false);
    }

    public Optional<SessionInfo> sessionInfo(String guildId) {
        return registry.get(guildId).map(SessionInfo::of);
    }

    public List<CommandHistory.Entry> commandHistory(int limit) {
        return commandHistory.recent(limit);
    }

    private int countHumans(VoiceChannelRef channel) {
        try {
            return chatPlatform.countHumanMembers(channel.guildId(), channel.channelId());
        } catch (RuntimeException e) {
            LOG.warn("Could not count members in guild {}; assuming the channel is occupied: {}",
                    channel.guildId(), e.getMessage());
            return 1;
        }
    }

    private void openInitialStream(String guildId, UUID sessionId, VoiceConnection connection) {
        VoiceSession session = registry.get(guildId, sessionId).orElse(null);
        if (session == null || session.isPaused()) {
            return;
        }
        try {
            listening.startListening(session, connection);
        } catch (RuntimeException e) {
            // paused so the next membership change retries
            session.markPaused(true);
            String provider = session.providers().transcription().name();
            LOG.error("Could not open transcription stream in guild {}; session paused", guildId, e);
            publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "transcription", provider, e.getMessage(),
                    e, null));
            return;
        }
        if (session.mode() == SessionMode.ASSISTANT && properties.isReadyCueEnabled()) {
            playback.acknowledge(guildId, sessionId, properties.getReadyCue());
        }
    }

    private void teardown(VoiceSession session, String deliverToUserId, AtomicBoolean exported) {
        String guildId = session.guildId();
        try {
            listening.stopListening(session);
            subtitles.cancel(session);
            int dropped = session.shutdownQueue();
            if (dropped > 0) {
                LOG.debug("Discarded {} queued event(s) for guild {}", dropped, guildId);
            }
            exported.set(exporter.deliver(session, deliverToUserId));
            playback.release(guildId);
        } finally {
            try {
                chatPlatform.leaveVoice(guildId);
            } catch (RuntimeException e) {
                LOG.warn("Failed to leave voice in guild {}: {}", guildId, e.getMessage());
            }
            if (registry.activeGuildIds().stream().allMatch(guildId::equals)) {
                chatPlatform.setPresence(null);
            }
        }
    }
}
