package com.critfumble.fumblebot.service.playback;

import com.critfumble.fumblebot.exception.ProviderException;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.VoiceConnection;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.transcript.TranscriptRecorder;
import com.critfumble.fumblebot.service.tts.SpeechSynthesizer;
import com.critfumble.fumblebot.service.tts.VoiceParams;
import com.critfumble.fumblebot.util.TimeUtils;
import com.critfumble.fumblebot.util.concurrent.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Serializes speech synthesis and playback per guild.
 *
 * <p>A guild's audio output is a single-owner resource: each guild gets one playback lane (a
 * {@link SerialExecutor} over the shared playback pool), so a second {@code speak} waits for the first
 * to finish instead of interleaving. Lanes of different guilds run in parallel.
 *
 * <p>Every task re-resolves the session by guild and session id before synthesizing and skips sessions
 * that were stopped in the meantime.
 */
@Service
public class PlaybackCoordinator {

    private static final Logger LOG = LogManager.getLogger(PlaybackCoordinator.class);

    private final Map<String, SerialExecutor> lanes = new ConcurrentHashMap<>();
    private final Executor playbackExecutor;
    private final SessionRegistry registry;
    private final ChatPlatform chatPlatform;
    private final TranscriptRecorder recorder;
    private final ApplicationEventPublisher publisher;
    private final VoiceSessionMetrics metrics;

    public PlaybackCoordinator(@Qualifier("playbackExecutor") Executor playbackExecutor,
                               SessionRegistry registry,
                               ChatPlatform chatPlatform,
                               TranscriptRecorder recorder,
                               ApplicationEventPublisher publisher,
                               VoiceSessionMetrics metrics) {
        this.playbackExecutor = Objects.requireNonNull(playbackExecutor, "playbackExecutor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Speaks a response and records it as a bot entry, waiting until playback finished.
     *
     * @return true if the text was played
     */
    public boolean speak(String guildId, UUID sessionId, String text) {
        return speakAsync(guildId, sessionId, text, true).join();
    }

    /**
     * Queues speech on the guild's lane.
     *
     * @param record true to append the text to the transcript after playback
     * @return future completing with true once played, false if skipped or failed; never exceptional
     */
    public CompletableFuture<Boolean> speakAsync(String guildId, UUID sessionId, String text, boolean record) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }
        Optional<VoiceSession> session = registry.get(guildId, sessionId);
        if (session.isEmpty() || session.get().providers().speechSynthesizer().isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        SerialExecutor lane = lanes.computeIfAbsent(guildId,
                id -> new SerialExecutor(playbackExecutor, "playback-" + id));
        boolean queued = lane.trySubmit(() -> {
            try {
                done.complete(play(guildId, sessionId, text, record));
            } catch (RuntimeException e) {
                LOG.error("Playback task failed in guild {}", guildId, e);
                done.complete(false);
            }
        });
        if (!queued) {
            done.complete(false);
        }
        return done;
    }

    /**
     * Plays a short cue without recording it. Best-effort: never blocks, never fails the caller.
     */
    public void acknowledge(String guildId, UUID sessionId, String cue) {
        speakAsync(guildId, sessionId, cue, false);
    }

    /**
     * Drops the guild's lane; queued speech is discarded.
     */
    public void release(String guildId) {
        SerialExecutor lane = lanes.remove(guildId);
        if (lane != null) {
            int dropped = lane.shutdown();
            LOG.debug("Released playback lane for guild {} ({} pending dropped)", guildId, dropped);
        }
    }

    private boolean play(String guildId, UUID sessionId, String text, boolean record) {
        Optional<VoiceSession> current = registry.get(guildId, sessionId);
        if (current.isEmpty()) {
            LOG.debug("Session gone before playback in guild {}; skipping", guildId);
            return false;
        }
        VoiceSession session = current.get();
        Optional<SpeechSynthesizer> tts = session.providers().speechSynthesizer();
        if (tts.isEmpty()) {
            return false;
        }
        Optional<VoiceConnection> connection = chatPlatform.currentConnection(guildId);
        if (connection.isEmpty()) {
            LOG.warn("No voice connection for guild {}; cannot speak", guildId);
            return false;
        }

        long start = System.nanoTime();
        byte[] audio;
        try {
            audio = tts.get().synthesize(text, VoiceParams.defaults());
        } catch (ProviderException | IllegalArgumentException e) {
            LOG.warn("Speech synthesis failed in guild {}: {}", guildId, e.getMessage());
            metrics.incrementProviderFailure(tts.get().name(), "speech");
            publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "speech", tts.get().name(),
                    e.getMessage(), e, null));
            return false;
        }

        try {
            connection.get().play(audio);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Playback interrupted in guild {}", guildId);
            return false;
        } catch (RuntimeException e) {
            LOG.warn("Playback failed in guild {}: {}", guildId, e.getMessage());
            publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "playback", tts.get().name(),
                    e.getMessage(), e, null));
            return false;
        }
        LOG.debug("Spoke {} chars in guild {} ({} ms)", text.length(), guildId, TimeUtils.elapsedMillis(start));

        if (record) {
            recorder.appendBotEntry(session, text);
        }
        return true;
    }
}
