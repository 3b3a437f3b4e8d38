package com.critfumble.fumblebot.service.transcription;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.IntentResult;
import com.critfumble.fumblebot.domain.ResponsePair;
import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.domain.Utterance;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.OutgoingMessage;
import com.critfumble.fumblebot.service.action.ActionDispatcher;
import com.critfumble.fumblebot.service.intent.IntentResolver;
import com.critfumble.fumblebot.service.intent.ResolutionStage;
import com.critfumble.fumblebot.service.intent.ResolvedIntent;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.service.orchestration.CommandHistory;
import com.critfumble.fumblebot.service.orchestration.event.TranscriptionReceivedEvent;
import com.critfumble.fumblebot.service.orchestration.event.VoiceCommandEvent;
import com.critfumble.fumblebot.service.orchestration.event.VoiceResponseEvent;
import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import com.critfumble.fumblebot.service.playback.PlaybackCoordinator;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.stt.TranscriptionEvent;
import com.critfumble.fumblebot.service.stt.TranscriptionListener;
import com.critfumble.fumblebot.service.transcript.TranscriptRecorder;
import com.critfumble.fumblebot.util.LogSanitizer;
import com.critfumble.fumblebot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Routes transcription events of a session to the transcript and, for addressed utterances, through
 * intent resolution, dispatch and the spoken/text answer.
 *
 * <p>Callbacks from the provider are only enqueued here; the work runs on the session's serial queue,
 * so one guild's events are handled one at a time in arrival order. Every queued task re-resolves the
 * session by guild and session id and silently discards itself when the session was stopped or
 * replaced.
 *
 * <p>Routing of one final event:
 * <ol>
 *   <li>append a passive entry</li>
 *   <li>if it opens with a wake phrase, append the addressed form as a command entry</li>
 *   <li>in assistant mode, resolve the intent (Stage 1, else acknowledgment cue then Stage 2)</li>
 *   <li>dispatch, post the display text, speak the spoken text</li>
 * </ol>
 * The session is looked up again after resolution and after dispatch; an answer for a session stopped in
 * the meantime is dropped, except the farewell of the goodbye that stopped it. Interim events are
 * published for observers only.
 */
@Service
public class TranscriptionRouter {

    private static final Logger LOG = LogManager.getLogger(TranscriptionRouter.class);
    private static final int LOG_PREVIEW = 40;

    private final SessionRegistry registry;
    private final WakePhraseDetector wakeDetector;
    private final IntentResolver resolver;
    private final ActionDispatcher dispatcher;
    private final PlaybackCoordinator playback;
    private final TranscriptRecorder recorder;
    private final ChatPlatform chatPlatform;
    private final CommandHistory commandHistory;
    private final ApplicationEventPublisher publisher;
    private final VoiceSessionMetrics metrics;
    private final VoiceProperties properties;

    public TranscriptionRouter(SessionRegistry registry,
                               WakePhraseDetector wakeDetector,
                               IntentResolver resolver,
                               ActionDispatcher dispatcher,
                               PlaybackCoordinator playback,
                               TranscriptRecorder recorder,
                               ChatPlatform chatPlatform,
                               CommandHistory commandHistory,
                               ApplicationEventPublisher publisher,
                               VoiceSessionMetrics metrics,
                               VoiceProperties properties) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.wakeDetector = Objects.requireNonNull(wakeDetector, "wakeDetector must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.commandHistory = Objects.requireNonNull(commandHistory, "commandHistory must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Creates the provider listener for one session. The listener holds ids only, never the session.
     */
    public TranscriptionListener listenerFor(String guildId, UUID sessionId, String providerName) {
        return new TranscriptionListener() {
            @Override
            public void onTranscription(TranscriptionEvent event) {
                TranscriptionRouter.this.onTranscription(guildId, sessionId, event);
            }

            @Override
            public void onWakeWord(String speakerId, String command) {
                TranscriptionRouter.this.onWakeWord(guildId, sessionId, speakerId, command);
            }

            @Override
            public void onError(Throwable error) {
                TranscriptionRouter.this.onProviderError(guildId, providerName, error);
            }
        };
    }

    /**
     * Entry point for transcription events.
     */
    public void onTranscription(String guildId, UUID sessionId, TranscriptionEvent event) {
        if (!event.isFinal()) {
            if (registry.get(guildId, sessionId).isPresent()) {
                publisher.publishEvent(new TranscriptionReceivedEvent(guildId, event.speakerId(), event.text(),
                        false, null));
            }
            return;
        }
        enqueue(guildId, sessionId, session -> handleFinal(session, event));
    }

    /**
     * Entry point for provider-level wake word detection. The addressed phrase is reconstructed from the
     * canonical bot name.
     */
    public void onWakeWord(String guildId, UUID sessionId, String speakerId, String command) {
        String cmd = command == null ? "" : command.trim();
        String fullText = ("Hey " + properties.getBotDisplayName() + ", " + cmd).trim();
        enqueue(guildId, sessionId, session -> {
            List<TranscriptEntry> context = session.recentEntries(properties.getRecentContextSize());
            handleAddressed(session, speakerId, fullText, cmd, context);
        });
    }

    /**
     * Non-fatal provider error: logged, counted and published.
     */
    public void onProviderError(String guildId, String providerName, Throwable error) {
        LOG.warn("Transcription provider {} reported an error in guild {}: {}",
                providerName, guildId, error != null ? error.getMessage() : "unknown");
        metrics.incrementProviderFailure(providerName, "transcription");
        publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "transcription", providerName,
                error != null ? error.getMessage() : "unknown", error, null));
    }

    private void enqueue(String guildId, UUID sessionId, Consumer<VoiceSession> work) {
        Optional<VoiceSession> target = registry.get(guildId, sessionId);
        if (target.isEmpty()) {
            LOG.debug("Discarding transcription event for stale session in guild {}", guildId);
            return;
        }
        target.get().enqueue(() -> {
            Optional<VoiceSession> current = registry.get(guildId, sessionId);
            if (current.isEmpty()) {
                LOG.debug("Session in guild {} stopped before event was handled; discarding", guildId);
                return;
            }
            try {
                work.accept(current.get());
            } catch (RuntimeException e) {
                LOG.error("Failed to handle transcription event in guild {}", guildId, e);
                publisher.publishEvent(new VoiceSessionErrorEvent(guildId, "routing", null, e.getMessage(), e,
                        null));
            }
        });
    }

    void handleFinal(VoiceSession session, TranscriptionEvent event) {
        String text = event.text().trim();
        if (text.isEmpty()) {
            return;
        }
        publisher.publishEvent(new TranscriptionReceivedEvent(session.guildId(), event.speakerId(), text,
                true, null));
        List<TranscriptEntry> context = session.recentEntries(properties.getRecentContextSize());
        recorder.append(session, event.speakerId(), text, false);

        Optional<String> command = wakeDetector.detect(text);
        if (command.isEmpty()) {
            return;
        }
        handleAddressed(session, event.speakerId(), text, command.get(), context);
    }

    void handleAddressed(VoiceSession session, String speakerId, String fullText, String command,
                         List<TranscriptEntry> context) {
        long start = System.nanoTime();
        TranscriptEntry entry = recorder.append(session, speakerId, fullText, true);

        boolean dispatch = session.mode() == SessionMode.ASSISTANT
                && command.length() >= properties.getMinCommandLength();
        publisher.publishEvent(new VoiceCommandEvent(session.guildId(), speakerId, command, dispatch, null));
        if (!dispatch) {
            LOG.debug("Addressed utterance recorded without dispatch (mode={}, commandLength={})",
                    session.mode(), command.length());
            return;
        }
        commandHistory.record(session.guildId(), speakerId, command);
        LOG.info("Voice command from {}: '{}'", entry.speakerDisplayName(), LogSanitizer.preview(command, LOG_PREVIEW));

        Utterance utterance = new Utterance(speakerId, fullText, command);
        ResolvedIntent resolved = resolve(session, utterance, entry.speakerDisplayName(), context);
        IntentResult result = resolved.result();
        if (!result.shouldRespond()) {
            LOG.debug("Not responding (stage={}, reason={})", resolved.stage().tag(), result.reason().wireName());
            return;
        }
        if (isStale(session, "intent resolution")) {
            return;
        }

        Optional<ResponsePair> response = dispatcher.dispatch(session, utterance, result);
        if (response.isEmpty()) {
            return;
        }
        ResponsePair pair = response.get();
        if (result instanceof IntentResult.Goodbye) {
            // the farewell outlives the session it ended; posted, never spoken
            post(session, pair.displayText());
            publisher.publishEvent(new VoiceResponseEvent(session.guildId(), speakerId, result.intent(),
                    resolved.stage().tag(), pair.displayText(), false, TimeUtils.elapsedMillis(start), null));
            return;
        }
        if (isStale(session, "dispatch")) {
            return;
        }
        post(session, pair.displayText());

        boolean spoken = playback.speak(session.guildId(), session.sessionId(), pair.spokenText());
        if (!spoken) {
            recorder.appendBotEntry(session, pair.displayText());
        }
        publisher.publishEvent(new VoiceResponseEvent(session.guildId(), speakerId, result.intent(),
                resolved.stage().tag(), pair.displayText(), spoken, TimeUtils.elapsedMillis(start), null));
    }

    private boolean isStale(VoiceSession session, String phase) {
        if (registry.get(session.guildId(), session.sessionId()).isPresent()) {
            return false;
        }
        LOG.debug("Session in guild {} stopped during {}; dropping the answer", session.guildId(), phase);
        return true;
    }

    private void post(VoiceSession session, String text) {
        session.textChannel().ifPresent(channel -> {
            try {
                chatPlatform.sendMessage(channel.channelId(), OutgoingMessage.text(text));
            } catch (RuntimeException e) {
                LOG.warn("Failed to post response in guild {}: {}", session.guildId(), e.getMessage());
            }
        });
    }

    private ResolvedIntent resolve(VoiceSession session, Utterance utterance, String speakerName,
                                   List<TranscriptEntry> context) {
        Optional<IntentResult> fast = resolver.matchFast(utterance);
        if (fast.isPresent()) {
            return new ResolvedIntent(fast.get(), ResolutionStage.FAST);
        }
        playback.acknowledge(session.guildId(), session.sessionId(), properties.getAcknowledgmentCue());
        return resolver.resolveWithModel(utterance, speakerName, context);
    }
}
