package com.critfumble.fumblebot.service.session;

import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.platform.VoiceChannelRef;
import com.critfumble.fumblebot.service.provider.ProviderSelection;
import com.critfumble.fumblebot.service.stt.TranscriptionStream;
import com.critfumble.fumblebot.service.subtitle.SubtitleState;
import com.critfumble.fumblebot.util.concurrent.SerialExecutor;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live state of one guild's voice session.
 *
 * <p>Instances are created and removed only by {@link SessionRegistry}. Components must not keep a
 * reference across an asynchronous boundary: re-resolve through the registry by guild id and compare
 * {@link #sessionId()} to detect that the session was stopped and replaced in the meantime.
 *
 * <p>All events for the session run on its {@link #enqueue serial queue}, one at a time. The transcript
 * is append-only; entries are never mutated or removed.
 */
public final class VoiceSession {

    public static final String MDC_GUILD_ID = "guildId";
    public static final String MDC_SESSION_ID = "sessionId";

    private final UUID sessionId;
    private final VoiceChannelRef channel;
    private final TextChannelRef textChannel;
    private final ProviderSelection providers;
    private final String startedBy;
    private final Instant startedAt;
    private final String recognitionHint;
    private final SubtitleState subtitles;
    private final SerialExecutor queue;

    private volatile SessionMode mode;
    private volatile String assistantEnabledBy;
    private volatile boolean paused;
    private volatile Instant endedAt;

    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final AtomicReference<TranscriptionStream> stream = new AtomicReference<>();
    private final AtomicBoolean closing = new AtomicBoolean(false);

    VoiceSession(VoiceChannelRef channel,
                 TextChannelRef textChannel,
                 SessionMode mode,
                 String startedBy,
                 ProviderSelection providers,
                 String recognitionHint,
                 boolean paused,
                 SubtitleState subtitles,
                 SerialExecutor queue) {
        this.sessionId = UUID.randomUUID();
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.textChannel = textChannel;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.startedBy = Objects.requireNonNull(startedBy, "startedBy must not be null");
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.recognitionHint = recognitionHint == null ? "" : recognitionHint;
        this.paused = paused;
        this.subtitles = Objects.requireNonNull(subtitles, "subtitles must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.startedAt = Instant.now();
    }

    public UUID sessionId() {
        return sessionId;
    }

    public String guildId() {
        return channel.guildId();
    }

    public VoiceChannelRef channel() {
        return channel;
    }

    public Optional<TextChannelRef> textChannel() {
        return Optional.ofNullable(textChannel);
    }

    public SessionMode mode() {
        return mode;
    }

    public Optional<String> assistantEnabledBy() {
        return Optional.ofNullable(assistantEnabledBy);
    }

    public boolean isPaused() {
        return paused;
    }

    public ProviderSelection providers() {
        return providers;
    }

    public String startedBy() {
        return startedBy;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Optional<Instant> endedAt() {
        return Optional.ofNullable(endedAt);
    }

    public String recognitionHint() {
        return recognitionHint;
    }

    public SubtitleState subtitles() {
        return subtitles;
    }

    /**
     * @return true once stop has begun; closing sessions accept no new work
     */
    public boolean isClosing() {
        return closing.get();
    }

    /**
     * Appends to the transcript. O(1), order-preserving. Refused once the session is closing, so the
     * exported transcript is final.
     *
     * @return false if the entry was refused
     */
    public boolean append(TranscriptEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        synchronized (transcript) {
            if (closing.get()) {
                return false;
            }
            transcript.add(entry);
            return true;
        }
    }

    /**
     * @return copy of the transcript in processing order
     */
    public List<TranscriptEntry> transcript() {
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    /**
     * @return copy of the last {@code n} entries
     */
    public List<TranscriptEntry> recentEntries(int n) {
        synchronized (transcript) {
            int from = Math.max(0, transcript.size() - Math.max(0, n));
            return List.copyOf(transcript.subList(from, transcript.size()));
        }
    }

    public int entryCount() {
        synchronized (transcript) {
            return transcript.size();
        }
    }

    /**
     * Runs a task on the session's serial queue with guild and session ids in the logging context.
     * Dropped silently once the session is closing.
     */
    public void enqueue(Runnable task) {
        if (closing.get()) {
            return;
        }
        queue.execute(withLoggingContext(task));
    }

    /**
     * Wraps a task so it runs with this session's guild and session ids in the Log4j2 ThreadContext.
     */
    public Runnable withLoggingContext(Runnable task) {
        String guildId = guildId();
        String id = sessionId.toString();
        return () -> {
            ThreadContext.put(MDC_GUILD_ID, guildId);
            ThreadContext.put(MDC_SESSION_ID, id);
            try {
                task.run();
            } finally {
                ThreadContext.remove(MDC_GUILD_ID);
                ThreadContext.remove(MDC_SESSION_ID);
            }
        };
    }

    // Mutators below are called by the orchestrator components of this package tree.

    public void markPaused(boolean paused) {
        this.paused = paused;
    }

    /**
     * Installs a stream if none is active.
     *
     * @return false if a stream was already active
     */
    public boolean attachStream(TranscriptionStream newStream) {
        return stream.compareAndSet(null, newStream);
    }

    /**
     * @return the active stream, removed from the session, if any
     */
    public Optional<TranscriptionStream> detachStream() {
        return Optional.ofNullable(stream.getAndSet(null));
    }

    public boolean hasStream() {
        return stream.get() != null;
    }

    boolean upgradeToAssistant(String enabledBy) {
        if (mode == SessionMode.ASSISTANT) {
            return false;
        }
        this.mode = SessionMode.ASSISTANT;
        this.assistantEnabledBy = enabledBy;
        return true;
    }

    boolean beginClosing() {
        return closing.compareAndSet(false, true);
    }

    void markEnded() {
        this.endedAt = Instant.now();
    }

    /**
     * Discards queued events. The running one, if any, finishes.
     *
     * @return number of events discarded
     */
    public int shutdownQueue() {
        return queue.shutdown();
    }

    @Override
    public String toString() {
        return "VoiceSession{guildId=" + guildId() + ", sessionId=" + sessionId + ", mode=" + mode
                + ", paused=" + paused + '}';
    }
}
