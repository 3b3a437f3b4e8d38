package com.critfumble.fumblebot.service.subtitle;

import com.critfumble.fumblebot.config.properties.SubtitleProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.MessageRef;
import com.critfumble.fumblebot.platform.OutgoingMessage;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Rolling "live subtitle" message in the session's text channel.
 *
 * <p>Every transcript entry is appended to the session's {@link SubtitleState}; rendering is debounced
 * so a burst of lines produces one message edit. The renderer keeps one live message per session. When
 * editing it fails (for instance because it was deleted), the reference is dropped and a replacement
 * message is sent.
 */
@Component
public class LiveSubtitleRenderer {

    private static final Logger LOG = LogManager.getLogger(LiveSubtitleRenderer.class);

    static final String HEADER = "🎙️ **Live transcript**";

    private final ChatPlatform chatPlatform;
    private final TaskScheduler scheduler;
    private final SubtitleProperties properties;

    public LiveSubtitleRenderer(ChatPlatform chatPlatform,
                                @Qualifier("subtitleScheduler") TaskScheduler scheduler,
                                SubtitleProperties properties) {
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Adds an entry and (re)arms the debounce timer.
     */
    public void onEntry(VoiceSession session, TranscriptEntry entry) {
        if (!properties.isEnabled() || session.textChannel().isEmpty()) {
            return;
        }
        SubtitleState state = session.subtitles();
        if (state.isCancelled()) {
            return;
        }
        state.append(formatLine(entry));
        ScheduledFuture<?> timer = scheduler.schedule(session.withLoggingContext(() -> flush(session)),
                Instant.now().plusMillis(properties.getDebounceMs()));
        state.rearm(timer);
    }

    /**
     * Renders the current window now. Skipped once the session is closing or the state was cancelled.
     */
    public void flush(VoiceSession session) {
        SubtitleState state = session.subtitles();
        Optional<TextChannelRef> channel = session.textChannel();
        if (channel.isEmpty() || session.isClosing() || state.isCancelled()) {
            return;
        }
        state.renderLock().lock();
        try {
            String content = render(state.lines());
            MessageRef message = state.message();
            if (message != null) {
                try {
                    chatPlatform.editMessage(message, content);
                    state.markRendered(System.currentTimeMillis());
                    return;
                } catch (RuntimeException e) {
                    LOG.debug("Subtitle edit failed in guild {}; sending a new message: {}",
                            session.guildId(), e.getMessage());
                    state.message(null);
                }
            }
            state.message(chatPlatform.sendMessage(channel.get().channelId(), OutgoingMessage.text(content)));
            state.markRendered(System.currentTimeMillis());
        } catch (RuntimeException e) {
            LOG.warn("Subtitle render failed in guild {}: {}", session.guildId(), e.getMessage());
        } finally {
            state.renderLock().unlock();
        }
    }

    /**
     * Cancels the pending render and stops further renders for the session.
     */
    public void cancel(VoiceSession session) {
        session.subtitles().cancel();
    }

    String formatLine(TranscriptEntry entry) {
        String text = LogSanitizer.truncate(entry.text(), properties.getMaxLineLength());
        if (text.length() < entry.text().length()) {
            text += "...";
        }
        return (entry.command() ? "🎤 " : "") + "**" + entry.speakerDisplayName() + "**: " + text;
    }

    static String render(List<String> lines) {
        StringBuilder sb = new StringBuilder(HEADER);
        for (String line : lines) {
            sb.append('\n').append(line);
        }
        return sb.toString();
    }
}
