package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.OutgoingMessage;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import com.critfumble.fumblebot.service.session.VoiceSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finalizes a session transcript on stop: markdown export, optional AI summary, delivery.
 *
 * <p>Never fails the stop: every failure is logged, published as an error event and reported through
 * the return value.
 */
@Component
public class TranscriptExporter {

    private static final Logger LOG = LogManager.getLogger(TranscriptExporter.class);

    private final TranscriptMarkdownExporter markdownExporter;
    private final SessionSummarizer summarizer;
    private final ChatPlatform chatPlatform;
    private final ApplicationEventPublisher publisher;

    public TranscriptExporter(TranscriptMarkdownExporter markdownExporter,
                              SessionSummarizer summarizer,
                              ChatPlatform chatPlatform,
                              ApplicationEventPublisher publisher) {
        this.markdownExporter = Objects.requireNonNull(markdownExporter, "markdownExporter must not be null");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Exports and delivers the transcript.
     *
     * @param session session being stopped
     * @param deliverToUserId user to receive the export by direct message, or null for the session's
     *                        text channel
     * @return true if the export was delivered
     */
    public boolean deliver(VoiceSession session, String deliverToUserId) {
        List<TranscriptEntry> entries = session.transcript();
        Instant endedAt = session.endedAt().orElseGet(Instant::now);
        TranscriptExport export;
        Optional<String> summary;
        try {
            export = markdownExporter.export(session.channel().name(), session.startedAt(), endedAt, entries);
            summary = summarizer.summarize(entries);
        } catch (RuntimeException e) {
            fail(session, "Transcript export failed", e);
            return false;
        }

        OutgoingMessage attachment = OutgoingMessage.withFile(export.statsMessage(), export.fileName(),
                export.markdown());
        Optional<OutgoingMessage> summaryMessage = summary.map(s -> OutgoingMessage.text("**Session Summary**\n" + s));
        if (deliverToUserId != null) {
            try {
                chatPlatform.sendDirectMessage(deliverToUserId, attachment);
                summaryMessage.ifPresent(m -> chatPlatform.sendDirectMessage(deliverToUserId, m));
                LOG.info("Transcript ({} entries) sent to user {}", entries.size(), deliverToUserId);
                return true;
            } catch (RuntimeException e) {
                LOG.warn("Direct message to user {} failed; falling back to the text channel: {}",
                        deliverToUserId, e.getMessage());
            }
        }
        Optional<TextChannelRef> channel = session.textChannel();
        if (channel.isEmpty()) {
            LOG.info("No text channel for guild {}; transcript ({} entries) not delivered",
                    session.guildId(), entries.size());
            return false;
        }
        try {
            chatPlatform.sendMessage(channel.get().channelId(), attachment);
            summaryMessage.ifPresent(m -> chatPlatform.sendMessage(channel.get().channelId(), m));
            LOG.info("Transcript ({} entries) posted to channel {}", entries.size(), channel.get().name());
            return true;
        } catch (RuntimeException e) {
            fail(session, "Transcript delivery failed", e);
            return false;
        }
    }

    private void fail(VoiceSession session, String message, RuntimeException e) {
        LOG.warn("{} for guild {}: {}", message, session.guildId(), e.getMessage(), e);
        publisher.publishEvent(new VoiceSessionErrorEvent(session.guildId(), "export", null, message, e, null));
    }
}
