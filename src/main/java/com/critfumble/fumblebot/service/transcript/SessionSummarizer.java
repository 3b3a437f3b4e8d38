package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.service.llm.LlmClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces a short AI summary of a session transcript, or a raw excerpt when the model is unavailable.
 */
@Component
public class SessionSummarizer {

    private static final Logger LOG = LogManager.getLogger(SessionSummarizer.class);

    static final String SYSTEM_PROMPT = """
            You summarize tabletop RPG voice sessions from their transcripts.
            Write a short recap in markdown: key events, decisions, notable rolls and open threads.
            Use at most 8 bullet points. Do not invent events that are not in the transcript.""";

    private final LlmClient llm;
    private final VoiceProperties voiceProperties;
    private final LlmProperties llmProperties;

    public SessionSummarizer(LlmClient llm, VoiceProperties voiceProperties, LlmProperties llmProperties) {
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.voiceProperties = Objects.requireNonNull(voiceProperties, "voiceProperties must not be null");
        this.llmProperties = Objects.requireNonNull(llmProperties, "llmProperties must not be null");
    }

    /**
     * Best-effort summary.
     *
     * @param entries transcript in processing order
     * @return summary, or empty if the transcript is too short or the model call failed
     */
    public Optional<String> summarize(List<TranscriptEntry> entries) {
        if (entries.size() < voiceProperties.getSummaryMinEntries()) {
            LOG.debug("Transcript has {} entries; skipping summary", entries.size());
            return Optional.empty();
        }
        try {
            String summary = llm.complete(formatTranscript(entries), SYSTEM_PROMPT,
                    llmProperties.getSummaryMaxTokens());
            return summary == null || summary.isBlank() ? Optional.empty() : Optional.of(summary.trim());
        } catch (RuntimeException e) {
            LOG.warn("Session summary failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Summary if available, else a raw excerpt of the last entries.
     */
    public String summaryOrExcerpt(List<TranscriptEntry> entries) {
        return summarize(entries).orElseGet(() -> excerpt(entries, voiceProperties.getSummaryExcerptSize()));
    }

    /**
     * @return the last {@code n} entries as markdown lines
     */
    public String excerpt(List<TranscriptEntry> entries, int n) {
        if (entries.isEmpty()) {
            return "_Nothing was said in this session._";
        }
        List<TranscriptEntry> tail = entries.subList(Math.max(0, entries.size() - n), entries.size());
        StringBuilder sb = new StringBuilder("**Transcript excerpt** (last ")
                .append(tail.size()).append(" entries)\n");
        for (TranscriptEntry entry : tail) {
            sb.append("**").append(entry.speakerDisplayName()).append("**: ").append(entry.text()).append('\n');
        }
        return sb.toString().trim();
    }

    private static String formatTranscript(List<TranscriptEntry> entries) {
        StringBuilder sb = new StringBuilder("TRANSCRIPT:\n");
        for (TranscriptEntry entry : entries) {
            sb.append(entry.speakerDisplayName()).append(": ").append(entry.text()).append('\n');
        }
        return sb.toString();
    }
}
