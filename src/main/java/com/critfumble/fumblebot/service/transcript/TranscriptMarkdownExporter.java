package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders a transcript as markdown.
 *
 * <p>Consecutive entries of the same speaker form one block headed by the speaker name and the time of
 * the first entry; a block opened by an addressed command carries a microphone marker. Each entry is a
 * quoted line.
 */
@Component
public class TranscriptMarkdownExporter {

    static final String COMMAND_MARKER = "🎤 ";

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");
    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ZoneId zone;
    private final String botDisplayName;

    public TranscriptMarkdownExporter(VoiceProperties properties) {
        this.zone = ZoneId.of(properties.getExportTimeZone());
        this.botDisplayName = properties.getBotDisplayName();
    }

    /**
     * @param channelName voice channel name
     * @param startedAt session start
     * @param endedAt session end
     * @param entries transcript in processing order
     * @return export with file name, markdown and statistics message
     */
    public TranscriptExport export(String channelName, Instant startedAt, Instant endedAt,
                                   List<TranscriptEntry> entries) {
        return new TranscriptExport(fileName(channelName, startedAt),
                markdown(channelName, startedAt, endedAt, entries),
                statsMessage(startedAt, endedAt, entries));
    }

    String fileName(String channelName, Instant startedAt) {
        String safe = channelName.replaceAll("[^A-Za-z0-9_-]+", "-");
        return "transcript-" + safe + "-" + FILE_DATE.format(startedAt.atZone(zone)) + ".md";
    }

    String markdown(String channelName, Instant startedAt, Instant endedAt, List<TranscriptEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Voice Session Transcript\n\n")
                .append("**Channel:** ").append(channelName).append('\n')
                .append("**Date:** ").append(LONG_DATE.format(startedAt.atZone(zone))).append('\n')
                .append("**Start Time:** ").append(TIME.format(startedAt.atZone(zone))).append('\n')
                .append("**End Time:** ").append(TIME.format(endedAt.atZone(zone))).append('\n')
                .append("\n---\n\n## Transcript\n\n");

        String currentSpeaker = null;
        for (TranscriptEntry entry : entries) {
            if (!entry.speakerId().equals(currentSpeaker)) {
                if (currentSpeaker != null) {
                    sb.append('\n');
                }
                currentSpeaker = entry.speakerId();
                sb.append("### ")
                        .append(entry.speakerDisplayName())
                        .append(" *(")
                        .append(TIME.format(Instant.ofEpochMilli(entry.timestampMs()).atZone(zone)))
                        .append(")*\n\n");
            }
            sb.append("> ").append(entry.command() ? COMMAND_MARKER : "").append(entry.text()).append('\n');
        }
        if (currentSpeaker != null) {
            sb.append('\n');
        }
        sb.append("---\n\n*Generated by ").append(botDisplayName).append(" Voice Assistant*\n");
        return sb.toString();
    }

    String statsMessage(Instant startedAt, Instant endedAt, List<TranscriptEntry> entries) {
        Set<String> speakers = new HashSet<>();
        int commands = 0;
        for (TranscriptEntry entry : entries) {
            speakers.add(entry.speakerId());
            if (entry.command()) {
                commands++;
            }
        }
        return "**Voice Session Ended**\n"
                + "Duration: " + TimeUtils.humanDuration(Duration.between(startedAt, endedAt))
                + " | Speakers: " + speakers.size()
                + " | Entries: " + entries.size()
                + " | Commands: " + commands;
    }
}
