package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptMarkdownExporterTest {

    private static final Instant START = Instant.parse("2024-03-09T19:00:00Z");
    private static final Instant END = Instant.parse("2024-03-09T20:05:30Z");

    private final TranscriptMarkdownExporter exporter = new TranscriptMarkdownExporter(new VoiceProperties());

    private static TranscriptEntry entry(String id, String name, String text, int offsetSeconds, boolean command) {
        return new TranscriptEntry(id, name, text, START.plusSeconds(offsetSeconds).toEpochMilli(), command);
    }

    @Test
    void fileNameIsSafeAndTimestamped() {
        assertThat(exporter.fileName("Table Voice #1", START))
                .isEqualTo("transcript-Table-Voice-1-2024-03-09-19-00-00.md");
    }

    @Test
    void consecutiveEntriesOfOneSpeakerShareABlock() {
        // Arrange
        List<TranscriptEntry> entries = List.of(
                entry("u1", "Alice", "I open the door", 5, false),
                entry("u1", "Alice", "carefully", 7, false),
                entry("u2", "Bob", "hey fumblebot roll d20", 12, true),
                entry("bot", "FumbleBot", "17", 14, false));

        // Act
        String markdown = exporter.markdown("Table Voice", START, END, entries);

        // Assert
        assertThat(markdown).startsWith("# Voice Session Transcript\n\n**Channel:** Table Voice\n")
                .contains("**Date:** Saturday, March 9, 2024\n")
                .contains("**Start Time:** 19:00:00\n**End Time:** 20:05:30\n")
                .contains("### Alice *(19:00:05)*\n\n> I open the door\n> carefully\n\n"
                        + "### Bob *(19:00:12)*\n\n> 🎤 hey fumblebot roll d20\n\n"
                        + "### FumbleBot *(19:00:14)*\n\n> 17\n\n")
                .endsWith("---\n\n*Generated by FumbleBot Voice Assistant*\n");
    }

    @Test
    void commandFollowingPassiveLineOfSameSpeakerIsMarked() {
        List<TranscriptEntry> entries = List.of(
                entry("u2", "Bob", "hey fumblebot roll d20", 1, false),
                entry("u2", "Bob", "Hey FumbleBot, roll d20", 2, true));

        String markdown = exporter.markdown("Table Voice", START, END, entries);

        assertThat(markdown).contains("> hey fumblebot roll d20\n> 🎤 Hey FumbleBot, roll d20\n");
        assertThat(markdown).containsOnlyOnce("### Bob");
    }

    @Test
    void emptyTranscriptStillHasHeaderAndFooter() {
        String markdown = exporter.markdown("Table Voice", START, END, List.of());

        assertThat(markdown).contains("## Transcript\n\n---\n\n*Generated by");
    }

    @Test
    void statsCountSpeakersEntriesAndCommands() {
        List<TranscriptEntry> entries = List.of(
                entry("u1", "Alice", "a", 1, false),
                entry("u2", "Bob", "hey fumblebot b", 2, true),
                entry("u1", "Alice", "c", 3, false));

        assertThat(exporter.statsMessage(START, END, entries)).isEqualTo(
                "**Voice Session Ended**\nDuration: 1h 5m | Speakers: 2 | Entries: 3 | Commands: 1");
    }

    @Test
    void exportBundlesAllParts() {
        TranscriptExport export = exporter.export("Table Voice", START, END, List.of());

        assertThat(export.fileName()).endsWith(".md");
        assertThat(export.markdown()).contains("**Channel:** Table Voice");
        assertThat(export.statsMessage()).contains("Entries: 0");
    }
}
