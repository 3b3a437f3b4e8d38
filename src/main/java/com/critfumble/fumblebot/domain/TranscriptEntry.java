package com.critfumble.fumblebot.domain;

import java.util.Objects;

/**
 * Immutable record of one utterance in a voice session transcript.
 *
 * <p>Entries are ordered by the order in which the orchestrator processed them. With several speakers
 * a streaming provider may finalize utterances out of true speaking order; the transcript keeps
 * processing order and does not try to repair it.
 *
 * @param speakerId platform user id of the speaker (the bot's own id for bot entries)
 * @param speakerDisplayName display name at the time of the utterance
 * @param text utterance text
 * @param timestampMs epoch millis when the entry was processed
 * @param command true if this entry records an addressed (wake-word) utterance
 */
public record TranscriptEntry(
        String speakerId,
        String speakerDisplayName,
        String text,
        long timestampMs,
        boolean command
) {

    public TranscriptEntry {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        speakerDisplayName = speakerDisplayName == null || speakerDisplayName.isBlank()
                ? "Unknown" : speakerDisplayName;
    }
}
