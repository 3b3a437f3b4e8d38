package com.critfumble.fumblebot.domain;

/**
 * An addressed utterance handed from the transcription router to the intent resolver.
 *
 * @param speakerId who spoke
 * @param fullText the whole addressed phrase, wake phrase included
 * @param commandText the part after the wake phrase
 */
public record Utterance(String speakerId, String fullText, String commandText) {

    public Utterance {
        fullText = fullText == null ? "" : fullText.trim();
        commandText = commandText == null ? "" : commandText.trim();
    }
}
