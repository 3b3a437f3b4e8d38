package com.critfumble.fumblebot.domain;

import java.util.Objects;

/**
 * What the bot answers: a display variant for the text channel and a terser variant for speech.
 *
 * @param displayText markdown-capable text for the chat channel
 * @param spokenText plain text for speech synthesis
 */
public record ResponsePair(String displayText, String spokenText) {

    public ResponsePair {
        Objects.requireNonNull(displayText, "displayText");
        spokenText = spokenText == null ? displayText : spokenText;
    }

    public static ResponsePair of(String text) {
        return new ResponsePair(text, text);
    }
}
