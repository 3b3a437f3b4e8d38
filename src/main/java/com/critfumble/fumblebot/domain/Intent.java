package com.critfumble.fumblebot.domain;

import java.util.Locale;

/**
 * Classified purpose of an addressed utterance.
 */
public enum Intent {
    ROLL_DICE,
    LOOKUP_RULE,
    QUESTION,
    GREETING,
    GOODBYE,
    SEARCH_MESSAGES,
    POST_TO_CHANNEL,
    OTHER;

    /**
     * @return lower-case, hyphenated name used in prompts, logs and metric tags
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parses the model's spelling of an intent ({@code roll_dice}, {@code roll-dice}, {@code ROLL_DICE}).
     *
     * @param value intent as returned by the language model
     * @return parsed intent, {@link #OTHER} when missing or unknown
     */
    public static Intent parse(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return OTHER;
    }
}
