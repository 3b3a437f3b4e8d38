package com.critfumble.fumblebot.domain;

import java.util.Locale;

/**
 * Why the resolver decided (not) to respond to an utterance.
 */
public enum IntentReason {
    WAKE_WORD("wake-word"),
    DICE_REQUEST("dice-request"),
    RULE_QUESTION("rule-question"),
    VALUABLE_INFO("valuable-info"),
    SEARCH_REQUEST("search-request"),
    POST_REQUEST("post-request"),
    NOT_FOR_BOT("not-for-bot");

    private final String wireName;

    IntentReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses the model's spelling of a reason. Accepts hyphen or underscore separators.
     *
     * @param value reason as returned by the language model
     * @param fallback reason to use when the value is missing or unknown
     * @return parsed reason
     */
    public static IntentReason parse(String value, IntentReason fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (IntentReason reason : values()) {
            if (reason.wireName.equals(normalized)) {
                return reason;
            }
        }
        return fallback;
    }
}
