package com.critfumble.fumblebot.domain;

/**
 * Operating mode of a voice session.
 */
public enum SessionMode {
    /** Record everything; addressed utterances are recorded but never acted on. */
    TRANSCRIBE,
    /** Record everything and respond to addressed utterances. */
    ASSISTANT
}
