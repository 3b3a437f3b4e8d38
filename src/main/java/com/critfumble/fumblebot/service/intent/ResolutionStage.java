package com.critfumble.fumblebot.service.intent;

import java.util.Locale;

/**
 * Which resolver stage produced an intent.
 */
public enum ResolutionStage {
    /** Deterministic pattern match, no model call. */
    FAST,
    /** Structured answer from the language model. */
    MODEL,
    /** Heuristic after a failed or unparseable model call. */
    FALLBACK;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
