package com.critfumble.fumblebot.service.intent;

import com.critfumble.fumblebot.domain.IntentResult;

import java.util.Objects;

/**
 * An intent together with the stage that produced it.
 */
public record ResolvedIntent(IntentResult result, ResolutionStage stage) {

    public ResolvedIntent {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
    }
}
