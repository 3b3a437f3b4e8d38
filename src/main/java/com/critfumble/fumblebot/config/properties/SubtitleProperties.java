package com.critfumble.fumblebot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Live subtitle rendering in the session's text channel.
 */
@Validated
@ConfigurationProperties(prefix = "fumblebot.voice.subtitles")
public class SubtitleProperties {

    private boolean enabled = true;

    /** Lines kept in the rolling window. */
    @Positive
    private int capacity = 8;

    /** Quiet period before a pending edit is flushed. */
    @Min(0)
    private long debounceMs = 500;

    /** Longer lines are truncated with an ellipsis. */
    @Positive
    private int maxLineLength = 200;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }
}
