package com.critfumble.fumblebot.service.action;

import java.time.Instant;

/**
 * One message found by {@link MessageSearch}.
 */
public record SearchHit(String channelName, String authorName, String content, Instant timestamp) {
}
