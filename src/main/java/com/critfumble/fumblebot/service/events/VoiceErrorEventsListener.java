package com.critfumble.fumblebot.service.events;

import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs session error events, throttled per guild and error kind so a failing provider does not flood the log.
 */
@Component
class VoiceErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(VoiceErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onSessionError(VoiceSessionErrorEvent e) {
        String key = e.guildId() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Voice session error in guild {}: kind={}, provider={}, message={}",
                    e.guildId(), e.kind(), e.provider() == null ? "-" : e.provider(), e.message());
        } else {
            LOG.debug("Suppressed repeated {} error for guild {}", e.kind(), e.guildId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
