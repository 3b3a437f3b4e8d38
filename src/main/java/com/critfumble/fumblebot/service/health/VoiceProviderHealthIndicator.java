package com.critfumble.fumblebot.service.health;

import com.critfumble.fumblebot.service.provider.ProviderSelector;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the voice providers.
 *
 * <ul>
 *   <li>UP: transcription and speech available</li>
 *   <li>DEGRADED: transcription only; sessions answer by text</li>
 *   <li>DOWN: no transcription provider, sessions cannot start</li>
 * </ul>
 */
@Component
public class VoiceProviderHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ProviderSelector selector;
    private final SessionRegistry registry;

    public VoiceProviderHealthIndicator(ProviderSelector selector, SessionRegistry registry) {
        this.selector = selector;
        this.registry = registry;
    }

    @Override
    public Health health() {
        boolean transcription = selector.hasAvailableTranscription();
        boolean speech = selector.hasAvailableSpeech();

        Health.Builder builder;
        if (transcription && speech) {
            builder = Health.up();
        } else if (transcription) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.down();
        }
        return builder
                .withDetail("transcription", transcription ? "available" : "unavailable")
                .withDetail("speech", speech ? "available" : "unavailable")
                .withDetail("activeSessions", registry.size())
                .build();
    }
}
