package com.critfumble.fumblebot.service.metrics;

import com.critfumble.fumblebot.service.session.SessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the voice pipeline.
 *
 * <p>Metric names are prefixed with {@code fumblebot.voice}:
 * <ul>
 *   <li>{@code intent.resolved} counter, tags {@code stage} (fast, model, fallback) and {@code intent}</li>
 *   <li>{@code dispatch.latency} timer, tag {@code intent}</li>
 *   <li>{@code provider.failure} counter, tags {@code provider} and {@code kind}</li>
 *   <li>{@code sessions.active} gauge</li>
 * </ul>
 */
@Component
public class VoiceSessionMetrics {

    private static final String METRIC_PREFIX = "fumblebot.voice";

    private final MeterRegistry registry;

    public VoiceSessionMetrics(MeterRegistry registry, SessionRegistry sessions) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", sessions, SessionRegistry::size)
                .description("Voice sessions currently registered")
                .register(registry);
    }

    public void recordIntent(String stage, String intent) {
        Counter.builder(METRIC_PREFIX + ".intent.resolved")
                .description("Addressed utterances classified, by resolver stage")
                .tag("stage", stage)
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String intent, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".dispatch.latency")
                .description("Time taken to execute an intent")
                .tag("intent", intent)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementProviderFailure(String provider, String kind) {
        Counter.builder(METRIC_PREFIX + ".provider.failure")
                .description("Provider calls that failed")
                .tag("provider", provider == null ? "unknown" : provider)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
