package com.critfumble.fumblebot.service.events;

import com.critfumble.fumblebot.service.orchestration.event.VoiceSessionErrorEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class VoiceErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogsPerKey() {
        VoiceErrorEventsListener l = new VoiceErrorEventsListener();

        assertThat(l.shouldLog("g1-speech")).isTrue();
        assertThat(l.shouldLog("g1-speech")).isFalse();
        // other guild or kind is logged independently
        assertThat(l.shouldLog("g2-speech")).isTrue();
        assertThat(l.shouldLog("g1-transcription")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        VoiceErrorEventsListener l = new VoiceErrorEventsListener();

        assertThatCode(() -> {
            l.onSessionError(new VoiceSessionErrorEvent("g1", "speech", "openai", "429", null, null));
            l.onSessionError(new VoiceSessionErrorEvent("g1", "speech", null, "again", null, null));
        }).doesNotThrowAnyException();
    }

    @Test
    void eventTimestampDefaultsToNow() {
        VoiceSessionErrorEvent event = new VoiceSessionErrorEvent("g1", "export", null, "failed", null, null);

        assertThat(event.at()).isNotNull();
    }
}
