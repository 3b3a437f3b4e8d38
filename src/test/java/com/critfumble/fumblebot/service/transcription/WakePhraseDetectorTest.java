package com.critfumble.fumblebot.service.transcription;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class WakePhraseDetectorTest {

    private final WakePhraseDetector detector = new WakePhraseDetector(new VoiceProperties());

    @ParameterizedTest
    @CsvSource({
            "'hey fumblebot roll d20', 'roll d20'",
            "'Hey, FumbleBot! Roll 2d6+3.', 'roll 2d6+3'",
            "'okay fumble bot what is grapple', 'what is grapple'",
            "'fumblebot, stop listening', 'stop listening'",
            "'Fumble Bot search for the dragon', 'search for the dragon'"
    })
    void extractsCommandAfterWakePhrase(String text, String command) {
        assertThat(detector.detect(text)).contains(command);
    }

    @Test
    void bareWakePhraseYieldsEmptyCommand() {
        assertThat(detector.detect("Hey FumbleBot")).contains("");
    }

    @ParameterizedTest
    @ValueSource(strings = {"I think fumblebot is great", "hey there", "the fumble was bad", ""})
    void ignoresUtterancesNotOpeningWithWakePhrase(String text) {
        assertThat(detector.detect(text)).isEmpty();
    }

    @Test
    void prefersLongestPhrase() {
        assertThat(detector.phrases().get(0)).isEqualTo("okay fumble bot");
        assertThat(detector.detect("hey fumble bot roll")).contains("roll");
    }
}
