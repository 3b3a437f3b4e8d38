package com.critfumble.fumblebot.service.tts;

import com.critfumble.fumblebot.config.properties.TtsProperties;
import com.critfumble.fumblebot.exception.ProviderException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeepgramSpeechSynthesizerTest {

    private MockWebServer server;
    private DeepgramSpeechSynthesizer tts;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        TtsProperties properties = new TtsProperties();
        properties.getDeepgram().setBaseUrl(server.url("/v1").toString());
        properties.getDeepgram().setApiKey("dg-test");
        tts = new DeepgramSpeechSynthesizer(properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void modelAndEncodingGoInQuery() throws InterruptedException {
        // Arrange
        server.enqueue(new MockResponse().setBody("audio"));

        // Act
        tts.synthesize("Natural twenty!", VoiceParams.defaults());

        // Assert
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v1/speak");
        assertThat(request.getRequestUrl().queryParameter("model")).isEqualTo("aura-orion-en");
        assertThat(request.getRequestUrl().queryParameter("encoding")).isEqualTo("mp3");
        assertThat(request.getHeader("Authorization")).isEqualTo("Token dg-test");
        assertThat(new JSONObject(request.getBody().readUtf8()).getString("text")).isEqualTo("Natural twenty!");
    }

    @Test
    void voiceIdReplacesModel() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("audio"));

        tts.synthesize("hi", new VoiceParams("aura-luna-en", null));

        assertThat(server.takeRequest().getRequestUrl().queryParameter("model")).isEqualTo("aura-luna-en");
    }

    @Test
    void connectionFailureBecomesProviderException() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        }

        assertThatThrownBy(() -> tts.synthesize("hi", null))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("request failed")
                .hasCauseInstanceOf(IOException.class);
        assertThat(tts.name()).isEqualTo(DeepgramSpeechSynthesizer.NAME);
    }
}
