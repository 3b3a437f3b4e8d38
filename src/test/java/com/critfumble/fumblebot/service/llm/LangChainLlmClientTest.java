package com.critfumble.fumblebot.service.llm;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.exception.ProviderException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LangChainLlmClientTest {

    private static final String COMPLETION = """
            {"id": "chatcmpl-1", "object": "chat.completion", "created": 1700000000, "model": "gpt-4o-mini",
             "choices": [{"index": 0, "message": {"role": "assistant", "content": "Roll a d20."},
                          "finish_reason": "stop"}],
             "usage": {"prompt_tokens": 12, "completion_tokens": 4, "total_tokens": 16}}""";

    private MockWebServer server;
    private LangChainLlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        LlmProperties properties = new LlmProperties();
        properties.setApiKey("sk-test");
        properties.setBaseUrl(server.url("/v1/").toString());
        properties.setMaxRetries(1);
        properties.setTimeoutSeconds(5);
        client = new LangChainLlmClient(properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsSystemAndUserMessagesWithTokenLimit() throws InterruptedException {
        // Arrange
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(COMPLETION));

        // Act
        String text = client.complete("how do I attack?", "You are FumbleBot.", 120);

        // Assert
        assertThat(text).isEqualTo("Roll a d20.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).endsWith("/chat/completions");
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertThat(body.getString("model")).isEqualTo("gpt-4o-mini");
        assertThat(body.getInt("max_tokens")).isEqualTo(120);
        JSONArray messages = body.getJSONArray("messages");
        assertThat(messages.getJSONObject(0).getString("role")).isEqualTo("system");
        assertThat(messages.getJSONObject(1).getString("role")).isEqualTo("user");
        assertThat(messages.getJSONObject(1).getString("content")).isEqualTo("how do I attack?");
    }

    @Test
    void blankSystemPromptIsOmitted() throws InterruptedException {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(COMPLETION));

        client.complete("hello", " ", 50);

        JSONArray messages = new JSONObject(server.takeRequest().getBody().readUtf8()).getJSONArray("messages");
        assertThat(messages.length()).isEqualTo(1);
    }

    @Test
    void httpErrorBecomesProviderException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\": {\"message\": \"boom\"}}"));

        assertThatThrownBy(() -> client.complete("hello", null, 50))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("LLM completion failed")
                .hasMessageContaining("model=gpt-4o-mini");
    }
}
