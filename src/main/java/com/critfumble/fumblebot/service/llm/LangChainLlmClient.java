package com.critfumble.fumblebot.service.llm;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.exception.ProviderExceptionBuilder;
import com.critfumble.fumblebot.util.TimeUtils;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LlmClient} over an OpenAI-compatible chat model.
 *
 * <p>Models are cached per token limit, since the limit is fixed at build time.
 */
@Service
public class LangChainLlmClient implements LlmClient {

    private static final Logger LOG = LogManager.getLogger(LangChainLlmClient.class);
    private static final String PROVIDER = "llm";

    private final LlmProperties properties;
    private final Map<Integer, ChatLanguageModel> modelCache = new ConcurrentHashMap<>();

    public LangChainLlmClient(LlmProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String complete(String userPrompt, String systemPrompt, int maxTokens) {
        Objects.requireNonNull(userPrompt, "userPrompt must not be null");
        List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(userPrompt));

        long start = System.nanoTime();
        try {
            Response<AiMessage> response = model(maxTokens).generate(messages);
            String text = response.content() != null ? response.content().text() : null;
            LOG.debug("LLM completion: model={}, maxTokens={}, {} ms",
                    properties.getModelName(), maxTokens, TimeUtils.elapsedMillis(start));
            return text != null ? text : "";
        } catch (RuntimeException e) {
            throw ProviderExceptionBuilder.create("LLM completion failed")
                    .provider(PROVIDER)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", properties.getModelName())
                    .build();
        }
    }

    private ChatLanguageModel model(int maxTokens) {
        return modelCache.computeIfAbsent(maxTokens, this::createModel);
    }

    private ChatLanguageModel createModel(int maxTokens) {
        LOG.info("Creating chat model: model={}, maxTokens={}", properties.getModelName(), maxTokens);
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .maxRetries(properties.getMaxRetries())
                .maxTokens(maxTokens);
        if (properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()) {
            builder.baseUrl(properties.getBaseUrl());
        }
        return builder.build();
    }
}
