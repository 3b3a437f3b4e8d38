package com.critfumble.fumblebot.service.llm;

/**
 * Text completion against a language model.
 */
public interface LlmClient {

    /**
     * Completes a prompt.
     *
     * @param userPrompt the user turn
     * @param systemPrompt instructions; may be null
     * @param maxTokens upper bound for the answer
     * @return model text, never null
     * @throws com.critfumble.fumblebot.exception.ProviderException if the call fails
     */
    String complete(String userPrompt, String systemPrompt, int maxTokens);
}
