package com.critfumble.fumblebot.testutil;

import com.critfumble.fumblebot.exception.ProviderException;
import com.critfumble.fumblebot.service.llm.LlmClient;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted language model. Queued replies are returned in order; once empty, the default reply is used.
 */
public class FakeLlmClient implements LlmClient {

    /** One recorded call. */
    public record Call(String userPrompt, String systemPrompt, int maxTokens) {
    }

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile String defaultReply = "";
    private volatile boolean failing;

    public synchronized FakeLlmClient reply(String text) {
        replies.addLast(text);
        return this;
    }

    public FakeLlmClient defaultReply(String text) {
        this.defaultReply = text;
        return this;
    }

    public FakeLlmClient failing(boolean failing) {
        this.failing = failing;
        return this;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    @Override
    public synchronized String complete(String userPrompt, String systemPrompt, int maxTokens) {
        calls.add(new Call(userPrompt, systemPrompt, maxTokens));
        if (failing) {
            throw new ProviderException("model unavailable", "llm");
        }
        String next = replies.pollFirst();
        return next != null ? next : defaultReply;
    }
}
