package com.critfumble.fumblebot.service.transcript;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.testutil.FakeLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionSummarizerTest {

    private FakeLlmClient llm;
    private LlmProperties llmProperties;
    private SessionSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llm = new FakeLlmClient();
        llmProperties = new LlmProperties();
        summarizer = new SessionSummarizer(llm, new VoiceProperties(), llmProperties);
    }

    private static List<TranscriptEntry> entries(int n) {
        List<TranscriptEntry> list = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            list.add(new TranscriptEntry("u" + (i % 2), i % 2 == 0 ? "Bob" : "Alice", "line " + i, i, false));
        }
        return list;
    }

    @Test
    void shortTranscriptIsNotSummarized() {
        assertThat(summarizer.summarize(entries(2))).isEmpty();
        assertThat(llm.calls()).isEmpty();
    }

    @Test
    void summaryUsesTranscriptAndBudget() {
        // Arrange
        llm.reply("  - The party rested.  ");

        // Act
        assertThat(summarizer.summarize(entries(3))).contains("- The party rested.");

        // Assert
        FakeLlmClient.Call call = llm.calls().get(0);
        assertThat(call.userPrompt()).startsWith("TRANSCRIPT:\nAlice: line 1\nBob: line 2\nAlice: line 3");
        assertThat(call.systemPrompt()).isEqualTo(SessionSummarizer.SYSTEM_PROMPT);
        assertThat(call.maxTokens()).isEqualTo(llmProperties.getSummaryMaxTokens());
    }

    @Test
    void blankOrFailedSummaryIsEmpty() {
        llm.reply("   ");
        assertThat(summarizer.summarize(entries(4))).isEmpty();

        llm.failing(true);
        assertThat(summarizer.summarize(entries(4))).isEmpty();
    }

    @Test
    void excerptFallbackListsLastEntries() {
        llm.failing(true);

        String text = summarizer.summaryOrExcerpt(entries(25));

        assertThat(text).startsWith("**Transcript excerpt** (last 20 entries)\n**Bob**: line 6\n")
                .endsWith("**Alice**: line 25");
    }

    @Test
    void excerptOfEmptyTranscript() {
        assertThat(summarizer.excerpt(List.of(), 5)).isEqualTo("_Nothing was said in this session._");
    }
}
