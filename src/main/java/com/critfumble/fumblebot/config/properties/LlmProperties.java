package com.critfumble.fumblebot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Language model used for intent parsing, answers and summaries.
 */
@Validated
@ConfigurationProperties(prefix = "fumblebot.llm")
public class LlmProperties {

    private String apiKey;

    /** OpenAI-compatible base URL; blank means the provider default. */
    private String baseUrl;

    private String modelName = "gpt-4o-mini";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.3;

    @Positive
    private int timeoutSeconds = 30;

    @PositiveOrZero
    private int maxRetries = 2;

    @Positive
    private int intentMaxTokens = 300;

    @Positive
    private int answerMaxTokens = 250;

    @Positive
    private int summaryMaxTokens = 400;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getIntentMaxTokens() {
        return intentMaxTokens;
    }

    public void setIntentMaxTokens(int intentMaxTokens) {
        this.intentMaxTokens = intentMaxTokens;
    }

    public int getAnswerMaxTokens() {
        return answerMaxTokens;
    }

    public void setAnswerMaxTokens(int answerMaxTokens) {
        this.answerMaxTokens = answerMaxTokens;
    }

    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }
}
