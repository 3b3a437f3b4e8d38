package com.critfumble.fumblebot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials and voices for the HTTP speech synthesis providers.
 * A provider without an API key reports itself unavailable.
 */
@ConfigurationProperties(prefix = "fumblebot.tts")
public class TtsProperties {

    private Endpoint openai = new Endpoint("https://api.openai.com/v1", "tts-1", "onyx", 0.9);
    private Endpoint deepgram = new Endpoint("https://api.deepgram.com/v1", "aura-orion-en", "aura-orion-en", 1.0);

    public Endpoint getOpenai() {
        return openai;
    }

    public void setOpenai(Endpoint openai) {
        this.openai = openai;
    }

    public Endpoint getDeepgram() {
        return deepgram;
    }

    public void setDeepgram(Endpoint deepgram) {
        this.deepgram = deepgram;
    }

    /**
     * One provider endpoint.
     */
    public static class Endpoint {
        private String apiKey;
        private String baseUrl;
        private String model;
        private String voice;
        private double speed;
        private String format = "mp3";
        private int timeoutSeconds = 20;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, String model, String voice, double speed) {
            this.baseUrl = baseUrl;
            this.model = model;
            this.voice = voice;
            this.speed = speed;
        }

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

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public double getSpeed() {
            return speed;
        }

        public void setSpeed(double speed) {
            this.speed = speed;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
