package com.critfumble.fumblebot.exception;

/**
 * Thrown when a call to an external provider (speech synthesis, language model) fails.
 * These failures are never fatal to a session; callers convert them to apologies or silence.
 */
public class ProviderException extends FumbleBotException {

    private final String providerName;

    public ProviderException(String message) {
        super(message);
        this.providerName = "unknown";
    }

    public ProviderException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.providerName = "unknown";
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
