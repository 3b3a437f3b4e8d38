package com.critfumble.fumblebot.exception;

/**
 * Thrown at session start when no usable provider of a required kind can be selected.
 * This is fatal to the start request only; nothing has been joined or registered when it is thrown.
 */
public class ProviderUnavailableException extends FumbleBotException {

    private final String providerKind;
    private final String requested;

    public ProviderUnavailableException(String providerKind, String requested) {
        super("No usable " + providerKind + " provider (requested: " + requested + ")");
        this.providerKind = providerKind;
        this.requested = requested;
    }

    public String getProviderKind() {
        return providerKind;
    }

    public String getRequested() {
        return requested;
    }
}
