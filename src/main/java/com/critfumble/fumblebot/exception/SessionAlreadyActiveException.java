package com.critfumble.fumblebot.exception;

/**
 * Thrown when a voice session is started for a guild that already has one.
 * Callers that want idempotent behavior should check {@code isActive(guildId)} first.
 */
public class SessionAlreadyActiveException extends FumbleBotException {

    private final String guildId;

    public SessionAlreadyActiveException(String guildId) {
        super("Voice session already active for guild " + guildId);
        this.guildId = guildId;
    }

    public String getGuildId() {
        return guildId;
    }
}
