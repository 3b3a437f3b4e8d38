package com.critfumble.fumblebot.exception;

/**
 * Thrown when an operation targets a guild that has no voice session.
 */
public class SessionNotActiveException extends FumbleBotException {

    private final String guildId;

    public SessionNotActiveException(String guildId) {
        super("No voice session active for guild " + guildId);
        this.guildId = guildId;
    }

    public String getGuildId() {
        return guildId;
    }
}
