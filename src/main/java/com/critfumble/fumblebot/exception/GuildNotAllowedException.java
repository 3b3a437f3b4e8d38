package com.critfumble.fumblebot.exception;

/**
 * Thrown when voice sessions are restricted to a single guild and another guild asks for one.
 */
public class GuildNotAllowedException extends FumbleBotException {

    private final String guildId;

    public GuildNotAllowedException(String guildId) {
        super("Voice sessions are not enabled for guild " + guildId);
        this.guildId = guildId;
    }

    public String getGuildId() {
        return guildId;
    }
}
