package com.critfumble.fumblebot.service.session;

/**
 * Ends a guild's session from inside the pipeline (e.g., a spoken goodbye).
 */
public interface SessionTerminator {

    /**
     * Stops the guild's session if one is active.
     *
     * @return true if this call stopped it
     */
    boolean stopIfActive(String guildId);
}
