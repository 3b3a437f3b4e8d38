package com.critfumble.fumblebot.service.action;

import java.util.List;

/**
 * Searches a guild's message history. Supplied by the hosting bot process.
 */
public interface MessageSearch {

    /**
     * @param guildId guild to search
     * @param query free-text query
     * @param limit maximum hits
     * @return hits, best first; empty when nothing matches
     */
    List<SearchHit> search(String guildId, String query, int limit);
}
