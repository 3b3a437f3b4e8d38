package com.critfumble.fumblebot.service.orchestration;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded log of dispatched voice commands across all guilds, newest last.
 */
@Component
public class CommandHistory {

    /**
     * One dispatched command.
     */
    public record Entry(String guildId, String speakerId, String command, Instant at) {
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public CommandHistory(VoiceProperties properties) {
        this.capacity = properties.getCommandHistorySize();
    }

    public synchronized void record(String guildId, String speakerId, String command) {
        if (capacity <= 0) {
            return;
        }
        entries.addLast(new Entry(guildId, speakerId, command, Instant.now()));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * @param limit maximum entries returned
     * @return the most recent entries, oldest first
     */
    public synchronized List<Entry> recent(int limit) {
        List<Entry> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size()));
    }
}
