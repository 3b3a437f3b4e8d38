package com.critfumble.fumblebot.service.orchestration;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandHistoryTest {

    private static CommandHistory withCapacity(int capacity) {
        VoiceProperties properties = new VoiceProperties();
        properties.setCommandHistorySize(capacity);
        return new CommandHistory(properties);
    }

    @Test
    void keepsNewestEntriesUpToCapacity() {
        CommandHistory history = withCapacity(3);
        for (int i = 1; i <= 5; i++) {
            history.record("g1", "u1", "command " + i);
        }

        assertThat(history.recent(10)).extracting(CommandHistory.Entry::command)
                .containsExactly("command 3", "command 4", "command 5");
        assertThat(history.recent(2)).extracting(CommandHistory.Entry::command)
                .containsExactly("command 4", "command 5");
        assertThat(history.recent(-1)).isEmpty();
    }

    @Test
    void zeroCapacityRecordsNothing() {
        CommandHistory history = withCapacity(0);

        history.record("g1", "u1", "roll d20");

        assertThat(history.recent(5)).isEmpty();
    }
}
