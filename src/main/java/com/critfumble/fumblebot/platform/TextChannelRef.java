package com.critfumble.fumblebot.platform;

import java.util.Objects;

/**
 * Identifies a text channel.
 */
public record TextChannelRef(String guildId, String channelId, String name) {

    public TextChannelRef {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(channelId, "channelId");
        name = name == null ? channelId : name;
    }
}
