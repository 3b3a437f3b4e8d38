package com.critfumble.fumblebot.platform;

import java.util.Objects;

/**
 * Identifies a voice channel.
 *
 * @param guildId guild that owns the channel
 * @param channelId voice channel id
 * @param name display name, used for presence text and transcript file names
 */
public record VoiceChannelRef(String guildId, String channelId, String name) {

    public VoiceChannelRef {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(channelId, "channelId");
        name = name == null ? channelId : name;
    }
}
