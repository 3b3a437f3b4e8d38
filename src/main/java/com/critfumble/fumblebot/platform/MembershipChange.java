package com.critfumble.fumblebot.platform;

/**
 * A member joined, left or moved between voice channels.
 *
 * @param guildId guild where the change happened
 * @param userId member that changed
 * @param previousChannelId voice channel before the change, {@code null} when joining
 * @param currentChannelId voice channel after the change, {@code null} when leaving
 * @param bot whether the member is a bot account
 */
public record MembershipChange(String guildId,
                               String userId,
                               String previousChannelId,
                               String currentChannelId,
                               boolean bot) {

    /**
     * @return true when the change entered or left the given channel
     */
    public boolean touches(String channelId) {
        return channelId != null
                && (channelId.equals(previousChannelId) || channelId.equals(currentChannelId));
    }
}
