package com.critfumble.fumblebot.platform;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Capabilities of the chat-platform gateway consumed by the voice orchestrator.
 *
 * <p>The gateway connection itself (login, sharding, audio receive) lives with the hosting bot process,
 * which exposes an implementation of this interface as a Spring bean.
 *
 * <p>Methods may throw unchecked exceptions on transport failure; callers in this project treat every
 * such failure as non-fatal to the session.
 */
public interface ChatPlatform {

    /**
     * @return user id of the bot's own account
     */
    String selfUserId();

    /**
     * Joins a voice channel, or returns the existing connection when already joined there.
     *
     * @param channel voice channel to join
     * @return live voice connection
     */
    VoiceConnection joinVoice(VoiceChannelRef channel);

    /**
     * Leaves whatever voice channel the bot occupies in the guild. A no-op when not connected.
     *
     * @param guildId guild identifier
     */
    void leaveVoice(String guildId);

    /**
     * @param guildId guild identifier
     * @return current voice connection for the guild, if any
     */
    Optional<VoiceConnection> currentConnection(String guildId);

    /**
     * Sends a message to a text channel.
     *
     * @return reference to the created message, used for later edits
     */
    MessageRef sendMessage(String channelId, OutgoingMessage message);

    /**
     * Replaces the content of a previously sent message.
     */
    void editMessage(MessageRef message, String content);

    /**
     * Sends a direct message to a user.
     */
    void sendDirectMessage(String userId, OutgoingMessage message);

    /**
     * Counts members of a voice channel that are not bots.
     */
    int countHumanMembers(String guildId, String channelId);

    /**
     * Resolves a member's display name in a guild.
     */
    Optional<String> displayName(String guildId, String userId);

    /**
     * Lists the text channels of a guild.
     */
    List<TextChannelRef> textChannels(String guildId);

    /**
     * Sets (or clears, when {@code null}) the bot's presence/status text.
     */
    void setPresence(String statusText);

    /**
     * Registers a listener for voice membership changes (members joining, leaving or moving between
     * voice channels).
     */
    void onMembershipChange(Consumer<MembershipChange> listener);
}
