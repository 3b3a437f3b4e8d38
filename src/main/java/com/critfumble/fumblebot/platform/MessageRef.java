package com.critfumble.fumblebot.platform;

/**
 * Reference to a message previously sent by the bot.
 */
public record MessageRef(String channelId, String messageId) { }
