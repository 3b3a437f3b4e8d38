package com.critfumble.fumblebot.service.action;

import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.TextChannelRef;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a spoken channel name to a text channel: exact match first, then substring match.
 *
 * <p>Names are compared after lower-casing, dropping a leading '#' and joining words with hyphens, so
 * "session logs" matches {@code session-logs} and "logs" matches it by substring.
 */
@Component
public class ChannelResolver {

    private final ChatPlatform chatPlatform;

    public ChannelResolver(ChatPlatform chatPlatform) {
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
    }

    public Optional<TextChannelRef> resolve(String guildId, String spokenName) {
        String wanted = normalize(spokenName);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        List<TextChannelRef> channels = chatPlatform.textChannels(guildId);
        for (TextChannelRef channel : channels) {
            if (normalize(channel.name()).equals(wanted)) {
                return Optional.of(channel);
            }
        }
        for (TextChannelRef channel : channels) {
            String name = normalize(channel.name());
            if (name.contains(wanted)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String out = name.trim().toLowerCase(Locale.ROOT);
        if (out.startsWith("#")) {
            out = out.substring(1);
        }
        out = out.replaceAll("\\bchannel\\b", " ");
        return out.trim().replaceAll("[\\s_]+", "-");
    }
}
