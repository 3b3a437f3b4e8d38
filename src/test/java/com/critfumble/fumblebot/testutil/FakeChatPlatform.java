package com.critfumble.fumblebot.testutil;

import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.MembershipChange;
import com.critfumble.fumblebot.platform.MessageRef;
import com.critfumble.fumblebot.platform.OutgoingMessage;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.platform.VoiceChannelRef;
import com.critfumble.fumblebot.platform.VoiceConnection;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory chat platform recording everything the bot does.
 */
public class FakeChatPlatform implements ChatPlatform {

    /** A message sent to a text channel. */
    public record Sent(String channelId, OutgoingMessage message, MessageRef ref) {
    }

    /** An edit of a previously sent message. */
    public record Edit(MessageRef ref, String content) {
    }

    /** A direct message. */
    public record Direct(String userId, OutgoingMessage message) {
    }

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final List<Edit> edits = new CopyOnWriteArrayList<>();
    public final List<Direct> directMessages = new CopyOnWriteArrayList<>();
    public final List<String> presence = new CopyOnWriteArrayList<>();
    public final List<String> joins = new CopyOnWriteArrayList<>();
    public final List<String> leaves = new CopyOnWriteArrayList<>();
    public static final String SELF_ID = "bot-self";

    /** Logging-context guild id seen by each send, in send order. */
    public final List<String> sendGuildContexts = new CopyOnWriteArrayList<>();
    public final List<Consumer<MembershipChange>> membershipListeners = new CopyOnWriteArrayList<>();

    private final Map<String, Integer> humans = new ConcurrentHashMap<>();
    private final Map<String, FakeVoiceConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, String> displayNames = new ConcurrentHashMap<>();
    private final Map<String, List<TextChannelRef>> textChannels = new ConcurrentHashMap<>();
    private final AtomicInteger messageIds = new AtomicInteger();
    private volatile boolean failEdits;
    private volatile boolean failSends;
    private volatile boolean failDirectMessages;

    public void setHumans(String channelId, int count) {
        humans.put(channelId, count);
    }

    public void setDisplayName(String userId, String name) {
        displayNames.put(userId, name);
    }

    public void addTextChannel(TextChannelRef channel) {
        textChannels.computeIfAbsent(channel.guildId(), g -> new CopyOnWriteArrayList<>()).add(channel);
    }

    public void failEdits(boolean fail) {
        this.failEdits = fail;
    }

    public void failDirectMessages(boolean fail) {
        this.failDirectMessages = fail;
    }

    public void failSends(boolean fail) {
        this.failSends = fail;
    }

    /** Delivers a membership change to every registered listener. */
    public void fireMembershipChange(MembershipChange change) {
        membershipListeners.forEach(l -> l.accept(change));
    }

    public FakeVoiceConnection connection(String guildId) {
        return connections.get(guildId);
    }

    /** Messages sent to a channel, by content. */
    public List<String> contentsSentTo(String channelId) {
        List<String> result = new ArrayList<>();
        for (Sent s : sent) {
            if (s.channelId().equals(channelId)) {
                result.add(s.message().content());
            }
        }
        return result;
    }

    @Override
    public String selfUserId() {
        return SELF_ID;
    }

    @Override
    public VoiceConnection joinVoice(VoiceChannelRef channel) {
        joins.add(channel.channelId());
        return connections.computeIfAbsent(channel.guildId(),
                g -> new FakeVoiceConnection(g, channel.channelId()));
    }

    @Override
    public void leaveVoice(String guildId) {
        leaves.add(guildId);
        connections.remove(guildId);
    }

    @Override
    public Optional<VoiceConnection> currentConnection(String guildId) {
        return Optional.ofNullable(connections.get(guildId));
    }

    @Override
    public MessageRef sendMessage(String channelId, OutgoingMessage message) {
        if (failSends) {
            throw new IllegalStateException("send failed");
        }
        MessageRef ref = new MessageRef(channelId, "m" + messageIds.incrementAndGet());
        sendGuildContexts.add(String.valueOf(ThreadContext.get("guildId")));
        sent.add(new Sent(channelId, message, ref));
        return ref;
    }

    @Override
    public void editMessage(MessageRef message, String content) {
        if (failEdits) {
            throw new IllegalStateException("Unknown message");
        }
        edits.add(new Edit(message, content));
    }

    @Override
    public void sendDirectMessage(String userId, OutgoingMessage message) {
        if (failDirectMessages) {
            throw new IllegalStateException("Cannot send messages to this user");
        }
        directMessages.add(new Direct(userId, message));
    }

    @Override
    public int countHumanMembers(String guildId, String channelId) {
        return humans.getOrDefault(channelId, 0);
    }

    @Override
    public Optional<String> displayName(String guildId, String userId) {
        return Optional.ofNullable(displayNames.get(userId));
    }

    @Override
    public List<TextChannelRef> textChannels(String guildId) {
        return List.copyOf(textChannels.getOrDefault(guildId, List.of()));
    }

    @Override
    public void setPresence(String statusText) {
        presence.add(statusText == null ? "<cleared>" : statusText);
    }

    @Override
    public void onMembershipChange(Consumer<MembershipChange> listener) {
        membershipListeners.add(listener);
    }
}
