package com.critfumble.fumblebot.testutil;

import com.critfumble.fumblebot.platform.VoiceConnection;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Voice connection that records played audio and tracks concurrent playback.
 */
public class FakeVoiceConnection implements VoiceConnection {

    private final String guildId;
    private final String channelId;
    private final List<String> played = new CopyOnWriteArrayList<>();
    private final AtomicInteger playing = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private volatile long playMillis;

    public FakeVoiceConnection(String guildId, String channelId) {
        this.guildId = guildId;
        this.channelId = channelId;
    }

    /** Makes every {@link #play} block for the given time. */
    public void setPlayMillis(long playMillis) {
        this.playMillis = playMillis;
    }

    @Override
    public String guildId() {
        return guildId;
    }

    @Override
    public String channelId() {
        return channelId;
    }

    @Override
    public void play(byte[] audio) throws InterruptedException {
        int now = playing.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            if (playMillis > 0) {
                Thread.sleep(playMillis);
            }
            played.add(new String(audio, StandardCharsets.UTF_8));
        } finally {
            playing.decrementAndGet();
        }
    }

    /** Audio played so far, decoded as the text {@link FakeSpeechSynthesizer} encoded. */
    public List<String> played() {
        return List.copyOf(played);
    }

    public int maxConcurrentPlays() {
        return maxConcurrent.get();
    }
}
