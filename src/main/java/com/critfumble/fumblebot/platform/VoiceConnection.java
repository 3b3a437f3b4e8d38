package com.critfumble.fumblebot.platform;

/**
 * A live voice connection in one guild. Audio played through it is heard by everyone in the channel.
 */
public interface VoiceConnection {

    String guildId();

    String channelId();

    /**
     * Plays encoded audio and blocks until playback has finished.
     *
     * @param audio encoded audio (mp3, ogg or wav as produced by the speech provider)
     * @throws InterruptedException if the calling thread is interrupted while waiting for playback
     */
    void play(byte[] audio) throws InterruptedException;
}
