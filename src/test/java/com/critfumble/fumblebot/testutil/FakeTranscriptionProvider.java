package com.critfumble.fumblebot.testutil;

import com.critfumble.fumblebot.exception.ProviderException;
import com.critfumble.fumblebot.platform.VoiceConnection;
import com.critfumble.fumblebot.service.stt.TranscriptionEvent;
import com.critfumble.fumblebot.service.stt.TranscriptionListener;
import com.critfumble.fumblebot.service.stt.TranscriptionProvider;
import com.critfumble.fumblebot.service.stt.TranscriptionStream;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transcription provider driven by the test: every opened stream is recorded and its listener can be fed
 * events directly.
 */
public class FakeTranscriptionProvider implements TranscriptionProvider {

    private final String name;
    private final boolean available;
    private final List<FakeStream> streams = new CopyOnWriteArrayList<>();
    private volatile boolean failStart;

    public FakeTranscriptionProvider(String name, boolean available) {
        this.name = name;
        this.available = available;
    }

    public void setFailStart(boolean failStart) {
        this.failStart = failStart;
    }

    public List<FakeStream> streams() {
        return List.copyOf(streams);
    }

    public FakeStream lastStream() {
        return streams.get(streams.size() - 1);
    }

    public long openStreamCount() {
        return streams.stream().filter(FakeStream::isOpen).count();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public TranscriptionStream start(VoiceConnection connection, String guildId, String hint,
                                     TranscriptionListener listener) {
        if (failStart) {
            throw new ProviderException("stream refused", name);
        }
        FakeStream stream = new FakeStream(guildId, hint, listener);
        streams.add(stream);
        return stream;
    }

    /**
     * Open stream whose listener the test can drive.
     */
    public static final class FakeStream implements TranscriptionStream {
        private final String guildId;
        private final String hint;
        private final TranscriptionListener listener;
        private final AtomicBoolean open = new AtomicBoolean(true);

        FakeStream(String guildId, String hint, TranscriptionListener listener) {
            this.guildId = guildId;
            this.hint = hint;
            this.listener = listener;
        }

        public String guildId() {
            return guildId;
        }

        public String hint() {
            return hint;
        }

        public TranscriptionListener listener() {
            return listener;
        }

        /** Emits a final transcription, even after close, like a late provider callback. */
        public void say(String speakerId, String text) {
            listener.onTranscription(new TranscriptionEvent(speakerId, text, true));
        }

        public void interim(String speakerId, String text) {
            listener.onTranscription(new TranscriptionEvent(speakerId, text, false));
        }

        @Override
        public void close() {
            open.set(false);
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}
