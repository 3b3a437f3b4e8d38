package com.critfumble.fumblebot.service.stt;

/**
 * Handle on an open transcription stream.
 */
public interface TranscriptionStream extends AutoCloseable {

    /**
     * Stops the stream. Idempotent; never throws.
     */
    @Override
    void close();

    boolean isOpen();
}
