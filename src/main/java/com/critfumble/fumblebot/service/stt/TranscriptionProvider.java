package com.critfumble.fumblebot.service.stt;

import com.critfumble.fumblebot.platform.VoiceConnection;

/**
 * Contract for streaming speech-to-text providers.
 *
 * <p>Implementations wrap a vendor streaming API behind a unified interface and are supplied by the
 * hosting bot process as Spring beans. The provider selector picks one per session at start time.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #isAvailable()} is checked once when a session starts</li>
 *   <li>{@link #start} opens a stream on the session's voice connection</li>
 *   <li>the stream emits events to the listener until {@link TranscriptionStream#close()}</li>
 * </ol>
 *
 * <p>Listener callbacks may arrive on any thread, including after the stream was closed. Consumers are
 * expected to discard late events themselves.
 */
public interface TranscriptionProvider {

    /**
     * @return provider name used in configuration and logs (e.g., "deepgram", "whisper")
     */
    String name();

    /**
     * Checks whether the provider is configured and reachable enough to open a stream.
     *
     * @return true if the provider can be selected
     */
    boolean isAvailable();

    /**
     * Opens a transcription stream on a live voice connection.
     *
     * @param connection voice connection to receive audio from
     * @param guildId guild the connection belongs to
     * @param hint vocabulary hint biasing recognition; may be blank
     * @param listener receiver of transcription events
     * @return open stream handle
     * @throws com.critfumble.fumblebot.exception.ProviderException if the stream cannot be opened
     */
    TranscriptionStream start(VoiceConnection connection, String guildId, String hint,
                              TranscriptionListener listener);
}
