/**
 * Streaming speech-to-text abstractions.
 *
 * <p>Concrete providers live with the hosting bot process; this project only consumes
 * {@link com.critfumble.fumblebot.service.stt.TranscriptionProvider} beans.
 */
package com.critfumble.fumblebot.service.stt;
