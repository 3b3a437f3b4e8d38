package com.critfumble.fumblebot.service.transcript;

/**
 * A rendered transcript ready for delivery.
 *
 * @param fileName attachment name
 * @param markdown attachment content
 * @param statsMessage message accompanying the attachment
 */
public record TranscriptExport(String fileName, String markdown, String statsMessage) {
}
