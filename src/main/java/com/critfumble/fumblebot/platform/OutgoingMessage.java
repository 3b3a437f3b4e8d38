package com.critfumble.fumblebot.platform;

import java.nio.charset.StandardCharsets;

/**
 * Message content with an optional file attachment.
 *
 * @param content text body (markdown allowed)
 * @param attachmentName file name of the attachment, or {@code null}
 * @param attachment attachment bytes, or {@code null}
 */
public record OutgoingMessage(String content, String attachmentName, byte[] attachment) {

    public static OutgoingMessage text(String content) {
        return new OutgoingMessage(content, null, null);
    }

    public static OutgoingMessage withFile(String content, String fileName, String fileContent) {
        return new OutgoingMessage(content, fileName, fileContent.getBytes(StandardCharsets.UTF_8));
    }

    public boolean hasAttachment() {
        return attachment != null && attachmentName != null;
    }
}
