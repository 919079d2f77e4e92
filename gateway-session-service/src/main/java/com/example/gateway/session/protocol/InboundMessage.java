package com.example.gateway.session.protocol;

import java.time.Instant;

/**
 * A message received from the network.
 *
 * @param type       network message type, e.g. {@code conversation}, {@code imageMessage}
 * @param text       text body or caption, null when the message has none
 * @param attachment null when the message carries no media
 */
public record InboundMessage(
        String messageId,
        String remoteJid,
        boolean fromMe,
        String pushName,
        String type,
        String text,
        Attachment attachment,
        Instant timestamp) {

    public MessageKey key() {
        return new MessageKey(remoteJid, messageId, fromMe);
    }

    public boolean hasAttachment() {
        return attachment != null;
    }

    /**
     * @param fileName     sender supplied name, documents only
     * @param declaredSize size announced by the sender; the downloaded size may differ
     */
    public record Attachment(String mimeType, String fileName, long declaredSize) {
    }
}
