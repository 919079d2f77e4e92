package com.example.gateway.session.protocol;

/**
 * Identifies a message within a chat; what a reaction points at.
 *
 * @param fromMe whether the tenant's own account sent the message
 */
public record MessageKey(String remoteJid, String messageId, boolean fromMe) {
}
