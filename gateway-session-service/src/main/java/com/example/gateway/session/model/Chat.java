package com.example.gateway.session.model;

import java.time.Instant;

/**
 * @param name          chat subject, or the contact's name for one-to-one chats
 * @param lastMessageAt time of the latest message in the chat, null when unknown
 */
public record Chat(String jid, String name, Integer unreadCount, Instant lastMessageAt) {
}
