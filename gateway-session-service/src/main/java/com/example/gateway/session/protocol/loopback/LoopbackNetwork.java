package com.example.gateway.session.protocol.loopback;

import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.shared.exception.NotConnectedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for the messaging network. Keeps track of the loopback client currently
 * attached for each tenant and lets operators act as the "other side": pair a device, drop a
 * connection, log an account out or deliver a message.
 */
@Slf4j
public class LoopbackNetwork {

    private final Map<String, LoopbackProtocolClient> attached = new ConcurrentHashMap<>();
    private final Map<String, byte[]> attachmentBodies = new ConcurrentHashMap<>();
    private final Map<String, List<SentMessage>> sent = new ConcurrentHashMap<>();
    private final Clock clock;

    public LoopbackNetwork(Clock clock) {
        this.clock = clock;
    }

    void attach(String tenantId, LoopbackProtocolClient client) {
        LoopbackProtocolClient previous = attached.put(tenantId, client);
        if (previous != null && previous != client) {
            log.debug("Loopback client for tenant {} replaced", tenantId);
        }
    }

    void detach(String tenantId, LoopbackProtocolClient client) {
        attached.remove(tenantId, client);
    }

    void recordSent(String tenantId, String targetJid, String text) {
        sent.computeIfAbsent(tenantId, k -> new CopyOnWriteArrayList<>())
                .add(new SentMessage(targetJid, text, null, clock.instant().toEpochMilli()));
    }

    void recordReaction(String tenantId, MessageKey target, String emoji) {
        sent.computeIfAbsent(tenantId, k -> new CopyOnWriteArrayList<>())
                .add(new SentMessage(target.remoteJid(), emoji, target.messageId(), clock.instant().toEpochMilli()));
    }

    Optional<byte[]> attachmentBody(String messageId) {
        return Optional.ofNullable(attachmentBodies.get(messageId));
    }

    /**
     * Completes pairing as if the owner had scanned the pairing token.
     */
    public void pair(String tenantId) {
        client(tenantId).completePairing();
    }

    /**
     * Drops the connection the way a network failure would.
     */
    public void drop(String tenantId) {
        client(tenantId).dropConnection();
    }

    /**
     * Logs the account out from the network side.
     */
    public void logout(String tenantId) {
        client(tenantId).remoteLogout();
    }

    /**
     * Delivers a message to the tenant.
     *
     * @param attachment body of an attachment, or null for a text-only message
     * @return the generated message id
     */
    public String deliver(String tenantId, String fromJid, String pushName, String text, String mimeType, byte[] attachment) {
        String messageId = UUID.randomUUID().toString().replace("-", "").substring(0, 20).toUpperCase();
        InboundMessage.Attachment descriptor = null;
        String type = "conversation";
        if (attachment != null) {
            attachmentBodies.put(messageId, attachment);
            descriptor = new InboundMessage.Attachment(mimeType, null, attachment.length);
            type = messageTypeFor(mimeType);
        }
        InboundMessage message = new InboundMessage(messageId, fromJid, false, pushName, type, text, descriptor, clock.instant());
        client(tenantId).receive(message);
        return messageId;
    }

    /**
     * Pushes address book entries to the tenant as a history sync would.
     */
    public void syncContacts(String tenantId, List<Contact> contacts) {
        client(tenantId).receiveContacts(contacts);
    }

    public void syncChats(String tenantId, List<Chat> chats) {
        client(tenantId).receiveChats(chats);
    }

    public List<SentMessage> sentMessages(String tenantId) {
        return new ArrayList<>(sent.getOrDefault(tenantId, List.of()));
    }

    private LoopbackProtocolClient client(String tenantId) {
        LoopbackProtocolClient client = attached.get(tenantId);
        if (client == null) {
            throw new NotConnectedException("No loopback connection for tenant " + tenantId);
        }
        return client;
    }

    private static String messageTypeFor(String mimeType) {
        if (mimeType == null) {
            return "documentMessage";
        }
        if (mimeType.startsWith("image/")) {
            return "imageMessage";
        }
        if (mimeType.startsWith("video/")) {
            return "videoMessage";
        }
        if (mimeType.startsWith("audio/")) {
            return "audioMessage";
        }
        return "documentMessage";
    }

    /**
     * @param reactedTo id of the message reacted to, in which case {@code text} is the emoji;
     *                  null for a plain text message
     */
    public record SentMessage(String to, String text, String reactedTo, long sentAtMillis) {
    }
}
