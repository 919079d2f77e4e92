package com.example.gateway.session.protocol;

import com.example.gateway.session.credentials.TenantCredentials;

import java.util.concurrent.CompletableFuture;

/**
 * One connection to the messaging network for one tenant. Wire protocol, encryption and
 * device pairing live behind this interface.
 *
 * <p>A client instance is used for a single connection attempt. Listener callbacks may arrive
 * on any thread. {@link #logout()} and {@link #close()} must not wait for callbacks that are
 * still in progress.</p>
 */
public interface ProtocolClient {

    /**
     * Starts connecting. Returns once the attempt is under way; progress is reported to
     * {@code listener}. May throw if the attempt cannot even begin.
     */
    void connect(TenantCredentials credentials, ProtocolListener listener);

    CompletableFuture<Void> send(String targetJid, MessageContent content);

    /**
     * Reacts to {@code target} with {@code emoji} in the chat the message belongs to.
     */
    CompletableFuture<Void> react(MessageKey target, String emoji);

    /**
     * Downloads the attachment of an inbound message.
     */
    CompletableFuture<byte[]> downloadMedia(InboundMessage message);

    /**
     * Unlinks this device from the account. Credentials become useless afterwards.
     */
    void logout();

    void close();
}
