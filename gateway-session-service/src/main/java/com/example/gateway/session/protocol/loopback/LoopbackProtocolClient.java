package com.example.gateway.session.protocol.loopback;

import com.example.gateway.session.credentials.TenantCredentials;
import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.Identity;
import com.example.gateway.session.protocol.DisconnectReason;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.MessageContent;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.session.protocol.ProtocolFaultException;
import com.example.gateway.session.protocol.ProtocolListener;
import com.example.gateway.shared.exception.NotConnectedException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Protocol client that talks to a {@link LoopbackNetwork} instead of the real network.
 *
 * <p>Without stored credentials it asks for pairing and waits for {@link LoopbackNetwork#pair};
 * with credentials it opens right away. Signals reach the listener on the given scheduler, never
 * on the caller's thread.</p>
 */
@Slf4j
public class LoopbackProtocolClient implements ProtocolClient {

    private final String tenantId;
    private final LoopbackNetwork network;
    private final Scheduler scheduler;
    private final Duration openDelay;
    private final Disposable.Composite timers = Disposables.composite();

    private volatile TenantCredentials credentials;
    private volatile ProtocolListener listener;
    private volatile boolean open;
    private volatile boolean closed;

    LoopbackProtocolClient(String tenantId, LoopbackNetwork network, Scheduler scheduler, Duration openDelay) {
        this.tenantId = tenantId;
        this.network = network;
        this.scheduler = scheduler;
        this.openDelay = openDelay;
    }

    @Override
    public void connect(TenantCredentials credentials, ProtocolListener listener) {
        if (closed) {
            throw new IllegalStateException("Loopback client for " + tenantId + " is closed");
        }
        this.credentials = credentials;
        this.listener = listener;
        network.attach(tenantId, this);
        later(() -> {
            boolean paired;
            try {
                paired = credentials.load().isPresent();
            } catch (RuntimeException e) {
                listener.onFault(new ProtocolFaultException("Credential store unavailable: " + e.getMessage(), true, e));
                return;
            }
            if (paired) {
                markOpen();
            } else {
                listener.onPairingToken("loopback:" + tenantId + ":" + UUID.randomUUID());
            }
        });
    }

    @Override
    public CompletableFuture<Void> send(String targetJid, MessageContent content) {
        if (!open || closed) {
            return CompletableFuture.failedFuture(new NotConnectedException("Loopback client for " + tenantId + " is not open"));
        }
        network.recordSent(tenantId, targetJid, content.text());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> react(MessageKey target, String emoji) {
        if (!open || closed) {
            return CompletableFuture.failedFuture(new NotConnectedException("Loopback client for " + tenantId + " is not open"));
        }
        network.recordReaction(tenantId, target, emoji);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<byte[]> downloadMedia(InboundMessage message) {
        return network.attachmentBody(message.messageId())
                .map(CompletableFuture::completedFuture)
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new IllegalStateException("No attachment stored for message " + message.messageId())));
    }

    @Override
    public void logout() {
        TenantCredentials current = credentials;
        if (current != null) {
            current.delete();
        }
        open = false;
        log.debug("Loopback client for tenant {} logged out", tenantId);
    }

    @Override
    public void close() {
        closed = true;
        open = false;
        timers.dispose();
        network.detach(tenantId, this);
    }

    void completePairing() {
        if (open) {
            return;
        }
        credentials.save(("loopback-device:" + tenantId + ":" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8));
        later(this::markOpen);
    }

    void dropConnection() {
        open = false;
        network.detach(tenantId, this);
        later(() -> listener.onClose(DisconnectReason.CONNECTION_LOST, "loopback connection dropped"));
    }

    void remoteLogout() {
        open = false;
        network.detach(tenantId, this);
        later(() -> listener.onClose(DisconnectReason.LOGGED_OUT, "logged out from another device"));
    }

    void receive(InboundMessage message) {
        whenOpen(() -> listener.onMessage(message));
    }

    void receiveContacts(List<Contact> contacts) {
        whenOpen(() -> listener.onContacts(List.copyOf(contacts)));
    }

    void receiveChats(List<Chat> chats) {
        whenOpen(() -> listener.onChats(List.copyOf(chats)));
    }

    private void whenOpen(Runnable signal) {
        if (!open) {
            throw new NotConnectedException("Loopback client for " + tenantId + " is not open");
        }
        scheduler.schedule(() -> {
            if (!closed) {
                signal.run();
            }
        });
    }

    private void markOpen() {
        open = true;
        listener.onOpen(identityFor(tenantId));
    }

    private void later(Runnable signal) {
        timers.add(Mono.delay(openDelay, scheduler).subscribe(tick -> {
            if (!closed) {
                signal.run();
            }
        }));
    }

    static Identity identityFor(String tenantId) {
        String phone = String.format("1555%07d", Math.floorMod(tenantId.hashCode(), 10_000_000));
        return new Identity(phone + "@s.whatsapp.net", "+" + phone);
    }
}
