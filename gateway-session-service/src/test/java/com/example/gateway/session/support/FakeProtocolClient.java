package com.example.gateway.session.support;

import com.example.gateway.session.credentials.TenantCredentials;
import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.Identity;
import com.example.gateway.session.protocol.DisconnectReason;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.MessageContent;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.session.protocol.ProtocolListener;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protocol client driven by the test: every signal is raised explicitly on the calling thread.
 */
public class FakeProtocolClient implements ProtocolClient {

    private final String tenantId;
    private final List<SentText> sent = new CopyOnWriteArrayList<>();
    private final List<Reaction> reactions = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<byte[]>> downloads = new ConcurrentHashMap<>();
    private final AtomicInteger logoutCalls = new AtomicInteger();
    private final AtomicInteger closeCalls = new AtomicInteger();

    private volatile ProtocolListener listener;
    private volatile TenantCredentials credentials;
    private volatile CompletableFuture<Void> sendResult = CompletableFuture.completedFuture(null);
    private volatile RuntimeException connectFailure;
    private volatile CountDownLatch logoutEntered;
    private volatile CountDownLatch logoutRelease;

    public FakeProtocolClient(String tenantId) {
        this.tenantId = tenantId;
    }

    @Override
    public void connect(TenantCredentials credentials, ProtocolListener listener) {
        if (connectFailure != null) {
            throw connectFailure;
        }
        this.credentials = credentials;
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> send(String targetJid, MessageContent content) {
        sent.add(new SentText(targetJid, content.text()));
        return sendResult;
    }

    @Override
    public CompletableFuture<Void> react(MessageKey target, String emoji) {
        reactions.add(new Reaction(target, emoji));
        return sendResult;
    }

    @Override
    public CompletableFuture<byte[]> downloadMedia(InboundMessage message) {
        CompletableFuture<byte[]> download = downloads.get(message.messageId());
        return download != null
                ? download
                : CompletableFuture.failedFuture(new IllegalStateException("no media for " + message.messageId()));
    }

    @Override
    public void logout() {
        logoutCalls.incrementAndGet();
        CountDownLatch release = logoutRelease;
        if (release != null) {
            logoutEntered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }

    // --- signals

    public void pairingToken(String token) {
        listener.onPairingToken(token);
    }

    public void open(Identity identity) {
        listener.onOpen(identity);
    }

    public void close(DisconnectReason reason) {
        listener.onClose(reason, "closed by test");
    }

    public void message(InboundMessage message) {
        listener.onMessage(message);
    }

    public void contacts(Contact... contacts) {
        listener.onContacts(List.of(contacts));
    }

    public void chats(Chat... chats) {
        listener.onChats(List.of(chats));
    }

    public void chatsDeleted(String... jids) {
        listener.onChatsDeleted(List.of(jids));
    }

    public void fault(Throwable fault) {
        listener.onFault(fault);
    }

    // --- scripting

    public void failConnectWith(RuntimeException failure) {
        this.connectFailure = failure;
    }

    public void failSendsWith(Throwable failure) {
        this.sendResult = CompletableFuture.failedFuture(failure);
    }

    public void serveMedia(String messageId, byte[] bytes) {
        downloads.put(messageId, CompletableFuture.completedFuture(bytes));
    }

    /**
     * Makes {@link #logout()} block until the returned latch is released.
     */
    public CountDownLatch blockLogout(CountDownLatch entered) {
        this.logoutEntered = entered;
        this.logoutRelease = new CountDownLatch(1);
        return logoutRelease;
    }

    public String tenantId() {
        return tenantId;
    }

    public TenantCredentials credentials() {
        return credentials;
    }

    public List<SentText> sent() {
        return sent;
    }

    public List<Reaction> reactions() {
        return reactions;
    }

    public int logoutCalls() {
        return logoutCalls.get();
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    public record SentText(String to, String text) {
    }

    public record Reaction(MessageKey target, String emoji) {
    }
}
