package com.example.gateway.session.connection;

import com.example.gateway.session.credentials.TenantCredentials;
import com.example.gateway.session.directory.ContactDirectory;
import com.example.gateway.session.event.EventBus;
import com.example.gateway.session.event.EventPayload;
import com.example.gateway.session.event.GatewayEvent;
import com.example.gateway.session.media.MediaCaptureService;
import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.model.SessionStatus;
import com.example.gateway.session.protocol.DisconnectReason;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.Jids;
import com.example.gateway.session.protocol.MessageContent;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.session.protocol.ProtocolClientFactory;
import com.example.gateway.session.protocol.ProtocolFaultException;
import com.example.gateway.session.protocol.ProtocolListener;
import com.example.gateway.shared.exception.ErrorCode;
import com.example.gateway.shared.exception.GatewayException;
import com.example.gateway.shared.exception.NotConnectedException;
import com.example.gateway.shared.exception.SessionStartException;
import com.example.gateway.shared.exception.TerminalLogoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle of one tenant session, driven by the signals of its protocol client.
 *
 * <p>All state is guarded by the tenant lock, which is shared with the session registry so
 * that protocol signals and start/reset/stop never interleave. Every connection attempt gets a
 * new generation number; signals from a client of an earlier attempt are ignored.</p>
 *
 * <p>{@link #snapshot()} never takes the lock.</p>
 */
@Slf4j
public class ConnectionStateMachine {

    private final String tenantId;
    private final ReentrantLock lock;
    private final ProtocolClientFactory clientFactory;
    private final TenantCredentials credentials;
    private final EventBus eventBus;
    private final MediaCaptureService mediaCapture;
    private final ContactDirectory directory;
    private final ConnectionLifecycleListener lifecycleListener;
    private final Clock clock;
    private final Instant startedAt;

    private SessionStatus status = SessionStatus.PENDING;
    private boolean terminal;
    private String lastQr;
    private Identity identity;
    private Instant lastTransitionAt;
    private ProtocolClient client;
    private long generation;
    private volatile SessionSnapshot snapshot;

    public ConnectionStateMachine(String tenantId,
                                  ReentrantLock lock,
                                  ProtocolClientFactory clientFactory,
                                  TenantCredentials credentials,
                                  EventBus eventBus,
                                  MediaCaptureService mediaCapture,
                                  ContactDirectory directory,
                                  ConnectionLifecycleListener lifecycleListener,
                                  Clock clock) {
        this.tenantId = tenantId;
        this.lock = lock;
        this.clientFactory = clientFactory;
        this.credentials = credentials;
        this.eventBus = eventBus;
        this.mediaCapture = mediaCapture;
        this.directory = directory;
        this.lifecycleListener = lifecycleListener;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastTransitionAt = startedAt;
        refreshSnapshot();
    }

    public SessionSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Publishes the initial {@code pending} status.
     */
    public void announce() {
        lock.lock();
        try {
            publishStatus();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts a new connection attempt, discarding the client of any previous one.
     *
     * @throws SessionStartException if the protocol client could not even begin connecting;
     *                               the session is then in {@code error} as after any fault
     */
    public void connect() {
        lock.lock();
        try {
            if (terminal) {
                throw new IllegalStateException("Session " + tenantId + " is " + status.wireName());
            }
            discardClient(false);
            long attempt = ++generation;
            lastQr = null;
            transition(SessionStatus.CONNECTING);
            publishStatus();
            try {
                ProtocolClient next = clientFactory.create(tenantId);
                client = next;
                next.connect(credentials, new AttemptListener(attempt));
            } catch (RuntimeException e) {
                log.error("Tenant {} failed to start connection attempt {}: {}", tenantId, attempt, e.getMessage());
                if (attempt == generation) {
                    handleFault(attempt, e);
                }
                throw new SessionStartException("Failed to connect session " + tenantId + ": " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a supervised reconnection, provided nothing has happened to the session since the
     * attempt that dropped.
     *
     * @return false when the attempt was stale and nothing was done
     */
    public boolean reconnect(long droppedAttempt) {
        lock.lock();
        try {
            if (droppedAttempt != generation || terminal || !status.isAwaitingReconnect()) {
                log.debug("Tenant {}: reconnect for attempt {} dropped (generation {}, status {})",
                        tenantId, droppedAttempt, generation, status.wireName());
                return false;
            }
            connect();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The reconnection policy gave up: the session ends in terminal {@code error}.
     */
    public void markExhausted(long droppedAttempt) {
        lock.lock();
        try {
            if (droppedAttempt != generation || terminal) {
                return;
            }
            terminal = true;
            transition(SessionStatus.ERROR);
            publishError(ErrorCode.RECONNECT_EXHAUSTED.code(), "Reconnection attempts exhausted", true);
            publishStatus();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the session for good. With {@code logout} set a connected client is logged out first.
     */
    public void shutdown(boolean logout) {
        lock.lock();
        try {
            generation++;
            discardClient(logout && status == SessionStatus.CONNECTED);
            lastQr = null;
            terminal = true;
            if (status != SessionStatus.CLOSED) {
                transition(SessionStatus.CLOSED);
                publishStatus();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws NotConnectedException unless the session is {@code connected}
     */
    public CompletableFuture<Void> sendText(String targetJid, String text) {
        return connectedClient().send(targetJid, MessageContent.text(text));
    }

    /**
     * @throws NotConnectedException unless the session is {@code connected}
     */
    public CompletableFuture<Void> react(MessageKey target, String emoji) {
        return connectedClient().react(target, emoji);
    }

    /**
     * Live sessions are reused by start; a closed or terminally failed one is replaced.
     */
    public boolean isLive() {
        lock.lock();
        try {
            return !terminal;
        } finally {
            lock.unlock();
        }
    }

    private ProtocolClient connectedClient() {
        lock.lock();
        try {
            if (status != SessionStatus.CONNECTED || client == null) {
                throw new NotConnectedException("Session " + tenantId + " is " + status.wireName() + ", not connected");
            }
            return client;
        } finally {
            lock.unlock();
        }
    }

    // Everything below runs with the lock held.

    private void handlePairingToken(String token) {
        lastQr = token;
        transition(SessionStatus.QR_PENDING);
        eventBus.publish(GatewayEvent.qr(snapshot, token, clock.instant()));
        publishStatus();
    }

    private void handleOpen(Identity openedAs) {
        identity = openedAs;
        lastQr = null;
        transition(SessionStatus.CONNECTED);
        eventBus.publish(GatewayEvent.connected(snapshot, clock.instant()));
        publishStatus();
        lifecycleListener.onConnected(tenantId);
    }

    private void handleClose(long attempt, DisconnectReason reason, String detail) {
        if (reason.isLogout()) {
            handleLogout(detail);
            return;
        }
        if (status.isAwaitingReconnect()) {
            log.debug("Tenant {}: close ({}) after attempt {} already failed", tenantId, reason, attempt);
            return;
        }
        log.warn("Tenant {} disconnected: {} ({})", tenantId, reason, detail);
        discardClient(false);
        lastQr = null;
        transition(SessionStatus.DISCONNECTED);
        publishStatus();
        lifecycleListener.onUnexpectedDisconnect(tenantId, attempt);
    }

    private void handleLogout(String detail) {
        log.warn("Tenant {} was logged out: {}", tenantId, detail);
        generation++;
        discardClient(false);
        lastQr = null;
        terminal = true;
        transition(SessionStatus.CLOSED);
        publishError(ErrorCode.LOGGED_OUT.code(), "Logged out: " + detail, true);
        publishStatus();
        try {
            credentials.delete();
        } catch (RuntimeException e) {
            log.warn("Tenant {}: could not delete credentials after logout: {}", tenantId, e.getMessage());
        }
        directory.clear(tenantId);
        lifecycleListener.onTerminated(tenantId);
    }

    private void handleFault(long attempt, Throwable fault) {
        if (fault instanceof TerminalLogoutException) {
            handleLogout(fault.getMessage());
            return;
        }
        boolean fatal = fault instanceof ProtocolFaultException protocolFault && protocolFault.isConfigurationFatal();
        if (!fatal && status.isAwaitingReconnect()) {
            log.debug("Tenant {}: fault after attempt {} already failed: {}", tenantId, attempt, fault.getMessage());
            return;
        }
        String code = fault instanceof GatewayException gatewayException
                ? gatewayException.getErrorCode().code()
                : ErrorCode.PROTOCOL_FAULT.code();
        log.error("Tenant {} protocol fault ({}{}): {}", tenantId, code, fatal ? ", fatal" : "", fault.getMessage());

        discardClient(false);
        lastQr = null;
        terminal = fatal;
        if (fatal) {
            generation++;
        }
        transition(SessionStatus.ERROR);
        publishError(code, fault.getMessage(), fatal);
        publishStatus();
        if (fatal) {
            lifecycleListener.onTerminated(tenantId);
        } else {
            lifecycleListener.onUnexpectedDisconnect(tenantId, attempt);
        }
    }

    private void handleMessage(InboundMessage message) {
        if (message.fromMe() || Jids.isStatusBroadcast(message.remoteJid())) {
            log.trace("Tenant {}: skipping message {}", tenantId, message.messageId());
            return;
        }
        EventPayload.MessageIncoming payload = new EventPayload.MessageIncoming(
                message.messageId(),
                message.remoteJid(),
                message.pushName(),
                message.type(),
                message.text(),
                message.hasAttachment(),
                message.timestamp() != null ? message.timestamp() : clock.instant());
        directory.rememberMessage(tenantId, message.key());
        eventBus.publish(GatewayEvent.messageIncoming(snapshot, payload, clock.instant()));
        if (message.hasAttachment() && client != null) {
            mediaCapture.capture(tenantId, client, message, this::snapshot);
        }
    }

    private void transition(SessionStatus next) {
        SessionStatus previous = status;
        status = next;
        lastTransitionAt = clock.instant();
        refreshSnapshot();
        if (previous != next) {
            log.info("Tenant {} session {} -> {}", tenantId, previous.wireName(), next.wireName());
        }
    }

    private void refreshSnapshot() {
        snapshot = new SessionSnapshot(tenantId, status,
                status == SessionStatus.QR_PENDING ? lastQr : null,
                identity, terminal, startedAt, lastTransitionAt);
    }

    private void publishStatus() {
        eventBus.publish(GatewayEvent.status(snapshot, clock.instant()));
    }

    private void publishError(String code, String message, boolean fatal) {
        eventBus.publish(GatewayEvent.error(snapshot, code, message, fatal, clock.instant()));
    }

    private void discardClient(boolean logout) {
        ProtocolClient current = client;
        client = null;
        if (current == null) {
            return;
        }
        if (logout) {
            try {
                current.logout();
            } catch (RuntimeException e) {
                log.warn("Tenant {}: logout failed: {}", tenantId, e.getMessage());
            }
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("Tenant {}: closing protocol client failed: {}", tenantId, e.getMessage());
        }
    }

    /**
     * Routes the signals of one connection attempt into the state machine.
     */
    private final class AttemptListener implements ProtocolListener {

        private final long attempt;

        private AttemptListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onPairingToken(String token) {
            lock.lock();
            try {
                if (isCurrent("pairing token")) {
                    handlePairingToken(token);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onOpen(Identity openedAs) {
            lock.lock();
            try {
                if (isCurrent("open")) {
                    handleOpen(openedAs);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onClose(DisconnectReason reason, String detail) {
            lock.lock();
            try {
                if (isCurrent("close")) {
                    handleClose(attempt, reason, detail);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onMessage(InboundMessage message) {
            lock.lock();
            try {
                if (isCurrent("message") && status == SessionStatus.CONNECTED) {
                    handleMessage(message);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onContacts(List<Contact> contacts) {
            lock.lock();
            try {
                if (isCurrent("contacts")) {
                    directory.upsertContacts(tenantId, contacts);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onChats(List<Chat> chats) {
            lock.lock();
            try {
                if (isCurrent("chats")) {
                    directory.upsertChats(tenantId, chats);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onChatsDeleted(List<String> jids) {
            lock.lock();
            try {
                if (isCurrent("chats deleted")) {
                    directory.removeChats(tenantId, jids);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onFault(Throwable fault) {
            lock.lock();
            try {
                if (isCurrent("fault")) {
                    handleFault(attempt, fault);
                }
            } finally {
                lock.unlock();
            }
        }

        private boolean isCurrent(String signal) {
            if (attempt != generation || terminal) {
                log.debug("Tenant {}: ignoring {} from stale attempt {} (current {})", tenantId, signal, attempt, generation);
                return false;
            }
            return true;
        }
    }
}
