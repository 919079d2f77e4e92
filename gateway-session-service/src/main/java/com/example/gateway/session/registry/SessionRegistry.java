package com.example.gateway.session.registry;

import com.example.gateway.session.connection.ConnectionLifecycleListener;
import com.example.gateway.session.connection.ConnectionStateMachine;
import com.example.gateway.session.credentials.CredentialStore;
import com.example.gateway.session.directory.ContactDirectory;
import com.example.gateway.session.dto.SessionStartRequest;
import com.example.gateway.session.event.EventBus;
import com.example.gateway.session.event.EventKind;
import com.example.gateway.session.media.MediaCaptureService;
import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.protocol.Jids;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.session.protocol.ProtocolClientFactory;
import com.example.gateway.session.reconnect.ReconnectionSupervisor;
import com.example.gateway.session.sse.StreamingSubscriberManager;
import com.example.gateway.session.webhook.WebhookRegistry;
import com.example.gateway.shared.aspect.Monitored;
import com.example.gateway.shared.exception.MessageNotFoundException;
import com.example.gateway.shared.exception.MessageSendException;
import com.example.gateway.shared.exception.NotConnectedException;
import com.example.gateway.shared.exception.SessionBusyException;
import com.example.gateway.shared.exception.SessionStartException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns the session of every tenant.
 *
 * <p>Start, reset and stop for one tenant run under that tenant's lock, the same lock its
 * {@link ConnectionStateMachine} uses for protocol signals. Different tenants never share a
 * lock. Reads ({@link #status}, {@link #list}) take no lock at all.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("service")
public class SessionRegistry {

    private final Map<String, TenantSlot> slots = new ConcurrentHashMap<>();

    private final ProtocolClientFactory clientFactory;
    private final CredentialStore credentialStore;
    private final EventBus eventBus;
    private final MediaCaptureService mediaCaptureService;
    private final ContactDirectory contactDirectory;
    private final ReconnectionSupervisor reconnectionSupervisor;
    private final WebhookRegistry webhookRegistry;
    private final StreamingSubscriberManager subscriberManager;
    private final Clock clock;

    /**
     * Returns the live session unchanged, or creates one and starts connecting. Webhook settings
     * in {@code request} are applied either way.
     *
     * @throws SessionStartException if the protocol client could not begin connecting
     */
    public SessionSnapshot start(String tenantId, SessionStartRequest request) {
        TenantSlot slot = slot(tenantId);
        slot.lock.lock();
        try {
            applyWebhook(tenantId, request);
            return startLocked(slot);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Logs out and closes the current session, deletes the stored credentials and starts over,
     * which normally leads to a new pairing token.
     *
     * @throws SessionBusyException if a reset or stop for the tenant is already running
     */
    public SessionSnapshot reset(String tenantId) {
        TenantSlot slot = slot(tenantId);
        beginTeardown(slot);
        try {
            slot.lock.lock();
            try {
                log.info("Resetting session for tenant {}", tenantId);
                reconnectionSupervisor.cancel(tenantId);
                if (slot.machine != null) {
                    slot.machine.shutdown(true);
                    slot.machine = null;
                }
                credentialStore.delete(tenantId);
                contactDirectory.clear(tenantId);
                return startLocked(slot);
            } finally {
                slot.lock.unlock();
            }
        } finally {
            slot.teardownInFlight.set(false);
        }
    }

    /**
     * Closes the session, logging out first when connected. Unknown tenants are not an error.
     *
     * @param erase also delete the stored credentials
     * @throws SessionBusyException if a reset or stop for the tenant is already running
     */
    public void stop(String tenantId, boolean erase) {
        TenantSlot slot = slots.get(tenantId);
        if (slot == null) {
            if (erase) {
                credentialStore.delete(tenantId);
                contactDirectory.clear(tenantId);
            }
            log.debug("Stop for tenant {} without a session", tenantId);
            return;
        }
        beginTeardown(slot);
        try {
            slot.lock.lock();
            try {
                log.info("Stopping session for tenant {} (erase={})", tenantId, erase);
                reconnectionSupervisor.cancel(tenantId);
                if (slot.machine != null) {
                    slot.machine.shutdown(true);
                }
                if (erase) {
                    credentialStore.delete(tenantId);
                    contactDirectory.clear(tenantId);
                }
            } finally {
                slot.lock.unlock();
            }
        } finally {
            slot.teardownInFlight.set(false);
        }
        subscriberManager.closeTenant(tenantId);
    }

    public SessionSnapshot status(String tenantId) {
        ConnectionStateMachine machine = currentMachine(tenantId);
        return machine != null ? machine.snapshot() : SessionSnapshot.absent(tenantId, clock.instant());
    }

    public List<SessionSnapshot> list() {
        return slots.values().stream()
                .map(slot -> slot.machine)
                .filter(Objects::nonNull)
                .map(ConnectionStateMachine::snapshot)
                .sorted(Comparator.comparing(SessionSnapshot::id))
                .toList();
    }

    /**
     * @return completes with the JID the text was sent to
     * @throws NotConnectedException unless the session is connected
     */
    public CompletableFuture<String> sendText(String tenantId, String to, String text) {
        String jid = Jids.normalize(to);
        ConnectionStateMachine machine = currentMachine(tenantId);
        if (machine == null) {
            throw new NotConnectedException("No session for tenant " + tenantId);
        }
        return machine.sendText(jid, text)
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        log.warn("Tenant {} failed to send text to {}: {}", tenantId, jid, cause.getMessage());
                        throw new MessageSendException("Failed to send message to " + jid, cause);
                    }
                    log.debug("Tenant {} sent text to {}", tenantId, jid);
                    return jid;
                });
    }

    /**
     * Reacts to a recently received message of the chat {@code to}.
     *
     * @return completes with the JID of the chat
     * @throws NotConnectedException    unless the session is connected
     * @throws MessageNotFoundException if the message is not among the recent ones
     */
    public CompletableFuture<String> react(String tenantId, String to, String messageId, String emoji) {
        String jid = Jids.normalize(to);
        ConnectionStateMachine machine = currentMachine(tenantId);
        if (machine == null) {
            throw new NotConnectedException("No session for tenant " + tenantId);
        }
        MessageKey target = contactDirectory.findMessage(tenantId, jid, messageId)
                .orElseThrow(() -> new MessageNotFoundException("Message " + messageId + " not found in chat " + jid));
        return machine.react(target, emoji)
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        log.warn("Tenant {} failed to react to {} in {}: {}", tenantId, messageId, jid, cause.getMessage());
                        throw new MessageSendException("Failed to react to message " + messageId, cause);
                    }
                    log.debug("Tenant {} reacted to {} in {}", tenantId, messageId, jid);
                    return jid;
                });
    }

    public List<Contact> contacts(String tenantId, String query) {
        return contactDirectory.contacts(tenantId, query);
    }

    public List<Chat> chats(String tenantId) {
        return contactDirectory.chats(tenantId);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }


    /**
     * Closes every session without logging out, so they resume from their credentials on the
     * next start.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Closing {} session(s)", slots.size());
        for (Map.Entry<String, TenantSlot> entry : slots.entrySet()) {
            TenantSlot slot = entry.getValue();
            reconnectionSupervisor.cancel(entry.getKey());
            slot.lock.lock();
            try {
                if (slot.machine != null) {
                    slot.machine.shutdown(false);
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    private SessionSnapshot startLocked(TenantSlot slot) {
        ConnectionStateMachine existing = slot.machine;
        if (existing != null && existing.isLive()) {
            log.debug("Session for tenant {} already live ({})", slot.tenantId, existing.snapshot().status().wireName());
            return existing.snapshot();
        }
        reconnectionSupervisor.cancel(slot.tenantId);
        ConnectionStateMachine machine = new ConnectionStateMachine(
                slot.tenantId,
                slot.lock,
                clientFactory,
                credentialStore.forTenant(slot.tenantId),
                eventBus,
                mediaCaptureService,
                contactDirectory,
                new SupervisedLifecycle(slot),
                clock);
        slot.machine = machine;
        log.info("Starting session for tenant {}", slot.tenantId);
        machine.announce();
        machine.connect();
        return machine.snapshot();
    }

    private void applyWebhook(String tenantId, SessionStartRequest request) {
        if (request == null) {
            return;
        }
        Set<EventKind> events = request.getWebhookEvents() == null
                ? Set.of()
                : request.getWebhookEvents().stream()
                        .map(EventKind::fromWireName)
                        .collect(Collectors.toSet());
        webhookRegistry.update(tenantId, request.getWebhookUrl(), request.getWebhookSecret(), events);
    }

    private void beginTeardown(TenantSlot slot) {
        if (!slot.teardownInFlight.compareAndSet(false, true)) {
            throw new SessionBusyException("A reset or stop is already in progress for tenant " + slot.tenantId);
        }
    }

    private ConnectionStateMachine currentMachine(String tenantId) {
        TenantSlot slot = slots.get(tenantId);
        return slot == null ? null : slot.machine;
    }

    private TenantSlot slot(String tenantId) {
        return slots.computeIfAbsent(tenantId, TenantSlot::new);
    }

    /**
     * Reconnects run under the tenant lock and only against the machine that asked for them.
     */
    private void reconnect(TenantSlot slot, ConnectionStateMachine machine, long attempt) {
        slot.lock.lock();
        try {
            if (slot.machine != machine) {
                log.debug("Tenant {}: reconnect for a replaced session dropped", slot.tenantId);
                return;
            }
            machine.reconnect(attempt);
        } catch (SessionStartException e) {
            // the machine has already moved to error and asked for the next attempt
            log.warn("Tenant {}: reconnect attempt failed: {}", slot.tenantId, e.getMessage());
        } finally {
            slot.lock.unlock();
        }
    }

    private void exhaust(TenantSlot slot, ConnectionStateMachine machine, long attempt) {
        slot.lock.lock();
        try {
            if (slot.machine == machine) {
                machine.markExhausted(attempt);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private final class SupervisedLifecycle implements ConnectionLifecycleListener {

        private final TenantSlot slot;

        private SupervisedLifecycle(TenantSlot slot) {
            this.slot = slot;
        }

        @Override
        public void onConnected(String tenantId) {
            reconnectionSupervisor.onConnected(tenantId);
        }

        @Override
        public void onUnexpectedDisconnect(String tenantId, long attempt) {
            ConnectionStateMachine machine = slot.machine;
            reconnectionSupervisor.schedule(tenantId,
                    () -> reconnect(slot, machine, attempt),
                    () -> exhaust(slot, machine, attempt));
        }

        @Override
        public void onTerminated(String tenantId) {
            reconnectionSupervisor.cancel(tenantId);
        }
    }

    private static final class TenantSlot {
        private final String tenantId;
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean teardownInFlight = new AtomicBoolean();
        private volatile ConnectionStateMachine machine;

        private TenantSlot(String tenantId) {
            this.tenantId = tenantId;
        }
    }
}
