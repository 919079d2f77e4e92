package com.example.gateway.session.directory;

import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.protocol.Jids;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.config.MonitoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory contacts, chats and recent inbound message keys of every tenant, filled from the
 * signals of the tenant's protocol client.
 *
 * <p>Updates merge into what is already known: a field the network leaves out keeps its previous
 * value. The message index only remembers the most recent keys per tenant, which is what a
 * reaction needs to address its target.</p>
 */
@Component
@Slf4j
public class ContactDirectory {

    private final Map<String, TenantDirectory> directories = new ConcurrentHashMap<>();

    private final int recentMessages;
    private final Clock clock;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;

    @Autowired
    public ContactDirectory(AppProperties appProperties, Clock clock, MonitoringConfig.GatewayMetricsCollector metricsCollector) {
        this(appProperties.getDirectory().getRecentMessages(), clock, metricsCollector);
    }

    ContactDirectory(int recentMessages, Clock clock, MonitoringConfig.GatewayMetricsCollector metricsCollector) {
        if (recentMessages <= 0) {
            throw new IllegalArgumentException("recentMessages must be positive: " + recentMessages);
        }
        this.recentMessages = recentMessages;
        this.clock = clock;
        this.metricsCollector = metricsCollector;
    }

    public void upsertContacts(String tenantId, List<Contact> contacts) {
        TenantDirectory directory = directory(tenantId);
        int applied = 0;
        synchronized (directory) {
            for (Contact contact : contacts) {
                if (contact == null || isBlank(contact.jid())) {
                    continue;
                }
                directory.contacts.merge(contact.jid(), resolve(contact, null), (previous, ignored) -> resolve(previous, contact));
                applied++;
            }
        }
        metricsCollector.incrementCounter("gateway.directory.upserts", "kind", "contacts");
        log.debug("Tenant {}: {} contact(s) upserted", tenantId, applied);
    }

    public void upsertChats(String tenantId, List<Chat> chats) {
        TenantDirectory directory = directory(tenantId);
        int applied = 0;
        synchronized (directory) {
            for (Chat chat : chats) {
                if (chat == null || isBlank(chat.jid()) || Jids.isStatusBroadcast(chat.jid())) {
                    continue;
                }
                Chat previous = directory.chats.get(chat.jid());
                Contact contact = directory.contacts.get(chat.jid());
                String name = firstNonNull(chat.name(),
                        previous != null ? previous.name() : null,
                        contact != null ? contact.name() : null);
                int unread = chat.unreadCount() != null
                        ? chat.unreadCount()
                        : previous != null ? previous.unreadCount() : 0;
                Instant lastMessageAt = chat.lastMessageAt() != null
                        ? chat.lastMessageAt()
                        : previous != null ? previous.lastMessageAt() : clock.instant();
                directory.chats.put(chat.jid(), new Chat(chat.jid(), name, unread, lastMessageAt));
                applied++;
            }
        }
        metricsCollector.incrementCounter("gateway.directory.upserts", "kind", "chats");
        log.debug("Tenant {}: {} chat(s) upserted", tenantId, applied);
    }

    public void removeChats(String tenantId, List<String> jids) {
        TenantDirectory directory = directory(tenantId);
        synchronized (directory) {
            jids.forEach(directory.chats::remove);
        }
    }

    /**
     * Remembers an inbound message so it can be reacted to later.
     */
    public void rememberMessage(String tenantId, MessageKey key) {
        TenantDirectory directory = directory(tenantId);
        synchronized (directory) {
            directory.messages.put(indexKey(key.remoteJid(), key.messageId()), key);
        }
    }

    public Optional<MessageKey> findMessage(String tenantId, String jid, String messageId) {
        TenantDirectory directory = directories.get(tenantId);
        if (directory == null) {
            return Optional.empty();
        }
        synchronized (directory) {
            return Optional.ofNullable(directory.messages.get(indexKey(jid, messageId)));
        }
    }

    /**
     * Contacts whose name contains {@code query} (case-insensitive) or whose JID contains it.
     * A blank query returns every contact.
     */
    public List<Contact> contacts(String tenantId, String query) {
        TenantDirectory directory = directories.get(tenantId);
        if (directory == null) {
            return List.of();
        }
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        synchronized (directory) {
            return directory.contacts.values().stream()
                    .filter(contact -> needle.isEmpty()
                            || (contact.name() != null && contact.name().toLowerCase(Locale.ROOT).contains(needle))
                            || contact.jid().contains(needle))
                    .toList();
        }
    }

    /**
     * Most recently active first.
     */
    public List<Chat> chats(String tenantId) {
        TenantDirectory directory = directories.get(tenantId);
        if (directory == null) {
            return List.of();
        }
        synchronized (directory) {
            return directory.chats.values().stream()
                    .sorted(Comparator.comparing(Chat::lastMessageAt, Comparator.nullsLast(Comparator.reverseOrder())))
                    .toList();
        }
    }

    /**
     * Forgets everything about the tenant, e.g. once its account is unlinked.
     */
    public void clear(String tenantId) {
        if (directories.remove(tenantId) != null) {
            log.info("Directory of tenant {} cleared", tenantId);
        }
    }

    private TenantDirectory directory(String tenantId) {
        return directories.computeIfAbsent(tenantId, k -> new TenantDirectory(recentMessages));
    }

    private static Contact resolve(Contact previous, Contact update) {
        if (update == null) {
            String name = firstNonNull(previous.name(), previous.notify(), previous.verifiedName());
            return new Contact(previous.jid(), name, previous.notify(), previous.verifiedName(), previous.business());
        }
        String notify = firstNonNull(update.notify(), previous.notify());
        String verifiedName = firstNonNull(update.verifiedName(), previous.verifiedName());
        String name = firstNonNull(update.name(), previous.name(), notify, verifiedName);
        return new Contact(previous.jid(), name, notify, verifiedName, update.business());
    }

    private static String indexKey(String jid, String messageId) {
        return jid + '/' + messageId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static final class TenantDirectory {
        private final Map<String, Contact> contacts = new LinkedHashMap<>();
        private final Map<String, Chat> chats = new LinkedHashMap<>();
        private final LinkedHashMap<String, MessageKey> messages;

        private TenantDirectory(int capacity) {
            this.messages = new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, MessageKey> eldest) {
                    return size() > capacity;
                }
            };
        }
    }
}
