package com.example.gateway.session.event;

import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.webhook.WebhookDispatcher;
import com.example.gateway.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tenant publish/subscribe channel.
 *
 * <p>Each tenant has its own channel lock. Publishing and (un)subscribing for a tenant happen
 * under that lock, which gives every subscriber the tenant's events in publish order and makes
 * the status replay on subscribe precede any later event. Tenants never contend with each
 * other.</p>
 *
 * <p>The latest {@code status} event of every tenant is retained and replayed to new
 * subscribers; nothing else is buffered.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventBus {

    private final Map<String, TenantChannel> channels = new ConcurrentHashMap<>();

    private final WebhookDispatcher webhookDispatcher;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;
    private final Clock clock;

    public void publish(GatewayEvent event) {
        TenantChannel channel = channel(event.tenantId());
        synchronized (channel) {
            if (event.kind() == EventKind.STATUS) {
                channel.lastStatus = event;
            }
            for (EventSubscriber subscriber : channel.subscribers.values()) {
                deliver(subscriber, event);
            }
        }
        metricsCollector.incrementCounter("gateway.events.published", "kind", event.kind().wireName());
        // off the critical path: the dispatcher only schedules the POST
        try {
            webhookDispatcher.deliver(event);
        } catch (RuntimeException e) {
            log.warn("Webhook dispatch of {} event for tenant {} failed: {}",
                    event.kind().wireName(), event.tenantId(), e.toString());
        }
    }

    /**
     * Registers {@code subscriber} and, before returning, hands it the tenant's current status.
     */
    public EventSubscription subscribe(String tenantId, EventSubscriber subscriber) {
        TenantChannel channel = channel(tenantId);
        synchronized (channel) {
            channel.subscribers.put(subscriber.id(), subscriber);
            GatewayEvent replay = channel.lastStatus != null
                    ? channel.lastStatus
                    : GatewayEvent.status(SessionSnapshot.absent(tenantId, clock.instant()), clock.instant());
            deliver(subscriber, replay);
        }
        log.debug("Subscriber {} registered for tenant {}", subscriber.id(), tenantId);
        return () -> unsubscribe(tenantId, subscriber.id());
    }

    public int subscriberCount(String tenantId) {
        TenantChannel channel = channels.get(tenantId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers.size();
        }
    }

    private void unsubscribe(String tenantId, String subscriberId) {
        TenantChannel channel = channels.get(tenantId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            if (channel.subscribers.remove(subscriberId) != null) {
                log.debug("Subscriber {} removed from tenant {}", subscriberId, tenantId);
            }
        }
    }

    private void deliver(EventSubscriber subscriber, GatewayEvent event) {
        try {
            subscriber.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber {} failed to take {} event for tenant {}: {}",
                    subscriber.id(), event.kind().wireName(), event.tenantId(), e.getMessage());
        }
    }

    private TenantChannel channel(String tenantId) {
        return channels.computeIfAbsent(tenantId, k -> new TenantChannel());
    }

    private static final class TenantChannel {
        private final Map<String, EventSubscriber> subscribers = new LinkedHashMap<>();
        private GatewayEvent lastStatus;
    }
}
