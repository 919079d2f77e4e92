package com.example.gateway.session.sse;

import com.example.gateway.session.event.EventBus;
import com.example.gateway.session.event.EventSubscriber;
import com.example.gateway.session.event.EventSubscription;
import com.example.gateway.session.event.GatewayEvent;
import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.config.MonitoringConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the push connections opened on {@code GET /events}.
 *
 * <p>Each connection gets its own sink, bus registration and heartbeat timer. All three are
 * released together when the transport goes away, the tenant's session is stopped or the
 * server shuts down.</p>
 */
@Service
@Slf4j
public class StreamingSubscriberManager {

    private static final Sinks.EmitFailureHandler EMIT_RETRY =
            Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(250));

    private final Map<String, PushSubscriber> subscribers = new ConcurrentHashMap<>();

    private final EventBus eventBus;
    private final SseEventFactory sseEventFactory;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;
    private final Scheduler timerScheduler;
    private final Scheduler ioScheduler;
    private final Clock clock;
    private final Duration heartbeatInterval;

    public StreamingSubscriberManager(EventBus eventBus,
                                      SseEventFactory sseEventFactory,
                                      MonitoringConfig.GatewayMetricsCollector metricsCollector,
                                      @Qualifier("gatewayTimerScheduler") Scheduler timerScheduler,
                                      @Qualifier("gatewayIoScheduler") Scheduler ioScheduler,
                                      Clock clock,
                                      AppProperties appProperties) {
        this.eventBus = eventBus;
        this.sseEventFactory = sseEventFactory;
        this.metricsCollector = metricsCollector;
        this.timerScheduler = timerScheduler;
        this.ioScheduler = ioScheduler;
        this.clock = clock;
        this.heartbeatInterval = Duration.ofMillis(appProperties.getSse().getHeartbeatInterval());
    }

    /**
     * Registration happens on subscription, so the first element is always the tenant's current
     * status.
     */
    public Flux<ServerSentEvent<String>> createEventStream(String tenantId) {
        return Flux.defer(() -> {
            PushSubscriber subscriber = new PushSubscriber(UUID.randomUUID().toString(), tenantId, clock.instant());
            subscribers.put(subscriber.id, subscriber);
            subscriber.subscription = eventBus.subscribe(tenantId, subscriber);
            subscriber.heartbeat = Flux.interval(heartbeatInterval, heartbeatInterval, timerScheduler)
                    .subscribe(tick -> push(subscriber, sseEventFactory.createHeartbeatEvent()));
            updateGauge();
            log.info("Push subscriber {} opened for tenant {}", subscriber.id, tenantId);
            return subscriber.sink.asFlux()
                    .doFinally(signal -> remove(subscriber.id, signal.toString()));
        });
    }

    /**
     * Sends every subscriber of the tenant a {@code closed} event and completes their streams.
     */
    public void closeTenant(String tenantId) {
        ServerSentEvent<String> closed = sseEventFactory.createClosedEvent(tenantId);
        List<PushSubscriber> targets = subscribers.values().stream()
                .filter(subscriber -> subscriber.tenantId.equals(tenantId))
                .toList();
        for (PushSubscriber subscriber : targets) {
            push(subscriber, closed);
            remove(subscriber.id, "tenant closed");
        }
        if (!targets.isEmpty()) {
            log.info("Closed {} push subscriber(s) for tenant {}", targets.size(), tenantId);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public int subscriberCount(String tenantId) {
        return (int) subscribers.values().stream()
                .filter(subscriber -> subscriber.tenantId.equals(tenantId))
                .count();
    }

    @PreDestroy
    public void shutdown() {
        if (subscribers.isEmpty()) {
            return;
        }
        log.info("Notifying {} push subscriber(s) of shutdown", subscribers.size());
        ServerSentEvent<String> notice = sseEventFactory.createShutdownEvent();
        for (PushSubscriber subscriber : List.copyOf(subscribers.values())) {
            push(subscriber, notice);
            remove(subscriber.id, "shutdown");
        }
    }

    /**
     * Emissions can race between the bus publisher and the heartbeat timer. A contended emission
     * spins briefly; the sink is never guarded by a monitor.
     */
    private void push(PushSubscriber subscriber, ServerSentEvent<String> event) {
        if (event == null) {
            return;
        }
        try {
            subscriber.sink.emitNext(event, EMIT_RETRY);
        } catch (Sinks.EmissionException e) {
            log.warn("Failed to emit SSE event to subscriber {} of tenant {}. Result: {}. Cleaning up.",
                    subscriber.id, subscriber.tenantId, e.getReason());
            metricsCollector.incrementCounter("gateway.sse.emit.failed", "result", e.getReason().name());
            ioScheduler.schedule(() -> remove(subscriber.id, "emit failure"));
        }
    }

    /**
     * Detaches from the bus and the heartbeat first, then completes the sink. Completion runs
     * downstream callbacks, so nothing here may still be registered with the bus at that point.
     */
    private void remove(String subscriberId, String cause) {
        PushSubscriber subscriber = subscribers.remove(subscriberId);
        if (subscriber == null) {
            return;
        }
        if (subscriber.heartbeat != null) {
            subscriber.heartbeat.dispose();
        }
        if (subscriber.subscription != null) {
            subscriber.subscription.cancel();
        }
        try {
            subscriber.sink.emitComplete(EMIT_RETRY);
        } catch (Sinks.EmissionException e) {
            log.warn("Could not complete stream of subscriber {} for tenant {}: {}",
                    subscriberId, subscriber.tenantId, e.getReason());
        }
        updateGauge();
        log.info("Push subscriber {} for tenant {} removed ({}), open since {}",
                subscriberId, subscriber.tenantId, cause, subscriber.subscribedAt);
    }

    private void updateGauge() {
        metricsCollector.setGauge("gateway.sse.subscribers", subscribers.size());
    }

    private final class PushSubscriber implements EventSubscriber {
        private final String id;
        private final String tenantId;
        private final Instant subscribedAt;
        private final Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().unicast().onBackpressureBuffer();
        private volatile EventSubscription subscription;
        private volatile Disposable heartbeat;

        private PushSubscriber(String id, String tenantId, Instant subscribedAt) {
            this.id = id;
            this.tenantId = tenantId;
            this.subscribedAt = subscribedAt;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void onEvent(GatewayEvent event) {
            push(this, sseEventFactory.fromGatewayEvent(event));
        }
    }
}
