package com.example.gateway.session.event;

import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.model.SessionStatus;
import com.example.gateway.session.support.EventRecorder;
import com.example.gateway.session.support.MutableClock;
import com.example.gateway.session.webhook.WebhookDispatcher;
import com.example.gateway.shared.config.MonitoringConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EventBusTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final WebhookDispatcher webhookDispatcher = mock(WebhookDispatcher.class);
    private final EventBus eventBus = new EventBus(webhookDispatcher,
            new MonitoringConfig.GatewayMetricsCollector(new SimpleMeterRegistry()), clock);

    @Test
    void newSubscriberGetsClosedStatusWhenNothingWasPublished() {
        EventRecorder recorder = new EventRecorder("r1");

        eventBus.subscribe("t1", recorder);

        assertThat(recorder.events()).singleElement().satisfies(event -> {
            assertThat(event.kind()).isEqualTo(EventKind.STATUS);
            assertThat(event.status()).isEqualTo(SessionStatus.CLOSED);
            assertThat(event.tenantId()).isEqualTo("t1");
        });
    }

    @Test
    void newSubscriberGetsTheLatestStatusFirst() {
        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.CONNECTING), clock.instant()));
        eventBus.publish(GatewayEvent.qr(snapshot("t1", SessionStatus.QR_PENDING), "token", clock.instant()));
        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.QR_PENDING), clock.instant()));
        EventRecorder recorder = new EventRecorder("r1");

        eventBus.subscribe("t1", recorder);
        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.CONNECTED), clock.instant()));

        assertThat(recorder.statuses()).containsExactly(SessionStatus.QR_PENDING, SessionStatus.CONNECTED);
        assertThat(recorder.events(EventKind.QR)).isEmpty();
    }

    @Test
    void deliversInPublishOrderAndOnlyToTheTenant() {
        EventRecorder first = new EventRecorder("r1");
        EventRecorder other = new EventRecorder("r2");
        eventBus.subscribe("t1", first);
        eventBus.subscribe("t2", other);

        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.PENDING), clock.instant()));
        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.CONNECTING), clock.instant()));
        eventBus.publish(GatewayEvent.connected(snapshot("t1", SessionStatus.CONNECTED), clock.instant()));

        assertThat(first.kinds()).containsExactly(EventKind.STATUS, EventKind.STATUS, EventKind.STATUS, EventKind.CONNECTED);
        assertThat(first.statuses()).containsExactly(SessionStatus.CLOSED, SessionStatus.PENDING, SessionStatus.CONNECTING);
        assertThat(other.events()).hasSize(1);
    }

    @Test
    void cancelledSubscriptionStopsDelivery() {
        EventRecorder recorder = new EventRecorder("r1");
        EventSubscription subscription = eventBus.subscribe("t1", recorder);

        subscription.cancel();
        subscription.cancel();
        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.PENDING), clock.instant()));

        assertThat(recorder.events()).hasSize(1);
        assertThat(eventBus.subscriberCount("t1")).isZero();
    }

    @Test
    void failingSubscriberDoesNotStarveOthers() {
        EventSubscriber broken = new EventSubscriber() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public void onEvent(GatewayEvent event) {
                throw new IllegalStateException("gone");
            }
        };
        EventRecorder recorder = new EventRecorder("r1");
        eventBus.subscribe("t1", broken);
        eventBus.subscribe("t1", recorder);

        eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.PENDING), clock.instant()));

        assertThat(recorder.statuses()).containsExactly(SessionStatus.CLOSED, SessionStatus.PENDING);
    }

    @Test
    void everyPublishedEventGoesToTheWebhookDispatcher() {
        GatewayEvent event = GatewayEvent.status(snapshot("t1", SessionStatus.PENDING), clock.instant());

        eventBus.publish(event);

        verify(webhookDispatcher).deliver(event);
    }

    @Test
    void webhookDispatchFailureDoesNotEscapePublish() {
        doThrow(new IllegalArgumentException("bad webhook url")).when(webhookDispatcher).deliver(any());
        EventRecorder recorder = new EventRecorder("r1");
        eventBus.subscribe("t1", recorder);

        assertThatCode(() -> eventBus.publish(GatewayEvent.status(snapshot("t1", SessionStatus.PENDING), clock.instant())))
                .doesNotThrowAnyException();

        assertThat(recorder.statuses()).containsExactly(SessionStatus.CLOSED, SessionStatus.PENDING);
    }

    @Test
    void replayPrecedesEventsPublishedConcurrently() throws Exception {
        ExecutorService publisher = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        try {
            publisher.submit(() -> {
                started.countDown();
                for (int i = 0; i < 2_000; i++) {
                    eventBus.publish(GatewayEvent.qr(snapshot("t1", SessionStatus.QR_PENDING), "token-" + i, clock.instant()));
                }
            });
            started.await(5, TimeUnit.SECONDS);
            List<List<EventKind>> seen = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 50; i++) {
                EventRecorder recorder = new EventRecorder("r" + i);
                eventBus.subscribe("t1", recorder);
                seen.add(recorder.kinds());
            }
            assertThat(seen).allSatisfy(kinds -> assertThat(kinds.get(0)).isEqualTo(EventKind.STATUS));
        } finally {
            publisher.shutdownNow();
        }
    }

    private SessionSnapshot snapshot(String tenantId, SessionStatus status) {
        Identity identity = status == SessionStatus.CONNECTED ? new Identity("1@s.whatsapp.net", "+1") : null;
        return new SessionSnapshot(tenantId, status, null, identity, false, clock.instant(), clock.instant());
    }
}
