package com.example.gateway.session.reconnect;

import com.example.gateway.shared.config.MonitoringConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectionSupervisorTest {

    private static final Duration DELAY = Duration.ofMillis(1500);

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final VirtualTimeScheduler timer = VirtualTimeScheduler.create();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger exhausted = new AtomicInteger();

    @AfterEach
    void tearDown() {
        timer.dispose();
    }

    @Test
    void firesOnceAfterTheDelay() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        assertThat(supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet)).isTrue();
        timer.advanceTimeBy(DELAY.minusMillis(1));
        assertThat(attempts).hasValue(0);
        assertThat(supervisor.isPending("t1")).isTrue();

        timer.advanceTimeBy(Duration.ofMillis(1));
        assertThat(attempts).hasValue(1);
        assertThat(supervisor.isPending("t1")).isFalse();

        timer.advanceTimeBy(DELAY.multipliedBy(10));
        assertThat(attempts).hasValue(1);
    }

    @Test
    void secondRequestWhilePendingIsDropped() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        assertThat(supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet)).isFalse();
        timer.advanceTimeBy(DELAY.multipliedBy(2));

        assertThat(attempts).hasValue(1);
        assertThat(meterRegistry.counter("gateway.reconnect", "outcome", "dropped").count()).isEqualTo(1.0);
    }

    @Test
    void cancelledAttemptNeverRuns() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        supervisor.cancel("t1");
        timer.advanceTimeBy(DELAY.multipliedBy(2));

        assertThat(attempts).hasValue(0);
        assertThat(supervisor.isPending("t1")).isFalse();
    }

    @Test
    void tenantsAreScheduledIndependently() {
        ReconnectionSupervisor supervisor = supervisor(-1);
        AtomicInteger other = new AtomicInteger();

        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        supervisor.schedule("t2", other::incrementAndGet, exhausted::incrementAndGet);
        supervisor.cancel("t1");
        timer.advanceTimeBy(DELAY);

        assertThat(attempts).hasValue(0);
        assertThat(other).hasValue(1);
    }

    @Test
    void givesUpWhenThePolicySaysSo() {
        ReconnectionSupervisor supervisor = supervisor(2);

        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);
        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);
        boolean third = supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);

        assertThat(third).isFalse();
        assertThat(attempts).hasValue(2);
        assertThat(exhausted).hasValue(1);
        assertThat(supervisor.attemptCount("t1")).isZero();
    }

    @Test
    void successfulConnectionResetsTheAttemptCount() {
        ReconnectionSupervisor supervisor = supervisor(1);

        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);
        supervisor.onConnected("t1");
        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);

        assertThat(attempts).hasValue(2);
        assertThat(exhausted).hasValue(0);
    }

    @Test
    void failingAttemptDoesNotBreakLaterOnes() {
        ReconnectionSupervisor supervisor = supervisor(-1);

        supervisor.schedule("t1", () -> {
            throw new IllegalStateException("boom");
        }, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);
        supervisor.schedule("t1", attempts::incrementAndGet, exhausted::incrementAndGet);
        timer.advanceTimeBy(DELAY);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void fixedDelayPolicyHonoursTheCap() {
        assertThat(new FixedDelayReconnectPolicy(DELAY, -1).nextDelay(1_000)).contains(DELAY);
        assertThat(new FixedDelayReconnectPolicy(DELAY, 3).nextDelay(3)).contains(DELAY);
        assertThat(new FixedDelayReconnectPolicy(DELAY, 3).nextDelay(4)).isEmpty();
        assertThat(new FixedDelayReconnectPolicy(DELAY, 0).nextDelay(1)).isEmpty();
    }

    private ReconnectionSupervisor supervisor(int maxAttempts) {
        return new ReconnectionSupervisor(new FixedDelayReconnectPolicy(DELAY, maxAttempts), timer,
                Schedulers.immediate(), new MonitoringConfig.GatewayMetricsCollector(meterRegistry));
    }
}
