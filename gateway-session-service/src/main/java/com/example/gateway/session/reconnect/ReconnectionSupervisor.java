package com.example.gateway.session.reconnect;

import com.example.gateway.shared.config.MonitoringConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Schedules delayed reconnection attempts, at most one pending per tenant.
 *
 * <p>A request for a tenant that already has an attempt pending is dropped. The attempt itself
 * runs on the I/O scheduler and is expected to check that the session it was scheduled for is
 * still the current one.</p>
 */
@Component
@Slf4j
public class ReconnectionSupervisor {

    private final Map<String, PendingAttempt> pending = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    private final ReconnectPolicy policy;
    private final Scheduler timerScheduler;
    private final Scheduler ioScheduler;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;

    public ReconnectionSupervisor(ReconnectPolicy policy,
                                  @Qualifier("gatewayTimerScheduler") Scheduler timerScheduler,
                                  @Qualifier("gatewayIoScheduler") Scheduler ioScheduler,
                                  MonitoringConfig.GatewayMetricsCollector metricsCollector) {
        this.policy = policy;
        this.timerScheduler = timerScheduler;
        this.ioScheduler = ioScheduler;
        this.metricsCollector = metricsCollector;
        log.info("Reconnection supervisor using {}", policy);
    }

    /**
     * @param attempt     the reconnection to run after the delay
     * @param onExhausted run instead when the policy gives up
     * @return true when an attempt was scheduled
     */
    public boolean schedule(String tenantId, Runnable attempt, Runnable onExhausted) {
        PendingAttempt entry = new PendingAttempt();
        if (pending.putIfAbsent(tenantId, entry) != null) {
            metricsCollector.incrementCounter("gateway.reconnect", "outcome", "dropped");
            log.debug("Reconnect already pending for tenant {}, request dropped", tenantId);
            return false;
        }

        int number = attempts.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
        Optional<Duration> delay = policy.nextDelay(number);
        if (delay.isEmpty()) {
            pending.remove(tenantId, entry);
            attempts.remove(tenantId);
            metricsCollector.incrementCounter("gateway.reconnect", "outcome", "exhausted");
            log.warn("Giving up reconnecting tenant {} after {} attempts", tenantId, number - 1);
            runSafely(tenantId, onExhausted);
            return false;
        }

        log.info("Reconnecting tenant {} in {}ms (attempt {})", tenantId, delay.get().toMillis(), number);
        metricsCollector.incrementCounter("gateway.reconnect", "outcome", "scheduled");
        Disposable timer = Mono.delay(delay.get(), timerScheduler)
                .publishOn(ioScheduler)
                .subscribe(tick -> {
                    if (pending.remove(tenantId, entry)) {
                        runSafely(tenantId, attempt);
                    }
                });
        entry.timer.update(timer);
        return true;
    }

    /**
     * Cancels the pending attempt, if any, and forgets the attempt count.
     */
    public void cancel(String tenantId) {
        attempts.remove(tenantId);
        PendingAttempt entry = pending.remove(tenantId);
        if (entry != null) {
            entry.timer.dispose();
            log.debug("Pending reconnect cancelled for tenant {}", tenantId);
        }
    }

    /**
     * A successful connection restarts the attempt count.
     */
    public void onConnected(String tenantId) {
        attempts.remove(tenantId);
    }

    public boolean isPending(String tenantId) {
        return pending.containsKey(tenantId);
    }

    public int attemptCount(String tenantId) {
        AtomicInteger count = attempts.get(tenantId);
        return count == null ? 0 : count.get();
    }

    @PreDestroy
    public void shutdown() {
        pending.values().forEach(entry -> entry.timer.dispose());
        pending.clear();
        attempts.clear();
    }

    private void runSafely(String tenantId, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Reconnect task for tenant {} failed: {}", tenantId, e.getMessage(), e);
        }
    }

    private static final class PendingAttempt {
        private final Disposable.Swap timer = Disposables.swap();
    }
}
