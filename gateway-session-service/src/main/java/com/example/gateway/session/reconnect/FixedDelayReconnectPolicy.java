package com.example.gateway.session.reconnect;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Same delay before every attempt. A negative {@code maxAttempts} never gives up.
 */
public class FixedDelayReconnectPolicy implements ReconnectPolicy {

    private final Duration delay;
    private final int maxAttempts;

    public FixedDelayReconnectPolicy(Duration delay, int maxAttempts) {
        this.delay = Objects.requireNonNull(delay, "delay");
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Optional<Duration> nextDelay(int attempt) {
        if (maxAttempts >= 0 && attempt > maxAttempts) {
            return Optional.empty();
        }
        return Optional.of(delay);
    }

    @Override
    public String toString() {
        return "FixedDelayReconnectPolicy[delay=" + delay + ", maxAttempts=" + (maxAttempts < 0 ? "unlimited" : maxAttempts) + "]";
    }
}
