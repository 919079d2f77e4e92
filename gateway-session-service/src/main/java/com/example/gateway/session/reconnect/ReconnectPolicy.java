package com.example.gateway.session.reconnect;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides how long to wait before a reconnection attempt.
 */
public interface ReconnectPolicy {

    /**
     * @param attempt 1-based number of the attempt about to be scheduled
     * @return the delay, or empty when no further attempts should be made
     */
    Optional<Duration> nextDelay(int attempt);
}
