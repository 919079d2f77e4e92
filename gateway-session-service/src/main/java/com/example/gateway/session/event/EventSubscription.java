package com.example.gateway.session.event;

@FunctionalInterface
public interface EventSubscription {

    /**
     * Stops delivery. Idempotent.
     */
    void cancel();
}
