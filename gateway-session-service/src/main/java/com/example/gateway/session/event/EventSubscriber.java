package com.example.gateway.session.event;

/**
 * Receives the events of one tenant. Called with the tenant's channel lock held, so
 * implementations must hand off instead of blocking.
 */
public interface EventSubscriber {

    String id();

    void onEvent(GatewayEvent event);
}
