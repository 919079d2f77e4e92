package com.example.gateway.session.webhook;

import com.example.gateway.session.event.EventKind;

import java.util.Set;

/**
 * @param secret sent as {@code x-webhook-secret} when present
 * @param events kinds to forward; empty forwards everything
 */
public record WebhookConfig(String url, String secret, Set<EventKind> events) {

    public WebhookConfig {
        events = events == null ? Set.of() : Set.copyOf(events);
    }

    public boolean accepts(EventKind kind) {
        return events.isEmpty() || events.contains(kind);
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    @Override
    public String toString() {
        return "WebhookConfig[url=" + url + ", secret=" + (hasSecret() ? "***" : "none") + ", events=" + events + "]";
    }
}
