package com.example.gateway.session.webhook;

import com.example.gateway.session.event.EventKind;
import com.example.gateway.session.event.EventPayload;
import com.example.gateway.session.event.GatewayEvent;
import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body POSTed to tenant webhooks.
 */
public record WebhookEnvelope(
        EventKind event,
        @JsonProperty("session_id") String sessionId,
        SessionStatus status,
        String jid,
        String phone,
        EventPayload payload,
        Instant timestamp) {

    public static WebhookEnvelope from(GatewayEvent event) {
        Identity identity = event.identity();
        return new WebhookEnvelope(
                event.kind(),
                event.tenantId(),
                event.status(),
                identity == null ? null : identity.networkId(),
                identity == null ? null : identity.displayPhone(),
                event.payload(),
                event.timestamp());
    }
}
