package com.example.gateway.session.event;

import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Kind-specific payloads carried by {@link GatewayEvent}, one record per {@link EventKind}.
 */
public interface EventPayload {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Status(SessionStatus status, String qr, Identity identity, boolean terminal) implements EventPayload {
    }

    record Qr(String qr) implements EventPayload {
    }

    record Connected(String networkId, String displayPhone) implements EventPayload {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MessageIncoming(
            String messageId,
            String from,
            String pushName,
            String type,
            String text,
            boolean hasMedia,
            Instant timestamp) implements EventPayload {
    }

    /**
     * @param url where the captured bytes can be fetched; null when not captured
     * @param error error code when {@code captured} is false
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Media(
            String messageId,
            boolean captured,
            String mime,
            String filename,
            Long size,
            String contentHash,
            String url,
            String error) implements EventPayload {
    }

    record Error(String code, String message, boolean terminal) implements EventPayload {
    }
}
