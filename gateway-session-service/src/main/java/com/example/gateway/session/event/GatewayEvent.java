package com.example.gateway.session.event;

import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.model.SessionStatus;

import java.time.Instant;

/**
 * One lifecycle or message event for a tenant. {@code status} and {@code identity} describe the
 * session at emission time; {@code payload} type is fixed by {@code kind}.
 */
public record GatewayEvent(
        EventKind kind,
        String tenantId,
        SessionStatus status,
        Identity identity,
        EventPayload payload,
        Instant timestamp) {

    public static GatewayEvent status(SessionSnapshot session, Instant timestamp) {
        return of(EventKind.STATUS, session,
                new EventPayload.Status(session.status(), session.qr(), session.identity(), session.terminal()),
                timestamp);
    }

    public static GatewayEvent qr(SessionSnapshot session, String token, Instant timestamp) {
        return of(EventKind.QR, session, new EventPayload.Qr(token), timestamp);
    }

    public static GatewayEvent connected(SessionSnapshot session, Instant timestamp) {
        Identity identity = session.identity();
        return of(EventKind.CONNECTED, session,
                new EventPayload.Connected(identity == null ? null : identity.networkId(),
                        identity == null ? null : identity.displayPhone()),
                timestamp);
    }

    public static GatewayEvent messageIncoming(SessionSnapshot session, EventPayload.MessageIncoming payload, Instant timestamp) {
        return of(EventKind.MESSAGE_INCOMING, session, payload, timestamp);
    }

    public static GatewayEvent media(SessionSnapshot session, EventPayload.Media payload, Instant timestamp) {
        return of(EventKind.MEDIA, session, payload, timestamp);
    }

    public static GatewayEvent error(SessionSnapshot session, String code, String message, boolean terminal, Instant timestamp) {
        return of(EventKind.ERROR, session, new EventPayload.Error(code, message, terminal), timestamp);
    }

    private static GatewayEvent of(EventKind kind, SessionSnapshot session, EventPayload payload, Instant timestamp) {
        return new GatewayEvent(kind, session.id(), session.status(), session.identity(), payload, timestamp);
    }
}
