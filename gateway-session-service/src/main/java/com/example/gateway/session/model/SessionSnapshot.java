package com.example.gateway.session.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable view of a tenant session at one point in time. Safe to hand out without locking.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
        String id,
        SessionStatus status,
        String qr,
        Identity identity,
        boolean terminal,
        Instant startedAt,
        Instant lastTransitionAt) {

    /**
     * Snapshot reported for a tenant that has no session.
     */
    public static SessionSnapshot absent(String tenantId, Instant now) {
        return new SessionSnapshot(tenantId, SessionStatus.CLOSED, null, null, true, null, now);
    }
}
