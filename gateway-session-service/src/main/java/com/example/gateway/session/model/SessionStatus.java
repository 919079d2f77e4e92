package com.example.gateway.session.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connection lifecycle of one tenant session.
 *
 * <pre>
 * pending -> connecting -> {qr_pending <-> connecting} -> connected -> {disconnected -> connecting | closed}
 * </pre>
 * {@code error} is reachable from {@code connecting} and {@code connected}; it is terminal only
 * for configuration faults or once reconnection gives up.
 */
public enum SessionStatus {
    PENDING("pending"),
    CONNECTING("connecting"),
    QR_PENDING("qr_pending"),
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    CLOSED("closed"),
    ERROR("error");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * States a scheduled reconnection may leave.
     */
    public boolean isAwaitingReconnect() {
        return this == DISCONNECTED || this == ERROR;
    }
}
