package com.example.gateway.session.protocol;

import java.util.Arrays;

/**
 * Why the network closed a connection. Codes follow the status codes the messaging
 * network reports on close.
 */
public enum DisconnectReason {
    CONNECTION_CLOSED(428),
    CONNECTION_LOST(408),
    CONNECTION_REPLACED(440),
    LOGGED_OUT(401),
    BAD_SESSION(500),
    RESTART_REQUIRED(515),
    MULTIDEVICE_MISMATCH(411),
    FORBIDDEN(403),
    UNAVAILABLE_SERVICE(503),
    UNKNOWN(-1);

    private final int code;

    DisconnectReason(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Only an explicit logout ends a session; every other close is retried.
     */
    public boolean isLogout() {
        return this == LOGGED_OUT;
    }

    public static DisconnectReason fromCode(int code) {
        return Arrays.stream(values())
                .filter(reason -> reason.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
