package com.example.gateway.shared.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes. {@link #code()} is what clients and webhook consumers see;
 * {@link #status()} is only meaningful for request-scoped failures.
 */
public enum ErrorCode {

    AUTH_NOT_CONFIGURED("auth_not_configured", HttpStatus.FORBIDDEN),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    NOT_CONNECTED("not_connected", HttpStatus.CONFLICT),
    SESSION_BUSY("session_busy", HttpStatus.CONFLICT),
    CONNECT_FAILED("connect_failed", HttpStatus.INTERNAL_SERVER_ERROR),
    SEND_FAILED("send_failed", HttpStatus.INTERNAL_SERVER_ERROR),
    MEDIA_EXPIRED("media_expired", HttpStatus.NOT_FOUND),
    MESSAGE_NOT_FOUND("message_not_found", HttpStatus.NOT_FOUND),
    RATE_LIMITED("rate_limited", HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR),

    // Session-internal, reported through events and status only.
    TRANSIENT_CONNECTION("transient_connection", HttpStatus.SERVICE_UNAVAILABLE),
    LOGGED_OUT("logged_out", HttpStatus.CONFLICT),
    PROTOCOL_FAULT("protocol_fault", HttpStatus.INTERNAL_SERVER_ERROR),
    CONFIGURATION_FATAL("configuration_fatal", HttpStatus.INTERNAL_SERVER_ERROR),
    RECONNECT_EXHAUSTED("reconnect_exhausted", HttpStatus.SERVICE_UNAVAILABLE),
    MEDIA_DOWNLOAD_FAILED("media_download_failed", HttpStatus.BAD_GATEWAY),
    MEDIA_TOO_LARGE("media_too_large", HttpStatus.PAYLOAD_TOO_LARGE),
    WEBHOOK_DELIVERY_FAILED("webhook_delivery_failed", HttpStatus.BAD_GATEWAY);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
