package com.example.gateway.shared.exception;

import lombok.Getter;

/**
 * Base for every failure the gateway names. Carries the stable {@link ErrorCode}
 * that the HTTP boundary and the event stream report.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
