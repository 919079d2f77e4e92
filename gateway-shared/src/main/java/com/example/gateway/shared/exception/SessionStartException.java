package com.example.gateway.shared.exception;

public class SessionStartException extends GatewayException {

    public SessionStartException(String message) {
        super(ErrorCode.CONNECT_FAILED, message);
    }

    public SessionStartException(String message, Throwable cause) {
        super(ErrorCode.CONNECT_FAILED, message, cause);
    }
}
