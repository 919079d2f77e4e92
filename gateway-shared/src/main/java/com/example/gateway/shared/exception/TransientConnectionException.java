package com.example.gateway.shared.exception;

/**
 * Network-level loss of a protocol connection. Raised by protocol clients and handled
 * by reconnection; it is never surfaced to an HTTP caller.
 */
public class TransientConnectionException extends GatewayException {

    public TransientConnectionException(String message) {
        super(ErrorCode.TRANSIENT_CONNECTION, message);
    }

    public TransientConnectionException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_CONNECTION, message, cause);
    }
}
