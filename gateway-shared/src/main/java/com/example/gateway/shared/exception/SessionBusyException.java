package com.example.gateway.shared.exception;

/** Another reset or stop for the same tenant is still in flight; callers should retry. */
public class SessionBusyException extends GatewayException {

    public SessionBusyException(String message) {
        super(ErrorCode.SESSION_BUSY, message);
    }
}
