package com.example.gateway.shared.exception;

/** A send was attempted while the session is not {@code connected}. */
public class NotConnectedException extends GatewayException {

    public NotConnectedException(String message) {
        super(ErrorCode.NOT_CONNECTED, message);
    }
}
